package tech.clusterops.sdk.transaction;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.clusterops.sdk.dto.CreateIndexParams;
import tech.clusterops.sdk.dto.CreateMacroParams;
import tech.clusterops.sdk.dto.CreateRoleParams;
import tech.clusterops.sdk.dto.CreateUserParams;
import tech.clusterops.sdk.dto.ModifyRoleParams;
import tech.clusterops.sdk.exception.ApiCallException;
import tech.clusterops.sdk.exception.TransactionFailedException;
import tech.clusterops.sdk.exception.TransactionLogException;
import tech.clusterops.sdk.exception.TransactionValidationException;
import tech.clusterops.sdk.metrics.ApiMetrics;
import tech.clusterops.sdk.resilience.ApiFailure;
import tech.clusterops.sdk.support.ObjectMappers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Commit and rollback behaviour of {@link TransactionManager} against mocked resource calls.
 * Log I/O runs on the calling thread.
 */
@ExtendWith(MockitoExtension.class)
class TransactionManagerTest {

    private static final CompletableFuture<Void> OK = CompletableFuture.completedFuture(null);

    @Mock
    private ResourceOperations operations;

    @TempDir
    Path dir;

    private SimpleMeterRegistry registry;
    private TransactionLog log;
    private TransactionManager manager;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);
        registry = new SimpleMeterRegistry();
        log = new TransactionLog(dir, ObjectMappers.create());
        manager = new TransactionManager(operations, log, new ApiMetrics(registry), Duration.ofSeconds(30),
            Runnable::run, clock);
    }

    // ========================================
    // validate
    // ========================================

    @Test
    @DisplayName("an empty name fails validation before any network call")
    void emptyNameFailsValidation() {
        // Given
        Transaction tx = manager.begin()
            .addOperation(index("a"))
            .addOperation(index(""));

        // When / Then
        assertThatThrownBy(() -> manager.commit(tx).join())
            .cause()
            .isInstanceOfSatisfying(TransactionValidationException.class, e -> {
                assertThat(e.getErrors()).hasSize(1);
                assertThat(e.getErrors().get(0).index()).isEqualTo(1);
                assertThat(e.getMessage()).contains("Index name must not be empty");
            });
        verifyNoInteractions(operations);
        assertThat(log.loadPending()).isEmpty();
        assertThat(tx.status()).isEqualTo(TransactionStatus.BUILDING);
    }

    @Test
    @DisplayName("validation checks deletes and modifications too and lists every offender")
    void validationCoversEveryOperation() {
        Transaction tx = manager.begin()
            .addOperation(new TransactionOperation.DeleteUser("  "))
            .addOperation(new TransactionOperation.ModifyRole("", new ModifyRoleParams(null, null, null, null, null)))
            .addOperation(index("ok"));

        assertThatThrownBy(() -> manager.validate(tx))
            .isInstanceOfSatisfying(TransactionValidationException.class, e ->
                assertThat(e.getErrors()).extracting(TransactionValidationException.ValidationError::index)
                    .containsExactly(0, 1))
            .hasMessageContaining("Username must not be empty")
            .hasMessageContaining("Role name must not be empty");
    }

    @Test
    @DisplayName("validate is repeatable and changes nothing")
    void validateIsPure() {
        Transaction tx = manager.begin().addOperation(index("a"));

        manager.validate(tx);
        manager.validate(tx);

        assertThat(tx.status()).isEqualTo(TransactionStatus.BUILDING);
        assertThat(tx.operations()).containsExactly(index("a"));
        assertThat(log.loadPending()).isEmpty();
        verifyNoInteractions(operations);
    }

    // ========================================
    // commit
    // ========================================

    @Test
    @DisplayName("operations run in order and the transaction is archived as committed")
    void commitsInOrder() {
        // Given
        when(operations.createIndex(any())).thenReturn(OK);
        when(operations.createRole(any())).thenReturn(OK);
        when(operations.deleteUser("old")).thenReturn(OK);
        Transaction tx = manager.begin()
            .addOperation(index("a"))
            .addOperation(role("ops"))
            .addOperation(new TransactionOperation.DeleteUser("old"));

        // When
        manager.commit(tx).join();

        // Then
        InOrder order = inOrder(operations);
        order.verify(operations).createIndex(CreateIndexParams.named("a"));
        order.verify(operations).createRole(any());
        order.verify(operations).deleteUser("old");
        assertThat(tx.status()).isEqualTo(TransactionStatus.COMMITTED);
        assertThat(Files.exists(log.pendingFile())).isFalse();
        assertThat(log.history()).singleElement()
            .satisfies(p -> assertThat(p.getFileName().toString()).endsWith(tx.id() + "_committed.json"));
        assertThat(registry.find(ApiMetrics.COMMIT_SUCCESSES).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("the pending file exists before the first operation runs")
    void persistsBeforeFirstOperation() {
        AtomicBoolean pendingSeen = new AtomicBoolean();
        when(operations.createIndex(any())).thenAnswer(invocation -> {
            pendingSeen.set(Files.exists(log.pendingFile()));
            return OK;
        });

        manager.commit(manager.begin().addOperation(index("a"))).join();

        assertThat(pendingSeen).isTrue();
    }

    @Test
    @DisplayName("a failed user creation deletes the index created before it")
    void rollsBackCompletedCreates() {
        // Given
        ApiCallException conflict = apiError(409, "ERROR: User bob already exists");
        when(operations.createIndex(any())).thenReturn(OK);
        when(operations.createUser(any())).thenReturn(CompletableFuture.failedFuture(conflict));
        when(operations.deleteIndex("a")).thenReturn(OK);
        Transaction tx = manager.begin()
            .addOperation(index("a"))
            .addOperation(user("bob"));

        // When / Then
        assertThatThrownBy(() -> manager.commit(tx).join())
            .isInstanceOf(CompletionException.class)
            .cause()
            .isInstanceOfSatisfying(TransactionFailedException.class, e -> {
                assertThat(e.getFailedIndex()).isEqualTo(1);
                assertThat(e.getFailedOperation()).isEqualTo(user("bob"));
                assertThat(e.getCause()).isSameAs(conflict);
                assertThat(e.getRollbackOutcome().rolledBack()).containsExactly(index("a"));
                assertThat(e.getRollbackOutcome().isComplete()).isTrue();
                assertThat(e.getMessage())
                    .contains("operation 2 of 2 (CreateUser 'bob') failed")
                    .contains("User bob already exists")
                    .contains("rolled back 1 of 1 completed operations")
                    .doesNotContain("hunter2");
            });
        verify(operations).deleteIndex("a");
        verify(operations, never()).deleteUser(any());
        assertThat(tx.status()).isEqualTo(TransactionStatus.ROLLED_BACK);
        assertThat(Files.exists(log.pendingFile())).isFalse();
        assertThat(log.history()).singleElement()
            .satisfies(p -> assertThat(p.getFileName().toString()).endsWith("_rolled_back.json"));
        assertThat(registry.find(ApiMetrics.COMMIT_FAILURES).counter().count()).isEqualTo(1.0);
        assertThat(registry.find(ApiMetrics.ROLLBACK_ATTEMPTS).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("rollback runs in reverse order of completion")
    void rollsBackInReverseOrder() {
        // Given
        when(operations.createIndex(any())).thenReturn(OK);
        when(operations.createRole(any())).thenReturn(OK);
        when(operations.createMacro(any())).thenReturn(CompletableFuture.failedFuture(apiError(400, "bad definition")));
        when(operations.deleteRole("ops")).thenReturn(OK);
        when(operations.deleteIndex("a")).thenReturn(OK);
        Transaction tx = manager.begin()
            .addOperation(index("a"))
            .addOperation(role("ops"))
            .addOperation(new TransactionOperation.CreateMacro(
                new CreateMacroParams("m", "index=main", null, null, false, false, null, null)));

        // When
        assertThatThrownBy(() -> manager.commit(tx).join()).cause().isInstanceOf(TransactionFailedException.class);

        // Then
        InOrder order = inOrder(operations);
        order.verify(operations).deleteRole("ops");
        order.verify(operations).deleteIndex("a");
        verify(operations, never()).deleteMacro(any());
    }

    @Test
    @DisplayName("deletes and modifications are reported as having no automated rollback path")
    void reportsUnsupportedRollback() {
        // Given
        when(operations.deleteIndex("old")).thenReturn(OK);
        when(operations.modifyRole(any(), any())).thenReturn(OK);
        when(operations.createUser(any())).thenReturn(CompletableFuture.failedFuture(apiError(400, "bad")));
        Transaction tx = manager.begin()
            .addOperation(new TransactionOperation.DeleteIndex("old"))
            .addOperation(new TransactionOperation.ModifyRole("ops", new ModifyRoleParams(List.of("search"), null, null, null, null)))
            .addOperation(user("bob"));

        // When / Then
        assertThatThrownBy(() -> manager.commit(tx).join())
            .cause()
            .isInstanceOfSatisfying(TransactionFailedException.class, e -> {
                RollbackOutcome outcome = e.getRollbackOutcome();
                assertThat(outcome.rolledBack()).isEmpty();
                assertThat(outcome.unsupported()).extracting(TransactionOperation::kind)
                    .containsExactly("ModifyRole", "DeleteIndex");
                assertThat(e.getMessage())
                    .contains("rolled back 0 of 2 completed operations")
                    .contains("no automated rollback path for: ModifyRole 'ops', DeleteIndex 'old'");
            });
    }

    @Test
    @DisplayName("a failing rollback is reported alongside the original error")
    void reportsRollbackFailure() {
        // Given
        ApiCallException original = apiError(409, "user exists");
        when(operations.createIndex(any())).thenReturn(OK);
        when(operations.createUser(any())).thenReturn(CompletableFuture.failedFuture(original));
        when(operations.deleteIndex("a")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("index busy")));
        Transaction tx = manager.begin()
            .addOperation(index("a"))
            .addOperation(user("bob"));

        // When / Then
        assertThatThrownBy(() -> manager.commit(tx).join())
            .cause()
            .isInstanceOfSatisfying(TransactionFailedException.class, e -> {
                assertThat(e.getCause()).isSameAs(original);
                assertThat(e.getRollbackOutcome().requiresManualCleanup()).isTrue();
                assertThat(e.getMessage()).contains(
                    "rollback also failed for these operations, manual cleanup required: delete_index 'a' (index busy)");
            });
        assertThat(registry.find(ApiMetrics.ROLLBACK_FAILURES).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a rollback call that hangs is cut off by the rollback timeout")
    void rollbackTimeout() {
        // Given
        manager = new TransactionManager(operations, log, new ApiMetrics(registry), Duration.ofMillis(100),
            Runnable::run, Clock.systemUTC());
        when(operations.createIndex(any())).thenReturn(OK);
        when(operations.createUser(any())).thenReturn(CompletableFuture.failedFuture(apiError(409, "exists")));
        when(operations.deleteIndex("a")).thenReturn(new CompletableFuture<>());
        Transaction tx = manager.begin()
            .addOperation(index("a"))
            .addOperation(user("bob"));

        // When / Then
        assertThatThrownBy(() -> manager.commit(tx).join())
            .cause()
            .isInstanceOfSatisfying(TransactionFailedException.class, e ->
                assertThat(e.getRollbackOutcome().failures()).singleElement()
                    .satisfies(f -> assertThat(f.error()).contains("timed out")));
    }

    @Test
    @DisplayName("cancelling a commit stops before the next operation, skips rollback and keeps the pending file")
    void cancellationStopsWithoutRollback() {
        // Given
        CompletableFuture<Void> hanging = new CompletableFuture<>();
        when(operations.createIndex(any())).thenReturn(hanging);
        Transaction tx = manager.begin()
            .addOperation(index("a"))
            .addOperation(role("ops"));

        // When
        CompletableFuture<Void> commit = manager.commit(tx);
        await().atMost(5, SECONDS).until(() -> hanging.getNumberOfDependents() > 0);
        commit.cancel(true);

        // Then
        assertThat(commit).isCancelled();
        assertThat(hanging).isCancelled();
        verify(operations, never()).createRole(any());
        verify(operations, never()).deleteIndex(any());
        assertThat(log.loadPending()).get().extracting(Transaction::id).isEqualTo(tx.id());
    }

    @Test
    @DisplayName("a transaction can only be committed once")
    void commitOnlyOnce() {
        when(operations.createIndex(any())).thenReturn(OK);
        Transaction tx = manager.begin().addOperation(index("a"));
        manager.commit(tx).join();

        assertThatThrownBy(() -> manager.commit(tx).join()).cause().isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("a pending file that cannot be written leaves the transaction buildable and calls nothing")
    void pendingWriteFailureRevertsToBuilding() throws Exception {
        // Given
        Path blocked = Files.createFile(dir.resolve("blocked"));
        TransactionManager unwritable = new TransactionManager(operations,
            new TransactionLog(blocked, ObjectMappers.create()), new ApiMetrics(registry), Duration.ofSeconds(30),
            Runnable::run, Clock.systemUTC());
        Transaction tx = unwritable.begin().addOperation(index("a"));

        // When / Then
        assertThatThrownBy(() -> unwritable.commit(tx).join())
            .cause()
            .isInstanceOf(TransactionLogException.class);
        assertThat(tx.status()).isEqualTo(TransactionStatus.BUILDING);
        assertThat(registry.find(ApiMetrics.COMMIT_FAILURES).counter().count()).isEqualTo(1.0);
        verifyNoInteractions(operations);
    }

    // ========================================
    // pending recovery
    // ========================================

    @Test
    @DisplayName("a pending transaction is loaded for the operator and can be discarded")
    void discardPending() {
        // Given
        Transaction interrupted = manager.begin().addOperation(index("a"));
        interrupted.transitionTo(TransactionStatus.COMMITTING);
        log.savePending(interrupted);

        // When
        assertThat(manager.loadPending()).get().extracting(Transaction::id).isEqualTo(interrupted.id());
        Path archived = manager.discardPending().orElseThrow();

        // Then
        assertThat(archived.getFileName().toString()).endsWith(interrupted.id() + "_abandoned.json");
        assertThat(manager.loadPending()).isEmpty();
        assertThat(manager.discardPending()).isEmpty();
        verifyNoInteractions(operations);
    }

    private static ApiCallException apiError(int status, String detail) {
        return new ApiCallException(new ApiFailure.HttpStatus(status, detail, null, null),
            "/services/authentication/users", "POST", 1);
    }

    private static TransactionOperation index(String name) {
        return new TransactionOperation.CreateIndex(CreateIndexParams.named(name));
    }

    private static TransactionOperation role(String name) {
        return new TransactionOperation.CreateRole(new CreateRoleParams(name, List.of("search"), null, null, null, null));
    }

    private static TransactionOperation user(String name) {
        return new TransactionOperation.CreateUser(new CreateUserParams(name, "hunter2", List.of("user"), null, null, null));
    }
}
