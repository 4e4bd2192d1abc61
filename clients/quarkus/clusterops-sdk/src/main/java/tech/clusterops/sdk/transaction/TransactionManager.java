package tech.clusterops.sdk.transaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.clusterops.sdk.client.ClusterOpsClient;
import tech.clusterops.sdk.config.ClusterOpsConfig;
import tech.clusterops.sdk.exception.TransactionFailedException;
import tech.clusterops.sdk.exception.TransactionValidationException;
import tech.clusterops.sdk.exception.TransactionValidationException.ValidationError;
import tech.clusterops.sdk.metrics.ApiMetrics;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Applies {@link Transaction}s: validates them, persists the pending record, runs the operations
 * strictly in order and, when one fails, undoes the completed ones in reverse order.
 *
 * <p>Only creations can be undone (by deleting what was created). Deletes and modifications
 * have no automatic inverse and are reported in the {@link RollbackOutcome} instead.
 *
 * <p>Example usage:
 * <pre>{@code
 * var tx = transactionManager.begin()
 *     .addOperation(new TransactionOperation.CreateIndex(CreateIndexParams.named("web")))
 *     .addOperation(new TransactionOperation.CreateRole(roleParams));
 * transactionManager.commit(tx).join();
 * }</pre>
 *
 * <p>Cancelling the future returned by {@link #commit} stops before the next operation without
 * rolling back; the pending file stays for the operator to inspect.
 */
@ApplicationScoped
public class TransactionManager {

    private static final Logger LOG = Logger.getLogger(TransactionManager.class);

    private final ResourceOperations operations;
    private final TransactionLog log;
    private final ApiMetrics metrics;
    private final Duration rollbackTimeout;
    private final Executor ioExecutor;
    private final Clock clock;
    private final OperationExecutor executor = new OperationExecutor();
    private final Compensations compensations = new Compensations();

    @Inject
    public TransactionManager(ClusterOpsClient client, ClusterOpsConfig config) {
        this(client,
            new TransactionLog(Path.of(config.transaction().logDir()), client.getObjectMapper()),
            client.metrics(),
            Duration.ofSeconds(config.transaction().rollbackTimeout()),
            ForkJoinPool.commonPool(),
            Clock.systemUTC());
    }

    /**
     * @param ioExecutor runs transaction log reads and writes
     */
    public TransactionManager(ResourceOperations operations, TransactionLog log, ApiMetrics metrics,
                              Duration rollbackTimeout, Executor ioExecutor, Clock clock) {
        this.operations = operations;
        this.log = log;
        this.metrics = metrics;
        this.rollbackTimeout = rollbackTimeout;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
    }

    public Transaction begin() {
        Transaction transaction = Transaction.begin(clock);
        LOG.debugf("Began transaction %s", transaction.id());
        return transaction;
    }

    /**
     * Check the transaction locally. No network calls, no state change; repeated calls give the
     * same result.
     *
     * @throws TransactionValidationException listing every operation without a resource name
     */
    public void validate(Transaction transaction) {
        List<ValidationError> errors = new ArrayList<>();
        List<TransactionOperation> ops = transaction.operations();
        for (int i = 0; i < ops.size(); i++) {
            TransactionOperation op = ops.get(i);
            String name = op.resourceName();
            if (name == null || name.isBlank()) {
                errors.add(new ValidationError(i, op, op.resourceType().nameLabel() + " must not be empty"));
            }
        }
        if (!errors.isEmpty()) {
            throw new TransactionValidationException(transaction.id(), errors);
        }
    }

    /**
     * Validate, persist and apply the transaction.
     *
     * <p>The future fails with {@link TransactionValidationException} before any call is made,
     * or with {@link TransactionFailedException} once an operation fails and rollback has run.
     */
    public CompletableFuture<Void> commit(Transaction transaction) {
        if (transaction.status() != TransactionStatus.BUILDING) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                "Transaction " + transaction.id() + " is " + transaction.status().label() + " and cannot be committed"));
        }
        metrics.recordTransaction(ApiMetrics.COMMIT_ATTEMPTS);

        transaction.transitionTo(TransactionStatus.VALIDATING);
        try {
            validate(transaction);
        } catch (TransactionValidationException e) {
            transaction.transitionTo(TransactionStatus.BUILDING);
            metrics.recordTransaction(ApiMetrics.COMMIT_FAILURES);
            LOG.warnf("Transaction %s rejected: %s", transaction.id(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        transaction.transitionTo(TransactionStatus.COMMITTING);
        LOG.infof("Committing transaction %s with %d operation(s)", transaction.id(), transaction.operations().size());

        Commit commit = new Commit(transaction);
        CompletableFuture.runAsync(() -> log.savePending(transaction), ioExecutor)
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    transaction.transitionTo(TransactionStatus.BUILDING);
                    metrics.recordTransaction(ApiMetrics.COMMIT_FAILURES);
                    LOG.errorf(unwrap(error), "Transaction %s not started: pending file could not be written",
                        transaction.id());
                    commit.result.completeExceptionally(unwrap(error));
                } else {
                    commit.run(0);
                }
            });
        return commit.result;
    }

    /**
     * The transaction left pending by an interrupted commit, if any. Resuming or discarding it is
     * left to the caller.
     */
    public Optional<Transaction> loadPending() {
        return log.loadPending();
    }

    /**
     * Archive the pending transaction as abandoned and remove the pending file.
     *
     * @return the archive file, or empty when nothing was pending
     */
    public Optional<Path> discardPending() {
        Optional<Transaction> pending = log.loadPending();
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        Transaction transaction = pending.get();
        transaction.transitionTo(TransactionStatus.ABANDONED);
        Path archived = log.archive(transaction);
        log.clearPending();
        LOG.infof("Discarded pending transaction %s", transaction.id());
        return Optional.of(archived);
    }

    public TransactionLog log() {
        return log;
    }

    private final class Commit {

        final CompletableFuture<Void> result = new CompletableFuture<>();
        final Transaction transaction;
        final List<TransactionOperation> ops;
        final List<TransactionOperation> completed = new ArrayList<>();
        volatile CompletableFuture<Void> inFlight;

        Commit(Transaction transaction) {
            this.transaction = transaction;
            this.ops = transaction.operations();
            result.whenComplete((ignored, error) -> {
                CompletableFuture<Void> pending = inFlight;
                if (result.isCancelled()) {
                    LOG.warnf("Commit of transaction %s cancelled after %d of %d operation(s); pending file kept",
                        transaction.id(), completed.size(), ops.size());
                    if (pending != null) {
                        pending.cancel(true);
                    }
                }
            });
        }

        void run(int index) {
            if (result.isDone()) {
                return;
            }
            if (index == ops.size()) {
                finish();
                return;
            }
            TransactionOperation op = ops.get(index);
            LOG.debugf("Transaction %s: operation %d/%d %s", transaction.id(), index + 1, ops.size(), op.describe());

            CompletableFuture<Void> step;
            try {
                step = op.accept(executor);
            } catch (RuntimeException e) {
                step = CompletableFuture.failedFuture(e);
            }
            inFlight = step;
            if (result.isCancelled()) {
                step.cancel(true);
                return;
            }
            step.whenComplete((ignored, error) -> {
                if (result.isDone()) {
                    return;
                }
                if (error != null) {
                    fail(index, op, unwrap(error));
                } else {
                    completed.add(op);
                    run(index + 1);
                }
            });
        }

        void finish() {
            transaction.transitionTo(TransactionStatus.COMMITTED);
            metrics.recordTransaction(ApiMetrics.COMMIT_SUCCESSES);
            CompletableFuture.runAsync(this::archiveAndClear, ioExecutor)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        LOG.errorf(unwrap(error), "Transaction %s committed but could not be archived; pending file kept",
                            transaction.id());
                        result.completeExceptionally(unwrap(error));
                    } else {
                        LOG.infof("Transaction %s committed (%d operation(s))", transaction.id(), ops.size());
                        result.complete(null);
                    }
                });
        }

        void fail(int index, TransactionOperation op, Throwable cause) {
            LOG.warnf("Transaction %s: %s failed, rolling back %d completed operation(s): %s",
                transaction.id(), op.describe(), completed.size(), cause.getMessage());
            metrics.recordTransaction(ApiMetrics.COMMIT_FAILURES);

            rollback(List.copyOf(completed))
                .thenCompose(outcome -> {
                    transaction.transitionTo(TransactionStatus.ROLLED_BACK);
                    return CompletableFuture.runAsync(this::archiveAndClear, ioExecutor)
                        .handle((ignored, error) -> {
                            if (error != null) {
                                LOG.errorf(unwrap(error), "Failed to archive rolled back transaction %s; pending file kept",
                                    transaction.id());
                            }
                            return outcome;
                        });
                })
                .whenComplete((outcome, error) -> {
                    if (error != null) {
                        result.completeExceptionally(unwrap(error));
                    } else {
                        result.completeExceptionally(new TransactionFailedException(
                            transaction.id(), index, ops.size(), op, cause, outcome));
                    }
                });
        }

        void archiveAndClear() {
            log.archive(transaction);
            log.clearPending();
        }
    }

    private CompletableFuture<RollbackOutcome> rollback(List<TransactionOperation> completed) {
        if (completed.isEmpty()) {
            return CompletableFuture.completedFuture(RollbackOutcome.nothingToRollBack());
        }
        metrics.recordTransaction(ApiMetrics.ROLLBACK_ATTEMPTS);

        List<TransactionOperation> rolledBack = new ArrayList<>();
        List<RollbackFailure> failures = new ArrayList<>();
        List<TransactionOperation> unsupported = new ArrayList<>();

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int i = completed.size() - 1; i >= 0; i--) {
            TransactionOperation op = completed.get(i);
            chain = chain.thenCompose(ignored -> undo(op, rolledBack, failures, unsupported));
        }
        return chain.thenApply(ignored -> {
            if (!failures.isEmpty()) {
                metrics.recordTransaction(ApiMetrics.ROLLBACK_FAILURES);
            }
            return new RollbackOutcome(completed.size(), rolledBack, failures, unsupported);
        });
    }

    private CompletableFuture<Void> undo(TransactionOperation op, List<TransactionOperation> rolledBack,
                                         List<RollbackFailure> failures, List<TransactionOperation> unsupported) {
        Optional<Compensation> compensation = op.accept(compensations);
        if (compensation.isEmpty()) {
            LOG.warnf("No automated rollback path for %s, leaving it in place", op.describe());
            unsupported.add(op);
            return CompletableFuture.completedFuture(null);
        }

        Compensation undo = compensation.get();
        CompletableFuture<Void> call;
        try {
            call = undo.call().get();
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call
            .orTimeout(rollbackTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((ignored, error) -> {
                if (error == null) {
                    LOG.infof("Rolled back %s with %s", op.describe(), undo.action());
                    rolledBack.add(op);
                } else {
                    Throwable cause = unwrap(error);
                    String reason = cause instanceof TimeoutException
                        ? "timed out after " + rollbackTimeout.toMillis() + "ms"
                        : cause.getMessage();
                    LOG.errorf(cause, "Rollback %s '%s' failed, manual cleanup required", undo.action(), op.resourceName());
                    failures.add(new RollbackFailure(op, undo.action(), reason));
                }
                return null;
            });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * A compensating call and the action name reported for it.
     */
    private record Compensation(String action, Supplier<CompletableFuture<Void>> call) {}

    private final class OperationExecutor implements TransactionOperation.Visitor<CompletableFuture<Void>> {

        @Override
        public CompletableFuture<Void> createIndex(TransactionOperation.CreateIndex op) {
            return operations.createIndex(op.params());
        }

        @Override
        public CompletableFuture<Void> deleteIndex(TransactionOperation.DeleteIndex op) {
            return operations.deleteIndex(op.name());
        }

        @Override
        public CompletableFuture<Void> modifyIndex(TransactionOperation.ModifyIndex op) {
            return operations.modifyIndex(op.name(), op.params());
        }

        @Override
        public CompletableFuture<Void> createUser(TransactionOperation.CreateUser op) {
            return operations.createUser(op.params());
        }

        @Override
        public CompletableFuture<Void> deleteUser(TransactionOperation.DeleteUser op) {
            return operations.deleteUser(op.name());
        }

        @Override
        public CompletableFuture<Void> modifyUser(TransactionOperation.ModifyUser op) {
            return operations.modifyUser(op.name(), op.params());
        }

        @Override
        public CompletableFuture<Void> createRole(TransactionOperation.CreateRole op) {
            return operations.createRole(op.params());
        }

        @Override
        public CompletableFuture<Void> deleteRole(TransactionOperation.DeleteRole op) {
            return operations.deleteRole(op.name());
        }

        @Override
        public CompletableFuture<Void> modifyRole(TransactionOperation.ModifyRole op) {
            return operations.modifyRole(op.name(), op.params());
        }

        @Override
        public CompletableFuture<Void> createMacro(TransactionOperation.CreateMacro op) {
            return operations.createMacro(op.params());
        }

        @Override
        public CompletableFuture<Void> deleteMacro(TransactionOperation.DeleteMacro op) {
            return operations.deleteMacro(op.name());
        }

        @Override
        public CompletableFuture<Void> updateMacro(TransactionOperation.UpdateMacro op) {
            return operations.updateMacro(op.name(), op.params());
        }

        @Override
        public CompletableFuture<Void> createSavedSearch(TransactionOperation.CreateSavedSearch op) {
            return operations.createSavedSearch(op.params());
        }

        @Override
        public CompletableFuture<Void> deleteSavedSearch(TransactionOperation.DeleteSavedSearch op) {
            return operations.deleteSavedSearch(op.name());
        }

        @Override
        public CompletableFuture<Void> updateSavedSearch(TransactionOperation.UpdateSavedSearch op) {
            return operations.updateSavedSearch(op.name(), op.params());
        }
    }

    // Creations are undone by deleting; everything else has no inverse.
    private final class Compensations implements TransactionOperation.Visitor<Optional<Compensation>> {

        @Override
        public Optional<Compensation> createIndex(TransactionOperation.CreateIndex op) {
            String name = op.params().name();
            return Optional.of(new Compensation("delete_index", () -> operations.deleteIndex(name)));
        }

        @Override
        public Optional<Compensation> deleteIndex(TransactionOperation.DeleteIndex op) {
            return Optional.empty();
        }

        @Override
        public Optional<Compensation> modifyIndex(TransactionOperation.ModifyIndex op) {
            return Optional.empty();
        }

        @Override
        public Optional<Compensation> createUser(TransactionOperation.CreateUser op) {
            String name = op.params().name();
            return Optional.of(new Compensation("delete_user", () -> operations.deleteUser(name)));
        }

        @Override
        public Optional<Compensation> deleteUser(TransactionOperation.DeleteUser op) {
            return Optional.empty();
        }

        @Override
        public Optional<Compensation> modifyUser(TransactionOperation.ModifyUser op) {
            return Optional.empty();
        }

        @Override
        public Optional<Compensation> createRole(TransactionOperation.CreateRole op) {
            String name = op.params().name();
            return Optional.of(new Compensation("delete_role", () -> operations.deleteRole(name)));
        }

        @Override
        public Optional<Compensation> deleteRole(TransactionOperation.DeleteRole op) {
            return Optional.empty();
        }

        @Override
        public Optional<Compensation> modifyRole(TransactionOperation.ModifyRole op) {
            return Optional.empty();
        }

        @Override
        public Optional<Compensation> createMacro(TransactionOperation.CreateMacro op) {
            String name = op.params().name();
            return Optional.of(new Compensation("delete_macro", () -> operations.deleteMacro(name)));
        }

        @Override
        public Optional<Compensation> deleteMacro(TransactionOperation.DeleteMacro op) {
            return Optional.empty();
        }

        @Override
        public Optional<Compensation> updateMacro(TransactionOperation.UpdateMacro op) {
            return Optional.empty();
        }

        @Override
        public Optional<Compensation> createSavedSearch(TransactionOperation.CreateSavedSearch op) {
            String name = op.params().name();
            return Optional.of(new Compensation("delete_saved_search", () -> operations.deleteSavedSearch(name)));
        }

        @Override
        public Optional<Compensation> deleteSavedSearch(TransactionOperation.DeleteSavedSearch op) {
            return Optional.empty();
        }

        @Override
        public Optional<Compensation> updateSavedSearch(TransactionOperation.UpdateSavedSearch op) {
            return Optional.empty();
        }
    }
}
