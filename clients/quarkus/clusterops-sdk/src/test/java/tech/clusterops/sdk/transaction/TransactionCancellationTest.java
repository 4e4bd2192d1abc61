package tech.clusterops.sdk.transaction;

import com.github.tomakehurst.wiremock.WireMockServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.clusterops.sdk.client.ClusterOpsClient;
import tech.clusterops.sdk.dto.CreateIndexParams;
import tech.clusterops.sdk.dto.CreateRoleParams;
import tech.clusterops.sdk.metrics.ApiMetrics;
import tech.clusterops.sdk.support.ObjectMappers;
import tech.clusterops.sdk.support.TestConfigs;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Cancelling a commit while the real client is waiting to retry.
 */
class TransactionCancellationTest {

    private WireMockServer wireMock;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(options().dynamicPort());
        wireMock.start();
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    @DisplayName("cancelling a commit during a retry wait aborts the running call")
    void cancelledCommitAbortsRunningCall() {
        // Given
        wireMock.stubFor(post(urlPathEqualTo("/services/data/indexes")).willReturn(aResponse().withStatus(503)));
        CompletableFuture<Void> wait = new CompletableFuture<>();
        ApiMetrics metrics = new ApiMetrics(new SimpleMeterRegistry());
        ClusterOpsClient client = new ClusterOpsClient(TestConfigs.apiToken(wireMock.baseUrl(), "tok-1"),
            HttpClient.newHttpClient(), metrics, duration -> wait, Clock.systemUTC());
        TransactionLog log = new TransactionLog(dir, ObjectMappers.create());
        TransactionManager manager = new TransactionManager(client, log, metrics, Duration.ofSeconds(30),
            Runnable::run, Clock.systemUTC());
        Transaction tx = manager.begin()
            .addOperation(new TransactionOperation.CreateIndex(CreateIndexParams.named("web")))
            .addOperation(new TransactionOperation.CreateRole(
                new CreateRoleParams("ops", List.of("search"), null, null, null, null)));

        // When
        CompletableFuture<Void> commit = manager.commit(tx);
        await().atMost(5, SECONDS).until(() -> wait.getNumberOfDependents() > 0);
        commit.cancel(true);
        wait.complete(null);

        // Then
        assertThat(commit).isCancelled();
        assertThat(wait).isCancelled();
        wireMock.verify(1, postRequestedFor(urlPathEqualTo("/services/data/indexes")));
        wireMock.verify(1, anyRequestedFor(anyUrl()));
        assertThat(log.loadPending()).isPresent();
    }
}
