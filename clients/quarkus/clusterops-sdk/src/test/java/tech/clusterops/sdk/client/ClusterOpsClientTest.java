package tech.clusterops.sdk.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.clusterops.sdk.config.ClusterOpsConfig;
import tech.clusterops.sdk.dto.CreateIndexParams;
import tech.clusterops.sdk.dto.CreateRoleParams;
import tech.clusterops.sdk.dto.CreateUserParams;
import tech.clusterops.sdk.exception.ApiCallException;
import tech.clusterops.sdk.exception.InvalidResponseException;
import tech.clusterops.sdk.metrics.ApiMetrics;
import tech.clusterops.sdk.support.RecordingDelayer;
import tech.clusterops.sdk.support.TestConfigs;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.deleteRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ClusterOpsClientTest {

    private static final String LOGIN = "/services/auth/login";

    private WireMockServer wireMock;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(options().dynamicPort());
        wireMock.start();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    @DisplayName("logs in once and sends the session key as a bearer token")
    void logsInAndUsesSessionKey() {
        // Given
        wireMock.stubFor(post(urlPathEqualTo(LOGIN)).willReturn(okJson("{\"sessionKey\":\"sess-1\"}")));
        wireMock.stubFor(post(urlPathEqualTo("/services/data/indexes")).willReturn(okJson("{\"entry\":[]}")));
        ClusterOpsClient client = client(TestConfigs.session(wireMock.baseUrl(), "admin", "s3cret"));

        // When
        client.indexes().create(new CreateIndexParams("web", 100, null, null, null, null, null, null, null)).join();
        client.indexes().create(CreateIndexParams.named("app")).join();

        // Then
        wireMock.verify(1, postRequestedFor(urlPathEqualTo(LOGIN))
            .withHeader("Authorization", absent())
            .withRequestBody(containing("username=admin")));
        wireMock.verify(postRequestedFor(urlPathEqualTo("/services/data/indexes"))
            .withHeader("Authorization", equalTo("Bearer sess-1"))
            .withHeader("Content-Type", containing("application/x-www-form-urlencoded"))
            .withQueryParam("output_mode", equalTo("json"))
            .withRequestBody(equalTo("name=web&maxTotalDataSizeMB=100")));
    }

    @Test
    @DisplayName("API tokens are sent directly without a login")
    void apiTokenSkipsLogin() {
        // Given
        wireMock.stubFor(delete(urlPathEqualTo("/services/authorization/roles/ops")).willReturn(okJson("{}")));
        ClusterOpsClient client = client(TestConfigs.apiToken(wireMock.baseUrl(), "tok-1"));

        // When
        client.roles().delete("ops").join();

        // Then
        wireMock.verify(deleteRequestedFor(urlPathEqualTo("/services/authorization/roles/ops"))
            .withHeader("Authorization", equalTo("Bearer tok-1")));
        wireMock.verify(0, postRequestedFor(urlPathEqualTo(LOGIN)));
    }

    @Test
    @DisplayName("a 401 on a session clears it, logs in again and repeats the call once")
    void reauthenticatesOnceAfterRejection() {
        // Given
        wireMock.stubFor(post(urlPathEqualTo(LOGIN)).inScenario("login")
            .whenScenarioStateIs(STARTED)
            .willReturn(okJson("{\"sessionKey\":\"sess-1\"}"))
            .willSetStateTo("second"));
        wireMock.stubFor(post(urlPathEqualTo(LOGIN)).inScenario("login")
            .whenScenarioStateIs("second")
            .willReturn(okJson("{\"sessionKey\":\"sess-2\"}")));
        wireMock.stubFor(delete(urlPathEqualTo("/services/data/indexes/web"))
            .withHeader("Authorization", equalTo("Bearer sess-1"))
            .willReturn(aResponse().withStatus(401)));
        wireMock.stubFor(delete(urlPathEqualTo("/services/data/indexes/web"))
            .withHeader("Authorization", equalTo("Bearer sess-2"))
            .willReturn(okJson("{}")));
        ClusterOpsClient client = client(TestConfigs.session(wireMock.baseUrl(), "admin", "s3cret"));

        // When
        client.deleteIndex("web").join();

        // Then
        wireMock.verify(2, postRequestedFor(urlPathEqualTo(LOGIN)));
        wireMock.verify(2, deleteRequestedFor(urlPathEqualTo("/services/data/indexes/web")));
    }

    @Test
    @DisplayName("a second 401 after re-authentication is returned to the caller")
    void persistentRejectionFails() {
        // Given
        wireMock.stubFor(post(urlPathEqualTo(LOGIN)).willReturn(okJson("{\"sessionKey\":\"sess-1\"}")));
        wireMock.stubFor(delete(urlPathEqualTo("/services/data/indexes/web")).willReturn(aResponse().withStatus(401)));
        ClusterOpsClient client = client(TestConfigs.session(wireMock.baseUrl(), "admin", "s3cret"));

        // When / Then
        assertThatThrownBy(() -> client.deleteIndex("web").join())
            .cause()
            .isInstanceOfSatisfying(ApiCallException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(401);
                assertThat(e.isAuthRejection()).isTrue();
            });
        wireMock.verify(2, deleteRequestedFor(urlPathEqualTo("/services/data/indexes/web")));
    }

    @Test
    @DisplayName("API-token auth does not retry after a 401")
    void apiTokenRejectionIsFinal() {
        wireMock.stubFor(delete(urlPathEqualTo("/services/data/indexes/web")).willReturn(aResponse().withStatus(401)));
        ClusterOpsClient client = client(TestConfigs.apiToken(wireMock.baseUrl(), "tok-1"));

        assertThatThrownBy(() -> client.deleteIndex("web").join()).cause().isInstanceOf(ApiCallException.class);
        wireMock.verify(1, deleteRequestedFor(urlPathEqualTo("/services/data/indexes/web")));
    }

    @Test
    @DisplayName("a malformed body on HTTP 200 fails without retrying")
    void malformedSuccessBodyIsFatal() {
        // Given
        wireMock.stubFor(post(urlPathEqualTo("/services/authorization/roles"))
            .willReturn(aResponse().withStatus(200).withBody("<html>not json</html>")));
        ClusterOpsClient client = client(TestConfigs.apiToken(wireMock.baseUrl(), "tok-1"));

        // When / Then
        assertThatThrownBy(() -> client.roles()
                .create(new CreateRoleParams("ops", List.of("search"), List.of("main"), null, null, null)).join())
            .cause()
            .isInstanceOf(InvalidResponseException.class);
        wireMock.verify(1, postRequestedFor(urlPathEqualTo("/services/authorization/roles")));
        assertThat(registry.find(ApiMetrics.DESERIALIZATION_FAILURES).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("error responses surface the server message but never the submitted password")
    void errorMessagesAreCondensedAndRedacted() {
        // Given
        wireMock.stubFor(post(urlPathEqualTo("/services/authentication/users"))
            .willReturn(aResponse().withStatus(400)
                .withHeader("X-Request-Id", "req-9")
                .withBody("{\"messages\":[{\"type\":\"ERROR\",\"text\":\"Password too short\"}]}")));
        ClusterOpsClient client = client(TestConfigs.apiToken(wireMock.baseUrl(), "tok-1"));
        CreateUserParams bob = new CreateUserParams("bob", "hunter2", List.of("user", "power"), "Bob", null, null);

        // When / Then
        assertThatThrownBy(() -> client.createUser(bob).join())
            .cause()
            .isInstanceOf(ApiCallException.class)
            .hasMessageContaining("ERROR: Password too short")
            .hasMessageContaining("req-9")
            .hasMessageNotContaining("hunter2")
            .hasMessageNotContaining("tok-1");
        wireMock.verify(postRequestedFor(urlPathEqualTo("/services/authentication/users"))
            .withRequestBody(containing("roles=user%2Cpower")));
    }

    @Test
    @DisplayName("resource names are encoded as a single path segment")
    void encodesResourceNames() {
        wireMock.stubFor(delete(urlPathEqualTo("/services/saved/searches/Daily%20Errors")).willReturn(okJson("{}")));
        ClusterOpsClient client = client(TestConfigs.apiToken(wireMock.baseUrl(), "tok-1"));

        client.deleteSavedSearch("Daily Errors").join();

        wireMock.verify(1, deleteRequestedFor(urlPathEqualTo("/services/saved/searches/Daily%20Errors")));
    }

    @Test
    @DisplayName("cancelling a resource call during a backoff wait stops the retries")
    void cancellationReachesRetryLoop() {
        // Given
        wireMock.stubFor(post(urlPathEqualTo("/services/data/indexes")).willReturn(aResponse().withStatus(503)));
        CompletableFuture<Void> wait = new CompletableFuture<>();
        ClusterOpsClient client = new ClusterOpsClient(TestConfigs.apiToken(wireMock.baseUrl(), "tok-1"),
            HttpClient.newHttpClient(), new ApiMetrics(registry), duration -> wait, Clock.systemUTC());

        // When
        CompletableFuture<Void> create = client.indexes().create(CreateIndexParams.named("web"));
        await().atMost(5, SECONDS).until(() -> wait.getNumberOfDependents() > 0);
        create.cancel(true);
        wait.complete(null);

        // Then
        assertThat(create).isCancelled();
        assertThat(wait).isCancelled();
        wireMock.verify(1, postRequestedFor(urlPathEqualTo("/services/data/indexes")));
    }

    private ClusterOpsClient client(ClusterOpsConfig config) {
        return new ClusterOpsClient(config, HttpClient.newHttpClient(), new ApiMetrics(registry),
            new RecordingDelayer(), Clock.systemUTC());
    }
}
