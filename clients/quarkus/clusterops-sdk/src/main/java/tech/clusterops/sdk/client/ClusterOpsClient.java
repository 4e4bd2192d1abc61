package tech.clusterops.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.clusterops.sdk.client.auth.AuthStrategy;
import tech.clusterops.sdk.client.auth.Credential;
import tech.clusterops.sdk.client.auth.SessionManager;
import tech.clusterops.sdk.client.resources.Indexes;
import tech.clusterops.sdk.client.resources.Macros;
import tech.clusterops.sdk.client.resources.Roles;
import tech.clusterops.sdk.client.resources.SavedSearches;
import tech.clusterops.sdk.client.resources.Users;
import tech.clusterops.sdk.config.ClusterOpsConfig;
import tech.clusterops.sdk.dto.CreateIndexParams;
import tech.clusterops.sdk.dto.CreateMacroParams;
import tech.clusterops.sdk.dto.CreateRoleParams;
import tech.clusterops.sdk.dto.CreateSavedSearchParams;
import tech.clusterops.sdk.dto.CreateUserParams;
import tech.clusterops.sdk.dto.ModifyIndexParams;
import tech.clusterops.sdk.dto.ModifyRoleParams;
import tech.clusterops.sdk.dto.ModifyUserParams;
import tech.clusterops.sdk.dto.UpdateMacroParams;
import tech.clusterops.sdk.dto.UpdateSavedSearchParams;
import tech.clusterops.sdk.exception.ApiCallException;
import tech.clusterops.sdk.exception.InvalidResponseException;
import tech.clusterops.sdk.metrics.ApiMetrics;
import tech.clusterops.sdk.resilience.Delayer;
import tech.clusterops.sdk.resilience.ErrorCategory;
import tech.clusterops.sdk.resilience.ErrorClassifier;
import tech.clusterops.sdk.resilience.ResilientExecutor;
import tech.clusterops.sdk.resilience.RetryScheduler;
import tech.clusterops.sdk.support.ObjectMappers;
import tech.clusterops.sdk.transaction.ResourceOperations;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Main client for the cluster management API.
 *
 * <p>Every call obtains its credential from the {@link SessionManager} and runs through the
 * {@link ResilientExecutor}. With session authentication a 401 or 403 clears the session and
 * the call is repeated once with a fresh login.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * ClusterOpsClient client;
 *
 * client.indexes().create(CreateIndexParams.named("web")).join();
 * client.users().delete("bob").join();
 * }</pre>
 */
@ApplicationScoped
public class ClusterOpsClient implements ResourceOperations {

    private static final Logger LOG = Logger.getLogger(ClusterOpsClient.class);

    static final String LOGIN_PATH = "/services/auth/login";

    private final String baseUrl;
    private final Duration requestTimeout;
    private final int maxRetries;
    private final ObjectMapper objectMapper;
    private final ApiMetrics metrics;
    private final ResilientExecutor executor;
    private final SessionManager sessionManager;

    private final Indexes indexes = new Indexes(this);
    private final Users users = new Users(this);
    private final Roles roles = new Roles(this);
    private final Macros macros = new Macros(this);
    private final SavedSearches savedSearches = new SavedSearches(this);

    @Inject
    public ClusterOpsClient(ClusterOpsConfig config, ApiMetrics metrics) {
        this(config,
            HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.http().connectTimeout()))
                .build(),
            metrics,
            Delayer.nonBlocking(),
            Clock.systemUTC());
    }

    /**
     * Client that records metrics to a private in-memory registry.
     */
    public ClusterOpsClient(ClusterOpsConfig config) {
        this(config, ApiMetrics.inMemory());
    }

    public ClusterOpsClient(ClusterOpsConfig config, HttpClient httpClient, ApiMetrics metrics,
                            Delayer delayer, Clock clock) {
        this.baseUrl = config.baseUrl().replaceAll("/+$", "");
        this.requestTimeout = Duration.ofSeconds(config.http().requestTimeout());
        this.maxRetries = config.http().maxRetries();
        this.objectMapper = ObjectMappers.create();
        this.metrics = metrics;
        this.executor = new ResilientExecutor(
            httpClient,
            new ErrorClassifier(metrics, objectMapper),
            new RetryScheduler(Duration.ofMillis(config.http().baseDelayMs()), clock),
            delayer,
            metrics);
        this.sessionManager = new SessionManager(
            AuthStrategy.fromConfig(config.auth()),
            this::login,
            Duration.ofSeconds(config.auth().sessionTtl()),
            Duration.ofSeconds(config.auth().expiryBuffer()),
            clock);
    }

    public Indexes indexes() {
        return indexes;
    }

    public Users users() {
        return users;
    }

    public Roles roles() {
        return roles;
    }

    public Macros macros() {
        return macros;
    }

    public SavedSearches savedSearches() {
        return savedSearches;
    }

    /**
     * Make an authenticated API request and read the response body.
     *
     * <p>Cancelling the returned future cancels the underlying call, including any pending retry.
     *
     * @param path     request path with encoded segments
     * @param endpoint templated label used in metrics and errors, e.g. {@code /services/data/indexes/{name}}
     */
    public <T> CompletableFuture<T> request(String method, String path, String endpoint, FormBody form,
                                            TypeReference<T> responseType) {
        Exchange<T> exchange = new Exchange<>(method, path, endpoint, form,
            response -> readBody(response, endpoint, method, responseType));
        exchange.start();
        return exchange.result;
    }

    /**
     * Make an authenticated API request whose response body is not needed. A non-empty body must
     * still be JSON.
     */
    public CompletableFuture<Void> requestVoid(String method, String path, String endpoint, FormBody form) {
        Exchange<Void> exchange = new Exchange<>(method, path, endpoint, form, response -> {
            String body = response.body();
            if (body != null && !body.isBlank()) {
                readBody(response, endpoint, method, new TypeReference<JsonNode>() {});
            }
            return null;
        });
        exchange.start();
        return exchange.result;
    }

    /**
     * One authenticated call: credential, execution through the retry engine, and at most one
     * re-authentication for a rejected session token. The shared credential future is never
     * cancelled; the executor call is.
     */
    private final class Exchange<T> {

        final CompletableFuture<T> result = new CompletableFuture<>();
        final String method;
        final String path;
        final String endpoint;
        final FormBody form;
        final Function<HttpResponse<String>, T> reader;
        volatile CompletableFuture<?> inFlight;

        Exchange(String method, String path, String endpoint, FormBody form,
                 Function<HttpResponse<String>, T> reader) {
            this.method = method;
            this.path = path;
            this.endpoint = endpoint;
            this.form = form;
            this.reader = reader;
            result.whenComplete((value, error) -> {
                CompletableFuture<?> pending = inFlight;
                if (result.isCancelled() && pending != null) {
                    LOG.debugf("%s %s cancelled by caller", method, endpoint);
                    pending.cancel(true);
                }
            });
        }

        void start() {
            sessionManager.getCredential().whenComplete((credential, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                } else {
                    attempt(credential, true);
                }
            });
        }

        void attempt(Credential credential, boolean mayReauthenticate) {
            if (result.isDone()) {
                return;
            }
            CompletableFuture<HttpResponse<String>> call;
            try {
                call = execute(method, path, endpoint, form, credential);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }
            inFlight = call;
            if (result.isCancelled()) {
                call.cancel(true);
                return;
            }
            call.whenComplete((response, error) -> {
                if (error == null) {
                    complete(response);
                    return;
                }
                Throwable cause = unwrap(error);
                if (mayReauthenticate && cause instanceof ApiCallException apiError && apiError.isAuthRejection()
                        && sessionManager.invalidate(credential)) {
                    LOG.debugf("%s %s rejected with %d, re-authenticating once",
                        method, endpoint, apiError.getStatusCode());
                    sessionManager.getCredential().whenComplete((fresh, loginError) -> {
                        if (loginError != null) {
                            result.completeExceptionally(unwrap(loginError));
                        } else {
                            attempt(fresh, false);
                        }
                    });
                    return;
                }
                result.completeExceptionally(cause);
            });
        }

        void complete(HttpResponse<String> response) {
            try {
                result.complete(reader.apply(response));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }
    }

    private CompletableFuture<HttpResponse<String>> execute(String method, String path, String endpoint,
                                                            FormBody form, Credential credential) {
        return executor.execute(() -> buildRequest(method, path, form, credential), endpoint, method, maxRetries);
    }

    private HttpRequest buildRequest(String method, String path, FormBody form, Credential credential) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path + "?output_mode=json"))
            .header("Accept", "application/json")
            .timeout(requestTimeout);
        if (credential != null) {
            builder.header("Authorization", credential.authorizationHeader());
        }
        if (form != null) {
            builder.header("Content-Type", "application/x-www-form-urlencoded")
                .method(method, HttpRequest.BodyPublishers.ofString(form.encode()));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private <T> T readBody(HttpResponse<String> response, String endpoint, String method,
                           TypeReference<T> responseType) {
        try {
            return objectMapper.readValue(response.body(), responseType);
        } catch (IOException e) {
            metrics.recordError(endpoint, method, ErrorCategory.UNKNOWN);
            throw new InvalidResponseException(
                executor.classifier().classifyInvalidBody(response.statusCode(), e, endpoint, method),
                endpoint, method);
        }
    }

    /**
     * Exchange username and password for a session key. Runs through the retry engine but never
     * carries an Authorization header.
     */
    private CompletableFuture<String> login(String username, String password) {
        FormBody form = FormBody.create()
            .add("username", username)
            .add("password", password);
        return executor.execute(() -> buildRequest("POST", LOGIN_PATH, form, null), LOGIN_PATH, "POST", maxRetries)
            .thenApply(response -> {
                JsonNode body = readBody(response, LOGIN_PATH, "POST", new TypeReference<JsonNode>() {});
                JsonNode sessionKey = body == null ? null : body.get("sessionKey");
                return sessionKey != null && sessionKey.isTextual() ? sessionKey.asText() : null;
            });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // ResourceOperations

    @Override
    public CompletableFuture<Void> createIndex(CreateIndexParams params) {
        return indexes.create(params);
    }

    @Override
    public CompletableFuture<Void> deleteIndex(String name) {
        return indexes.delete(name);
    }

    @Override
    public CompletableFuture<Void> modifyIndex(String name, ModifyIndexParams params) {
        return indexes.modify(name, params);
    }

    @Override
    public CompletableFuture<Void> createUser(CreateUserParams params) {
        return users.create(params);
    }

    @Override
    public CompletableFuture<Void> deleteUser(String name) {
        return users.delete(name);
    }

    @Override
    public CompletableFuture<Void> modifyUser(String name, ModifyUserParams params) {
        return users.modify(name, params);
    }

    @Override
    public CompletableFuture<Void> createRole(CreateRoleParams params) {
        return roles.create(params);
    }

    @Override
    public CompletableFuture<Void> deleteRole(String name) {
        return roles.delete(name);
    }

    @Override
    public CompletableFuture<Void> modifyRole(String name, ModifyRoleParams params) {
        return roles.modify(name, params);
    }

    @Override
    public CompletableFuture<Void> createMacro(CreateMacroParams params) {
        return macros.create(params);
    }

    @Override
    public CompletableFuture<Void> deleteMacro(String name) {
        return macros.delete(name);
    }

    @Override
    public CompletableFuture<Void> updateMacro(String name, UpdateMacroParams params) {
        return macros.update(name, params);
    }

    @Override
    public CompletableFuture<Void> createSavedSearch(CreateSavedSearchParams params) {
        return savedSearches.create(params);
    }

    @Override
    public CompletableFuture<Void> deleteSavedSearch(String name) {
        return savedSearches.delete(name);
    }

    @Override
    public CompletableFuture<Void> updateSavedSearch(String name, UpdateSavedSearchParams params) {
        return savedSearches.update(name, params);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public ApiMetrics metrics() {
        return metrics;
    }

    public SessionManager sessionManager() {
        return sessionManager;
    }
}
