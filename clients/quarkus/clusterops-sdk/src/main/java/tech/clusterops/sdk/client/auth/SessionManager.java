package tech.clusterops.sdk.client.auth;

import org.jboss.logging.Logger;
import tech.clusterops.sdk.exception.AuthenticationException;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active {@link AuthStrategy} and hands out credentials.
 *
 * <p>For session authentication the token lives in a single slot holding either a completed
 * token or the one in-flight login. Callers that find the token absent or near expiry race to
 * swap in a new login future; exactly one wins and issues the login, the rest await the same
 * future. Tokens are immutable, so a reader sees the old token or the new one, never a mix.
 *
 * <p>A failed login fails every waiter with {@link AuthenticationException} and is replaced by
 * the next caller. Expired tokens are never handed out as a fallback.
 */
public class SessionManager {

    private static final Logger LOG = Logger.getLogger(SessionManager.class);

    private final AuthStrategy strategy;
    private final SessionLogin login;
    private final Duration ttl;
    private final Duration expiryBuffer;
    private final Clock clock;
    private final AtomicReference<CompletableFuture<SessionToken>> slot = new AtomicReference<>();
    private volatile boolean everAuthenticated;

    public SessionManager(AuthStrategy strategy, SessionLogin login, Duration ttl, Duration expiryBuffer,
                          Clock clock) {
        if (expiryBuffer.compareTo(ttl) > 0) {
            throw new IllegalArgumentException("expiryBuffer " + expiryBuffer + " exceeds session ttl " + ttl);
        }
        this.strategy = strategy;
        this.login = login;
        this.ttl = ttl;
        this.expiryBuffer = expiryBuffer;
        this.clock = clock;
    }

    public AuthStrategy strategy() {
        return strategy;
    }

    public boolean isApiToken() {
        return strategy instanceof AuthStrategy.ApiToken;
    }

    /**
     * Credential for the next request, logging in first when the session is absent or near expiry.
     */
    public CompletableFuture<Credential> getCredential() {
        if (strategy instanceof AuthStrategy.ApiToken apiToken) {
            return CompletableFuture.completedFuture(new Credential(apiToken.token()));
        }
        return currentSession().thenApply(token -> new Credential(token.value()));
    }

    /**
     * Drop the session token if it is still the one behind {@code rejected}, so the next
     * {@link #getCredential()} logs in again.
     *
     * @return true if a fresh credential can be obtained; always false for API tokens
     */
    public boolean invalidate(Credential rejected) {
        if (isApiToken()) {
            return false;
        }
        CompletableFuture<SessionToken> current = slot.get();
        if (current != null && current.isDone() && !current.isCompletedExceptionally()
                && current.join().value().equals(rejected.value())) {
            if (slot.compareAndSet(current, null)) {
                LOG.debug("Session token rejected by server, cleared for re-authentication");
            }
        }
        return true;
    }

    public SessionState state() {
        if (isApiToken()) {
            return SessionState.API_TOKEN;
        }
        CompletableFuture<SessionToken> current = slot.get();
        if (current == null || current.isCompletedExceptionally()) {
            return SessionState.UNAUTHENTICATED;
        }
        if (!current.isDone()) {
            return everAuthenticated ? SessionState.REFRESHING : SessionState.AUTHENTICATING;
        }
        return SessionState.AUTHENTICATED;
    }

    private CompletableFuture<SessionToken> currentSession() {
        while (true) {
            CompletableFuture<SessionToken> current = slot.get();
            if (current != null && (!current.isDone() || isUsable(current))) {
                return current;
            }
            CompletableFuture<SessionToken> refresh = new CompletableFuture<>();
            if (slot.compareAndSet(current, refresh)) {
                startLogin(refresh);
                return refresh;
            }
        }
    }

    private boolean isUsable(CompletableFuture<SessionToken> done) {
        return !done.isCompletedExceptionally() && !done.join().isNearExpiry(clock.instant());
    }

    private void startLogin(CompletableFuture<SessionToken> refresh) {
        var credentials = (AuthStrategy.SessionCredentials) strategy;
        String username = credentials.username();
        LOG.debugf("%s session for user '%s'", everAuthenticated ? "Refreshing" : "Opening", username);

        CompletableFuture<String> pending;
        try {
            pending = login.login(username, credentials.password());
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        pending.whenComplete((value, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
                LOG.warnf("Session login failed for user '%s': %s", username, cause.getMessage());
                refresh.completeExceptionally(cause instanceof AuthenticationException
                    ? cause : AuthenticationException.loginFailed(username, cause));
            } else if (value == null || value.isBlank()) {
                refresh.completeExceptionally(AuthenticationException.missingSessionKey(username));
            } else {
                everAuthenticated = true;
                refresh.complete(new SessionToken(value, clock.instant(), ttl, expiryBuffer));
            }
        });
    }

    @Override
    public String toString() {
        return "SessionManager[strategy=" + strategy + ", state=" + state() + "]";
    }
}
