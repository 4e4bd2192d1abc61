package tech.clusterops.sdk.client.auth;

import tech.clusterops.sdk.config.ClusterOpsConfig;
import tech.clusterops.sdk.exception.AuthenticationException;

import java.util.Objects;

/**
 * How the client authenticates. Secrets are redacted from {@code toString}.
 */
public sealed interface AuthStrategy permits AuthStrategy.ApiToken, AuthStrategy.SessionCredentials {

    /**
     * Static API token. Sent as-is and never refreshed.
     */
    record ApiToken(String token) implements AuthStrategy {
        public ApiToken {
            Objects.requireNonNull(token, "token");
        }

        @Override
        public String toString() {
            return "ApiToken[token=****]";
        }
    }

    /**
     * Username and password, exchanged for a short-lived session token.
     */
    record SessionCredentials(String username, String password) implements AuthStrategy {
        public SessionCredentials {
            Objects.requireNonNull(username, "username");
            Objects.requireNonNull(password, "password");
        }

        @Override
        public String toString() {
            return "SessionCredentials[username=" + username + ", password=****]";
        }
    }

    /**
     * Pick the strategy from configuration. An API token wins when both are configured.
     */
    static AuthStrategy fromConfig(ClusterOpsConfig.AuthConfig auth) {
        var token = auth.apiToken().filter(t -> !t.isBlank());
        if (token.isPresent()) {
            return new ApiToken(token.get());
        }
        var username = auth.username().filter(u -> !u.isBlank());
        var password = auth.password();
        if (username.isPresent() && password.isPresent()) {
            return new SessionCredentials(username.get(), password.get());
        }
        throw AuthenticationException.missingCredentials();
    }
}
