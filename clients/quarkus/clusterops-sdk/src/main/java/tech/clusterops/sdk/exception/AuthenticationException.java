package tech.clusterops.sdk.exception;

/**
 * Exception thrown when a credential cannot be obtained or refreshed.
 *
 * <p>Messages name the user at most; passwords and tokens never appear.
 */
public class AuthenticationException extends ClusterOpsException {

    public AuthenticationException(String message) {
        super(message, 401);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, 401, cause, null);
    }

    public static AuthenticationException missingCredentials() {
        return new AuthenticationException(
            "No credentials configured. Set clusterops.auth.api-token or clusterops.auth.username and password"
        );
    }

    public static AuthenticationException loginFailed(String username, Throwable cause) {
        return new AuthenticationException("Failed to obtain a session token for user '" + username + "'", cause);
    }

    public static AuthenticationException missingSessionKey(String username) {
        return new AuthenticationException("Login response for user '" + username + "' carried no session key");
    }
}
