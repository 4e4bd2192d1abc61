package tech.clusterops.sdk.client.auth;

import java.util.concurrent.CompletableFuture;

/**
 * Exchanges a username and password for a session token.
 */
@FunctionalInterface
public interface SessionLogin {

    CompletableFuture<String> login(String username, String password);
}
