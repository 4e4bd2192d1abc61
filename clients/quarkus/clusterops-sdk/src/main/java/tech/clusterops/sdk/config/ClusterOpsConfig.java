package tech.clusterops.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the ClusterOps SDK.
 *
 * <p>Configure in application.properties:
 * <pre>
 * clusterops.base-url=https://cluster.example.com:8089
 * clusterops.auth.username=admin
 * clusterops.auth.password=changeme
 * # or
 * clusterops.auth.api-token=your_token
 * </pre>
 */
@ConfigMapping(prefix = "clusterops")
public interface ClusterOpsConfig {

    /**
     * Base URL of the management API.
     */
    @WithName("base-url")
    @WithDefault("https://localhost:8089")
    String baseUrl();

    AuthConfig auth();

    HttpConfig http();

    TransactionConfig transaction();

    interface AuthConfig {
        /**
         * Static API token. Takes precedence over username/password.
         */
        @WithName("api-token")
        Optional<String> apiToken();

        Optional<String> username();

        Optional<String> password();

        /**
         * Lifetime of a session token in seconds.
         */
        @WithName("session-ttl")
        @WithDefault("3600")
        int sessionTtl();

        /**
         * Seconds before expiry at which a session token is refreshed proactively.
         */
        @WithName("expiry-buffer")
        @WithDefault("60")
        int expiryBuffer();
    }

    interface HttpConfig {
        /**
         * Connect timeout in seconds.
         */
        @WithName("connect-timeout")
        @WithDefault("10")
        int connectTimeout();

        /**
         * Per-attempt response timeout in seconds.
         */
        @WithName("request-timeout")
        @WithDefault("30")
        int requestTimeout();

        /**
         * Retries allowed after the first attempt of a call.
         */
        @WithName("max-retries")
        @WithDefault("3")
        int maxRetries();

        /**
         * Delay before the first retry in milliseconds; doubles for every further retry.
         */
        @WithName("base-delay-ms")
        @WithDefault("1000")
        long baseDelayMs();
    }

    interface TransactionConfig {
        /**
         * Directory holding pending_transaction.json and the history/ archive.
         */
        @WithName("log-dir")
        @WithDefault("${user.home}/.clusterops/transactions")
        String logDir();

        /**
         * Timeout in seconds for each rollback cleanup call.
         */
        @WithName("rollback-timeout")
        @WithDefault("30")
        int rollbackTimeout();
    }
}
