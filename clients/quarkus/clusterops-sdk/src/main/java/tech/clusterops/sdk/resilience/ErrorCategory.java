package tech.clusterops.sdk.resilience;

/**
 * Closed taxonomy of per-attempt failures, used for retry decisions and metric labels.
 */
public enum ErrorCategory {
    /** Connection refused, DNS failure, connection reset. */
    TRANSPORT("transport"),
    /** HTTP 4xx responses. */
    HTTP_4XX("http_4xx"),
    /** HTTP 5xx responses. */
    HTTP_5XX("http_5xx"),
    /** Error response with a status outside 4xx/5xx. */
    API("api"),
    /** Connect or response timeout. */
    TIMEOUT("timeout"),
    /** TLS handshake or certificate failure. */
    TLS("tls"),
    /** Anything else, including unreadable response bodies. */
    UNKNOWN("unknown");

    private final String label;

    ErrorCategory(String label) {
        this.label = label;
    }

    /**
     * Stable lowercase label used as the {@code category} metric tag.
     */
    public String label() {
        return label;
    }
}
