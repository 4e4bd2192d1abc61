package tech.clusterops.sdk.client.auth;

public enum SessionState {
    /** Static API token; nothing to manage. */
    API_TOKEN,
    UNAUTHENTICATED,
    AUTHENTICATING,
    AUTHENTICATED,
    REFRESHING
}
