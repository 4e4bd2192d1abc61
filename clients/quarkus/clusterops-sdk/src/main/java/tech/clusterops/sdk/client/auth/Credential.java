package tech.clusterops.sdk.client.auth;

/**
 * Opaque credential value handed out by the {@link SessionManager}.
 */
public record Credential(String value) {

    public String authorizationHeader() {
        return "Bearer " + value;
    }

    @Override
    public String toString() {
        return "Credential[****]";
    }
}
