package tech.clusterops.sdk.transaction;

/**
 * Kinds of resource a transaction can touch.
 */
public enum ResourceType {
    INDEX("Index name"),
    USER("Username"),
    ROLE("Role name"),
    MACRO("Macro name"),
    SAVED_SEARCH("Saved search name");

    private final String nameLabel;

    ResourceType(String nameLabel) {
        this.nameLabel = nameLabel;
    }

    /**
     * How the identifying name is called in messages, e.g. "Username".
     */
    public String nameLabel() {
        return nameLabel;
    }
}
