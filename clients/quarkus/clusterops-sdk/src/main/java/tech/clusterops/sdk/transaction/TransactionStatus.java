package tech.clusterops.sdk.transaction;

/**
 * Lifecycle of a transaction: BUILDING, VALIDATING, COMMITTING, then COMMITTED or ROLLED_BACK.
 * ABANDONED marks a pending transaction an operator chose to discard.
 */
public enum TransactionStatus {
    BUILDING("building"),
    VALIDATING("validating"),
    COMMITTING("committing"),
    COMMITTED("committed"),
    ROLLED_BACK("rolled_back"),
    ABANDONED("abandoned");

    private final String label;

    TransactionStatus(String label) {
        this.label = label;
    }

    /**
     * Lowercase form used in archive file names.
     */
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == ABANDONED;
    }
}
