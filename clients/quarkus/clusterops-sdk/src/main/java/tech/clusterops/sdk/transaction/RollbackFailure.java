package tech.clusterops.sdk.transaction;

/**
 * A compensating call that failed or timed out during rollback.
 *
 * @param action compensating action attempted, e.g. {@code delete_index}
 * @param error  failure description
 */
public record RollbackFailure(TransactionOperation operation, String action, String error) {

    @Override
    public String toString() {
        return action + " '" + operation.resourceName() + "' (" + error + ")";
    }
}
