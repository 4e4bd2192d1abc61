package tech.clusterops.sdk.exception;

import tech.clusterops.sdk.transaction.RollbackOutcome;
import tech.clusterops.sdk.transaction.TransactionOperation;

/**
 * An operation failed mid-commit. Carries the failed operation, its original error and what
 * the automatic rollback managed to undo.
 */
public class TransactionFailedException extends ClusterOpsException {

    private final String transactionId;
    private final int failedIndex;
    private final TransactionOperation failedOperation;
    private final RollbackOutcome rollbackOutcome;

    public TransactionFailedException(String transactionId, int failedIndex, int operationCount,
                                      TransactionOperation failedOperation, Throwable cause,
                                      RollbackOutcome rollbackOutcome) {
        super(String.format("Transaction %s: operation %d of %d (%s) failed: %s; %s",
                transactionId, failedIndex + 1, operationCount, failedOperation.describe(),
                cause.getMessage(), rollbackOutcome.summary()),
            cause instanceof ClusterOpsException e ? e.getStatusCode() : 0, cause, null);
        this.transactionId = transactionId;
        this.failedIndex = failedIndex;
        this.failedOperation = failedOperation;
        this.rollbackOutcome = rollbackOutcome;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public int getFailedIndex() {
        return failedIndex;
    }

    public TransactionOperation getFailedOperation() {
        return failedOperation;
    }

    public RollbackOutcome getRollbackOutcome() {
        return rollbackOutcome;
    }
}
