package tech.clusterops.sdk.exception;

/**
 * Exception thrown when the pending transaction file or its archive cannot be read or written.
 */
public class TransactionLogException extends ClusterOpsException {

    public TransactionLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
