package tech.clusterops.sdk.exception;

import tech.clusterops.sdk.transaction.TransactionOperation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when a transaction is rejected before any network call.
 */
public class TransactionValidationException extends ClusterOpsException {

    private final String transactionId;
    private final List<ValidationError> errors;

    public TransactionValidationException(String transactionId, List<ValidationError> errors) {
        super("Transaction " + transactionId + " is invalid: " + errors.stream()
            .map(ValidationError::toString)
            .collect(Collectors.joining("; ")));
        this.transactionId = transactionId;
        this.errors = List.copyOf(errors);
    }

    public String getTransactionId() {
        return transactionId;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    /**
     * A single rejected operation.
     *
     * @param index zero-based position of the operation in the transaction
     */
    public record ValidationError(int index, TransactionOperation operation, String message) {
        @Override
        public String toString() {
            return "operation " + (index + 1) + " (" + operation.kind() + "): " + message;
        }
    }
}
