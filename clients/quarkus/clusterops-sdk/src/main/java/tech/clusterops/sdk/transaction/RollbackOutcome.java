package tech.clusterops.sdk.transaction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What the automatic rollback achieved for the operations completed before a failure.
 *
 * @param completedCount operations that had completed when the failure occurred
 * @param rolledBack     operations successfully reversed, in rollback order
 * @param failures       compensating calls that failed; these need manual cleanup
 * @param unsupported    operations with no automatic inverse (deletes and modifies), left as they are
 */
public record RollbackOutcome(
    int completedCount,
    List<TransactionOperation> rolledBack,
    List<RollbackFailure> failures,
    List<TransactionOperation> unsupported
) {
    public RollbackOutcome {
        rolledBack = List.copyOf(rolledBack);
        failures = List.copyOf(failures);
        unsupported = List.copyOf(unsupported);
    }

    public static RollbackOutcome nothingToRollBack() {
        return new RollbackOutcome(0, List.of(), List.of(), List.of());
    }

    public int rolledBackCount() {
        return rolledBack.size();
    }

    public boolean requiresManualCleanup() {
        return !failures.isEmpty();
    }

    public boolean isComplete() {
        return failures.isEmpty() && unsupported.isEmpty();
    }

    /**
     * Operator-facing summary, e.g. "rolled back 1 of 2 completed operations; rollback also
     * failed for these operations, manual cleanup required: delete_index 'web' (HTTP 500: ...)".
     */
    public String summary() {
        StringBuilder summary = new StringBuilder()
            .append("rolled back ").append(rolledBack.size())
            .append(" of ").append(completedCount).append(" completed operations");
        if (!failures.isEmpty()) {
            summary.append("; rollback also failed for these operations, manual cleanup required: ")
                .append(failures.stream().map(RollbackFailure::toString).collect(Collectors.joining(", ")));
        }
        if (!unsupported.isEmpty()) {
            summary.append("; no automated rollback path for: ")
                .append(unsupported.stream().map(TransactionOperation::describe).collect(Collectors.joining(", ")));
        }
        return summary.toString();
    }
}
