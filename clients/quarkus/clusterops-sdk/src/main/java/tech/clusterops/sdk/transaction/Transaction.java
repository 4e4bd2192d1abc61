package tech.clusterops.sdk.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.tsid.TsidCreator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered list of operations applied as one unit, with named savepoints.
 *
 * <p>Operations and savepoints may only change while the transaction is {@code BUILDING}.
 * Savepoint positions never exceed the number of operations.
 */
public class Transaction {

    private final String id;
    private final List<TransactionOperation> operations;
    private final Map<String, Integer> savepoints;
    private final Instant createdAt;
    private volatile TransactionStatus status;

    @JsonCreator
    Transaction(@JsonProperty("id") String id,
                @JsonProperty("operations") List<TransactionOperation> operations,
                @JsonProperty("savepoints") Map<String, Integer> savepoints,
                @JsonProperty("createdAt") Instant createdAt,
                @JsonProperty("status") TransactionStatus status) {
        this.id = Objects.requireNonNull(id, "id");
        this.operations = operations != null ? new ArrayList<>(operations) : new ArrayList<>();
        this.savepoints = savepoints != null ? new LinkedHashMap<>(savepoints) : new LinkedHashMap<>();
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.status = status != null ? status : TransactionStatus.BUILDING;
    }

    /**
     * New empty transaction with a time-sorted id.
     */
    public static Transaction begin(Clock clock) {
        return new Transaction(TsidCreator.getTsid().toString(), null, null, clock.instant(), null);
    }

    @JsonProperty("id")
    public String id() {
        return id;
    }

    @JsonProperty("operations")
    public List<TransactionOperation> operations() {
        return Collections.unmodifiableList(operations);
    }

    @JsonProperty("savepoints")
    public Map<String, Integer> savepoints() {
        return Collections.unmodifiableMap(savepoints);
    }

    @JsonProperty("createdAt")
    public Instant createdAt() {
        return createdAt;
    }

    @JsonProperty("status")
    public TransactionStatus status() {
        return status;
    }

    public Transaction addOperation(TransactionOperation operation) {
        requireBuilding();
        operations.add(Objects.requireNonNull(operation, "operation"));
        return this;
    }

    /**
     * Mark the current end of the operation list. Reusing a name moves the savepoint.
     */
    public void setSavepoint(String name) {
        requireBuilding();
        savepoints.put(Objects.requireNonNull(name, "name"), operations.size());
    }

    /**
     * Drop every operation added after the named savepoint, along with savepoints that pointed
     * past the new end.
     *
     * @return false if no such savepoint exists
     */
    public boolean rollbackToSavepoint(String name) {
        requireBuilding();
        Integer position = savepoints.get(name);
        if (position == null) {
            return false;
        }
        operations.subList(position, operations.size()).clear();
        savepoints.values().removeIf(p -> p > position);
        return true;
    }

    void transitionTo(TransactionStatus next) {
        this.status = next;
    }

    private void requireBuilding() {
        if (status != TransactionStatus.BUILDING) {
            throw new IllegalStateException("Transaction " + id + " is " + status.label() + " and can no longer change");
        }
    }

    @Override
    public String toString() {
        return "Transaction[id=" + id + ", operations=" + operations.size() + ", status=" + status.label() + "]";
    }
}
