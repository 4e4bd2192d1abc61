package tech.clusterops.sdk.transaction;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import tech.clusterops.sdk.dto.CreateIndexParams;
import tech.clusterops.sdk.dto.CreateMacroParams;
import tech.clusterops.sdk.dto.CreateRoleParams;
import tech.clusterops.sdk.dto.CreateSavedSearchParams;
import tech.clusterops.sdk.dto.CreateUserParams;
import tech.clusterops.sdk.dto.ModifyIndexParams;
import tech.clusterops.sdk.dto.ModifyRoleParams;
import tech.clusterops.sdk.dto.ModifyUserParams;
import tech.clusterops.sdk.dto.UpdateMacroParams;
import tech.clusterops.sdk.dto.UpdateSavedSearchParams;

/**
 * One step of a {@link Transaction}: a closed set of configuration changes.
 *
 * <p>Code that acts on operations implements {@link Visitor}, so adding a variant breaks the
 * build until execution and rollback both handle it.
 *
 * <p>Persisted as JSON with a {@code type} discriminator, e.g.
 * {@code {"type":"DeleteIndex","name":"web"}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TransactionOperation.CreateIndex.class, name = "CreateIndex"),
    @JsonSubTypes.Type(value = TransactionOperation.DeleteIndex.class, name = "DeleteIndex"),
    @JsonSubTypes.Type(value = TransactionOperation.ModifyIndex.class, name = "ModifyIndex"),
    @JsonSubTypes.Type(value = TransactionOperation.CreateUser.class, name = "CreateUser"),
    @JsonSubTypes.Type(value = TransactionOperation.DeleteUser.class, name = "DeleteUser"),
    @JsonSubTypes.Type(value = TransactionOperation.ModifyUser.class, name = "ModifyUser"),
    @JsonSubTypes.Type(value = TransactionOperation.CreateRole.class, name = "CreateRole"),
    @JsonSubTypes.Type(value = TransactionOperation.DeleteRole.class, name = "DeleteRole"),
    @JsonSubTypes.Type(value = TransactionOperation.ModifyRole.class, name = "ModifyRole"),
    @JsonSubTypes.Type(value = TransactionOperation.CreateMacro.class, name = "CreateMacro"),
    @JsonSubTypes.Type(value = TransactionOperation.DeleteMacro.class, name = "DeleteMacro"),
    @JsonSubTypes.Type(value = TransactionOperation.UpdateMacro.class, name = "UpdateMacro"),
    @JsonSubTypes.Type(value = TransactionOperation.CreateSavedSearch.class, name = "CreateSavedSearch"),
    @JsonSubTypes.Type(value = TransactionOperation.DeleteSavedSearch.class, name = "DeleteSavedSearch"),
    @JsonSubTypes.Type(value = TransactionOperation.UpdateSavedSearch.class, name = "UpdateSavedSearch")
})
public sealed interface TransactionOperation permits
    TransactionOperation.CreateIndex, TransactionOperation.DeleteIndex, TransactionOperation.ModifyIndex,
    TransactionOperation.CreateUser, TransactionOperation.DeleteUser, TransactionOperation.ModifyUser,
    TransactionOperation.CreateRole, TransactionOperation.DeleteRole, TransactionOperation.ModifyRole,
    TransactionOperation.CreateMacro, TransactionOperation.DeleteMacro, TransactionOperation.UpdateMacro,
    TransactionOperation.CreateSavedSearch, TransactionOperation.DeleteSavedSearch,
    TransactionOperation.UpdateSavedSearch {

    ResourceType resourceType();

    /**
     * Identifying name of the resource touched; must be non-blank.
     */
    String resourceName();

    <R> R accept(Visitor<R> visitor);

    default String kind() {
        return getClass().getSimpleName();
    }

    default String describe() {
        return kind() + " '" + resourceName() + "'";
    }

    interface Visitor<R> {
        R createIndex(CreateIndex op);

        R deleteIndex(DeleteIndex op);

        R modifyIndex(ModifyIndex op);

        R createUser(CreateUser op);

        R deleteUser(DeleteUser op);

        R modifyUser(ModifyUser op);

        R createRole(CreateRole op);

        R deleteRole(DeleteRole op);

        R modifyRole(ModifyRole op);

        R createMacro(CreateMacro op);

        R deleteMacro(DeleteMacro op);

        R updateMacro(UpdateMacro op);

        R createSavedSearch(CreateSavedSearch op);

        R deleteSavedSearch(DeleteSavedSearch op);

        R updateSavedSearch(UpdateSavedSearch op);
    }

    // Indexes

    record CreateIndex(@JsonProperty("params") CreateIndexParams params) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.INDEX;
        }

        @Override
        public String resourceName() {
            return params.name();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.createIndex(this);
        }
    }

    record DeleteIndex(@JsonProperty("name") String name) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.INDEX;
        }

        @Override
        public String resourceName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.deleteIndex(this);
        }
    }

    record ModifyIndex(String name, ModifyIndexParams params) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.INDEX;
        }

        @Override
        public String resourceName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.modifyIndex(this);
        }
    }

    // Users

    record CreateUser(@JsonProperty("params") CreateUserParams params) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.USER;
        }

        @Override
        public String resourceName() {
            return params.name();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.createUser(this);
        }
    }

    record DeleteUser(@JsonProperty("name") String name) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.USER;
        }

        @Override
        public String resourceName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.deleteUser(this);
        }
    }

    record ModifyUser(String name, ModifyUserParams params) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.USER;
        }

        @Override
        public String resourceName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.modifyUser(this);
        }
    }

    // Roles

    record CreateRole(@JsonProperty("params") CreateRoleParams params) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.ROLE;
        }

        @Override
        public String resourceName() {
            return params.name();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.createRole(this);
        }
    }

    record DeleteRole(@JsonProperty("name") String name) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.ROLE;
        }

        @Override
        public String resourceName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.deleteRole(this);
        }
    }

    record ModifyRole(String name, ModifyRoleParams params) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.ROLE;
        }

        @Override
        public String resourceName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.modifyRole(this);
        }
    }

    // Macros

    record CreateMacro(@JsonProperty("params") CreateMacroParams params) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.MACRO;
        }

        @Override
        public String resourceName() {
            return params.name();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.createMacro(this);
        }
    }

    record DeleteMacro(@JsonProperty("name") String name) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.MACRO;
        }

        @Override
        public String resourceName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.deleteMacro(this);
        }
    }

    record UpdateMacro(String name, UpdateMacroParams params) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.MACRO;
        }

        @Override
        public String resourceName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.updateMacro(this);
        }
    }

    // Saved searches

    record CreateSavedSearch(@JsonProperty("params") CreateSavedSearchParams params) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.SAVED_SEARCH;
        }

        @Override
        public String resourceName() {
            return params.name();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.createSavedSearch(this);
        }
    }

    record DeleteSavedSearch(@JsonProperty("name") String name) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.SAVED_SEARCH;
        }

        @Override
        public String resourceName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.deleteSavedSearch(this);
        }
    }

    record UpdateSavedSearch(String name, UpdateSavedSearchParams params) implements TransactionOperation {
        @Override
        public ResourceType resourceType() {
            return ResourceType.SAVED_SEARCH;
        }

        @Override
        public String resourceName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.updateSavedSearch(this);
        }
    }
}
