package tech.clusterops.sdk.transaction;

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

import java.util.concurrent.CompletableFuture;

/**
 * Remote calls a transaction is made of. Implemented by
 * {@link tech.clusterops.sdk.client.ClusterOpsClient}; each call is retried independently.
 */
public interface ResourceOperations {

    CompletableFuture<Void> createIndex(CreateIndexParams params);

    CompletableFuture<Void> deleteIndex(String name);

    CompletableFuture<Void> modifyIndex(String name, ModifyIndexParams params);

    CompletableFuture<Void> createUser(CreateUserParams params);

    CompletableFuture<Void> deleteUser(String name);

    CompletableFuture<Void> modifyUser(String name, ModifyUserParams params);

    CompletableFuture<Void> createRole(CreateRoleParams params);

    CompletableFuture<Void> deleteRole(String name);

    CompletableFuture<Void> modifyRole(String name, ModifyRoleParams params);

    CompletableFuture<Void> createMacro(CreateMacroParams params);

    CompletableFuture<Void> deleteMacro(String name);

    CompletableFuture<Void> updateMacro(String name, UpdateMacroParams params);

    CompletableFuture<Void> createSavedSearch(CreateSavedSearchParams params);

    CompletableFuture<Void> deleteSavedSearch(String name);

    CompletableFuture<Void> updateSavedSearch(String name, UpdateSavedSearchParams params);
}
