package tech.clusterops.sdk.client.resources;

import tech.clusterops.sdk.client.ClusterOpsClient;
import tech.clusterops.sdk.client.FormBody;
import tech.clusterops.sdk.dto.CreateRoleParams;
import tech.clusterops.sdk.dto.ModifyRoleParams;
import tech.clusterops.sdk.support.UrlEncoding;

import java.util.concurrent.CompletableFuture;

/**
 * Resource for managing roles.
 */
public class Roles {

    static final String COLLECTION = "/services/authorization/roles";
    static final String ITEM = COLLECTION + "/{name}";

    private final ClusterOpsClient client;

    public Roles(ClusterOpsClient client) {
        this.client = client;
    }

    /**
     * Create a new role.
     */
    public CompletableFuture<Void> create(CreateRoleParams params) {
        FormBody form = FormBody.create()
            .add("name", params.name())
            .addJoined("capabilities", params.capabilities())
            .addJoined("searchIndexes", params.searchIndexes())
            .add("searchFilter", params.searchFilter())
            .addJoined("importedRoles", params.importedRoles())
            .add("defaultApp", params.defaultApp());
        return client.requestVoid("POST", COLLECTION, COLLECTION, form);
    }

    /**
     * Update a role.
     */
    public CompletableFuture<Void> modify(String name, ModifyRoleParams params) {
        FormBody form = FormBody.create()
            .addJoined("capabilities", params.capabilities())
            .addJoined("searchIndexes", params.searchIndexes())
            .add("searchFilter", params.searchFilter())
            .addJoined("importedRoles", params.importedRoles())
            .add("defaultApp", params.defaultApp());
        return client.requestVoid("POST", COLLECTION + "/" + UrlEncoding.pathSegment(name), ITEM, form);
    }

    /**
     * Delete a role.
     */
    public CompletableFuture<Void> delete(String name) {
        return client.requestVoid("DELETE", COLLECTION + "/" + UrlEncoding.pathSegment(name), ITEM, null);
    }
}
