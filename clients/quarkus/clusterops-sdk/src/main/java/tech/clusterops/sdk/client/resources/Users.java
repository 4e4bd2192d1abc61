package tech.clusterops.sdk.client.resources;

import tech.clusterops.sdk.client.ClusterOpsClient;
import tech.clusterops.sdk.client.FormBody;
import tech.clusterops.sdk.dto.CreateUserParams;
import tech.clusterops.sdk.dto.ModifyUserParams;
import tech.clusterops.sdk.support.UrlEncoding;

import java.util.concurrent.CompletableFuture;

/**
 * Resource for managing users.
 */
public class Users {

    static final String COLLECTION = "/services/authentication/users";
    static final String ITEM = COLLECTION + "/{name}";

    private final ClusterOpsClient client;

    public Users(ClusterOpsClient client) {
        this.client = client;
    }

    /**
     * Create a user. Roles are sent as one comma-separated value.
     */
    public CompletableFuture<Void> create(CreateUserParams params) {
        FormBody form = FormBody.create()
            .add("name", params.name())
            .add("password", params.password())
            .addJoined("roles", params.roles())
            .add("realname", params.realName())
            .add("email", params.email())
            .add("defaultApp", params.defaultApp());
        return client.requestVoid("POST", COLLECTION, COLLECTION, form);
    }

    /**
     * Update a user.
     */
    public CompletableFuture<Void> modify(String name, ModifyUserParams params) {
        FormBody form = FormBody.create()
            .add("password", params.password())
            .addJoined("roles", params.roles())
            .add("realname", params.realName())
            .add("email", params.email())
            .add("defaultApp", params.defaultApp());
        return client.requestVoid("POST", COLLECTION + "/" + UrlEncoding.pathSegment(name), ITEM, form);
    }

    public CompletableFuture<Void> delete(String name) {
        return client.requestVoid("DELETE", COLLECTION + "/" + UrlEncoding.pathSegment(name), ITEM, null);
    }
}
