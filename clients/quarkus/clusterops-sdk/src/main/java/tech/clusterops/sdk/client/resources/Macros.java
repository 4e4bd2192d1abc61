package tech.clusterops.sdk.client.resources;

import tech.clusterops.sdk.client.ClusterOpsClient;
import tech.clusterops.sdk.client.FormBody;
import tech.clusterops.sdk.dto.CreateMacroParams;
import tech.clusterops.sdk.dto.UpdateMacroParams;
import tech.clusterops.sdk.support.UrlEncoding;

import java.util.concurrent.CompletableFuture;

/**
 * Resource for managing search macros.
 */
public class Macros {

    static final String COLLECTION = "/services/admin/macros";
    static final String ITEM = COLLECTION + "/{name}";

    private final ClusterOpsClient client;

    public Macros(ClusterOpsClient client) {
        this.client = client;
    }

    public CompletableFuture<Void> create(CreateMacroParams params) {
        FormBody form = FormBody.create()
            .add("name", params.name())
            .add("definition", params.definition())
            .add("args", params.args())
            .add("description", params.description())
            .add("disabled", params.disabled())
            .add("iseval", params.iseval())
            .add("validation", params.validation())
            .add("errormsg", params.errormsg());
        return client.requestVoid("POST", COLLECTION, COLLECTION, form);
    }

    public CompletableFuture<Void> update(String name, UpdateMacroParams params) {
        FormBody form = FormBody.create()
            .add("definition", params.definition())
            .add("args", params.args())
            .add("description", params.description())
            .add("disabled", params.disabled())
            .add("iseval", params.iseval())
            .add("validation", params.validation())
            .add("errormsg", params.errormsg());
        return client.requestVoid("POST", COLLECTION + "/" + UrlEncoding.pathSegment(name), ITEM, form);
    }

    public CompletableFuture<Void> delete(String name) {
        return client.requestVoid("DELETE", COLLECTION + "/" + UrlEncoding.pathSegment(name), ITEM, null);
    }
}
