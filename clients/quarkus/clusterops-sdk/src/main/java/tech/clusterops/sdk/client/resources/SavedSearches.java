package tech.clusterops.sdk.client.resources;

import tech.clusterops.sdk.client.ClusterOpsClient;
import tech.clusterops.sdk.client.FormBody;
import tech.clusterops.sdk.dto.CreateSavedSearchParams;
import tech.clusterops.sdk.dto.UpdateSavedSearchParams;
import tech.clusterops.sdk.support.UrlEncoding;

import java.util.concurrent.CompletableFuture;

/**
 * Resource for managing saved searches.
 */
public class SavedSearches {

    static final String COLLECTION = "/services/saved/searches";
    static final String ITEM = COLLECTION + "/{name}";

    private final ClusterOpsClient client;

    public SavedSearches(ClusterOpsClient client) {
        this.client = client;
    }

    /**
     * Create a saved search.
     */
    public CompletableFuture<Void> create(CreateSavedSearchParams params) {
        FormBody form = FormBody.create()
            .add("name", params.name())
            .add("search", params.search())
            .add("description", params.description())
            .add("disabled", params.disabled());
        return client.requestVoid("POST", COLLECTION, COLLECTION, form);
    }

    /**
     * Update a saved search.
     */
    public CompletableFuture<Void> update(String name, UpdateSavedSearchParams params) {
        FormBody form = FormBody.create()
            .add("search", params.search())
            .add("description", params.description())
            .add("disabled", params.disabled());
        return client.requestVoid("POST", COLLECTION + "/" + UrlEncoding.pathSegment(name), ITEM, form);
    }

    /**
     * Delete a saved search.
     */
    public CompletableFuture<Void> delete(String name) {
        return client.requestVoid("DELETE", COLLECTION + "/" + UrlEncoding.pathSegment(name), ITEM, null);
    }
}
