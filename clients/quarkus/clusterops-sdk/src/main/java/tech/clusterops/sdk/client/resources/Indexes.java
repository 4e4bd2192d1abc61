package tech.clusterops.sdk.client.resources;

import tech.clusterops.sdk.client.ClusterOpsClient;
import tech.clusterops.sdk.client.FormBody;
import tech.clusterops.sdk.dto.CreateIndexParams;
import tech.clusterops.sdk.dto.ModifyIndexParams;
import tech.clusterops.sdk.support.UrlEncoding;

import java.util.concurrent.CompletableFuture;

/**
 * Resource for managing indexes.
 */
public class Indexes {

    static final String COLLECTION = "/services/data/indexes";
    static final String ITEM = COLLECTION + "/{name}";

    private final ClusterOpsClient client;

    public Indexes(ClusterOpsClient client) {
        this.client = client;
    }

    /**
     * Create an index.
     */
    public CompletableFuture<Void> create(CreateIndexParams params) {
        FormBody form = FormBody.create().add("name", params.name());
        addSettings(form, params.maxDataSizeMb(), params.maxHotBuckets(), params.maxWarmDbCount(),
            params.frozenTimePeriodSecs(), params.homePath(), params.coldDbPath(), params.thawedPath(),
            params.coldToFrozenDir());
        return client.requestVoid("POST", COLLECTION, COLLECTION, form);
    }

    /**
     * Change settings of an existing index.
     */
    public CompletableFuture<Void> modify(String name, ModifyIndexParams params) {
        FormBody form = FormBody.create();
        addSettings(form, params.maxDataSizeMb(), params.maxHotBuckets(), params.maxWarmDbCount(),
            params.frozenTimePeriodSecs(), params.homePath(), params.coldDbPath(), params.thawedPath(),
            params.coldToFrozenDir());
        return client.requestVoid("POST", COLLECTION + "/" + UrlEncoding.pathSegment(name), ITEM, form);
    }

    /**
     * Delete an index.
     */
    public CompletableFuture<Void> delete(String name) {
        return client.requestVoid("DELETE", COLLECTION + "/" + UrlEncoding.pathSegment(name), ITEM, null);
    }

    private static void addSettings(FormBody form, Integer maxDataSizeMb, Integer maxHotBuckets,
                                    Integer maxWarmDbCount, Integer frozenTimePeriodSecs, String homePath,
                                    String coldDbPath, String thawedPath, String coldToFrozenDir) {
        form.add("maxTotalDataSizeMB", maxDataSizeMb)
            .add("maxHotBuckets", maxHotBuckets)
            .add("maxWarmDBCount", maxWarmDbCount)
            .add("frozenTimePeriodInSecs", frozenTimePeriodSecs)
            .add("homePath", homePath)
            .add("coldPath", coldDbPath)
            .add("thawedPath", thawedPath)
            .add("coldToFrozenDir", coldToFrozenDir);
    }
}
