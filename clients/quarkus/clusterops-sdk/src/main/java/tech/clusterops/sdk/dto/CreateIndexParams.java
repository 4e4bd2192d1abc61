package tech.clusterops.sdk.dto;

/**
 * Parameters for creating an index. Only {@code name} is required.
 */
public record CreateIndexParams(
    String name,
    Integer maxDataSizeMb,
    Integer maxHotBuckets,
    Integer maxWarmDbCount,
    Integer frozenTimePeriodSecs,
    String homePath,
    String coldDbPath,
    String thawedPath,
    String coldToFrozenDir
) {
    public static CreateIndexParams named(String name) {
        return new CreateIndexParams(name, null, null, null, null, null, null, null, null);
    }
}
