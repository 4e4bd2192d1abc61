package tech.clusterops.sdk.dto;

/**
 * Parameters for modifying an index. Null fields keep their current value.
 */
public record ModifyIndexParams(
    Integer maxDataSizeMb,
    Integer maxHotBuckets,
    Integer maxWarmDbCount,
    Integer frozenTimePeriodSecs,
    String homePath,
    String coldDbPath,
    String thawedPath,
    String coldToFrozenDir
) {}
