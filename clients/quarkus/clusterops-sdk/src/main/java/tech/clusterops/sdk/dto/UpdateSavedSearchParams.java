package tech.clusterops.sdk.dto;

/**
 * Parameters for updating a saved search. Null fields keep their current value.
 */
public record UpdateSavedSearchParams(
    String search,
    String description,
    Boolean disabled
) {}
