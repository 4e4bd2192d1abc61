package tech.clusterops.sdk.dto;

public record CreateSavedSearchParams(
    String name,
    String search,
    String description,
    Boolean disabled
) {}
