package tech.clusterops.sdk.dto;

/**
 * Parameters for updating a search macro. Null fields keep their current value.
 */
public record UpdateMacroParams(
    String definition,
    String args,
    String description,
    Boolean disabled,
    Boolean iseval,
    String validation,
    String errormsg
) {}
