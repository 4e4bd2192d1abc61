package tech.clusterops.sdk.dto;

/**
 * Parameters for creating a search macro.
 *
 * @param args       comma-separated argument names, for parameterised macros
 * @param iseval     whether the definition is an eval expression
 * @param validation eval expression that must hold for the arguments
 * @param errormsg   message shown when validation fails
 */
public record CreateMacroParams(
    String name,
    String definition,
    String args,
    String description,
    boolean disabled,
    boolean iseval,
    String validation,
    String errormsg
) {}
