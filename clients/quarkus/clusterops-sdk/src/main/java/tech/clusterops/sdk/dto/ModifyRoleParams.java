package tech.clusterops.sdk.dto;

import java.util.List;

/**
 * Parameters for modifying a role. Null fields keep their current value.
 */
public record ModifyRoleParams(
    List<String> capabilities,
    List<String> searchIndexes,
    String searchFilter,
    List<String> importedRoles,
    String defaultApp
) {}
