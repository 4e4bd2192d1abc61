package tech.clusterops.sdk.dto;

import java.util.List;

public record CreateRoleParams(
    String name,
    List<String> capabilities,
    List<String> searchIndexes,
    String searchFilter,
    List<String> importedRoles,
    String defaultApp
) {
    public CreateRoleParams {
        capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        searchIndexes = searchIndexes != null ? List.copyOf(searchIndexes) : List.of();
        importedRoles = importedRoles != null ? List.copyOf(importedRoles) : List.of();
    }
}
