package tech.clusterops.sdk.dto;

import java.util.List;

/**
 * Parameters for modifying a user. Null fields keep their current value.
 */
public record ModifyUserParams(
    String password,
    List<String> roles,
    String realName,
    String email,
    String defaultApp
) {
    @Override
    public String toString() {
        return "ModifyUserParams[password=" + (password != null ? "****" : null) + ", roles=" + roles
            + ", realName=" + realName + ", email=" + email + ", defaultApp=" + defaultApp + "]";
    }
}
