package tech.clusterops.sdk.dto;

import java.util.List;

/**
 * Parameters for creating a user.
 */
public record CreateUserParams(
    String name,
    String password,
    List<String> roles,
    String realName,
    String email,
    String defaultApp
) {
    public CreateUserParams {
        roles = roles != null ? List.copyOf(roles) : List.of();
    }

    @Override
    public String toString() {
        return "CreateUserParams[name=" + name + ", password=****, roles=" + roles
            + ", realName=" + realName + ", email=" + email + ", defaultApp=" + defaultApp + "]";
    }
}
