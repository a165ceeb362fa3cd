package com.dtoollookup.permission;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Users to grant search and register rights on one base URI. Grants are additive.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PermissionUpdate(
    @JsonProperty("base_uri") String baseUri,
    @JsonProperty("users_with_search_permissions") List<String> usersWithSearchPermissions,
    @JsonProperty("users_with_register_permissions") List<String> usersWithRegisterPermissions
) {
    public PermissionUpdate {
        usersWithSearchPermissions = usersWithSearchPermissions != null ? usersWithSearchPermissions : List.of();
        usersWithRegisterPermissions = usersWithRegisterPermissions != null ? usersWithRegisterPermissions : List.of();
    }
}
