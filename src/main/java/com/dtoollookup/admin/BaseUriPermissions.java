package com.dtoollookup.admin;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Who may search and who may register on one base URI. */
public record BaseUriPermissions(
    @JsonProperty("base_uri") String baseUri,
    @JsonProperty("users_with_search_permissions") List<String> usersWithSearchPermissions,
    @JsonProperty("users_with_register_permissions") List<String> usersWithRegisterPermissions
) {
    public BaseUriPermissions {
        usersWithSearchPermissions = usersWithSearchPermissions != null
            ? List.copyOf(usersWithSearchPermissions) : List.of();
        usersWithRegisterPermissions = usersWithRegisterPermissions != null
            ? List.copyOf(usersWithRegisterPermissions) : List.of();
    }
}
