package com.dtoollookup.admin;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A registered user together with the base URIs it may search and register into.
 * The base URI lists are materialized by explicit join queries when the user is loaded.
 */
public record User(
    String username,
    @JsonProperty("is_admin") boolean admin,
    @JsonProperty("search_permissions_on_base_uris") List<String> searchBaseUris,
    @JsonProperty("register_permissions_on_base_uris") List<String> registerBaseUris
) {
    public User {
        searchBaseUris = searchBaseUris != null ? List.copyOf(searchBaseUris) : List.of();
        registerBaseUris = registerBaseUris != null ? List.copyOf(registerBaseUris) : List.of();
    }
}
