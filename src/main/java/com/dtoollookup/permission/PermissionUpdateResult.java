package com.dtoollookup.permission;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Outcome of a {@link PermissionUpdate}: the usernames that were not registered and got nothing. */
public record PermissionUpdateResult(
    @JsonProperty("base_uri") String baseUri,
    @JsonProperty("skipped_usernames") List<String> skippedUsernames
) {
    public PermissionUpdateResult {
        skippedUsernames = List.copyOf(skippedUsernames);
    }
}
