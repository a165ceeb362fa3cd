package com.dtoollookup.admin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a bulk user registration; {@code is_admin} defaults to false.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserRegistration(
    String username,
    @JsonProperty("is_admin") Boolean admin
) {
    public boolean adminOrDefault() {
        return Boolean.TRUE.equals(admin);
    }
}
