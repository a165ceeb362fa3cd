package com.dtoollookup.admin;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The access-controlled identity row of a dataset. {@code uri} is unique across
 * all records; {@code uuid} is carried along as a label.
 */
public record DatasetAdminRecord(
    String uuid,
    @JsonProperty("base_uri") String baseUri,
    String uri,
    String name
) {
}
