package com.dtoollookup.admin;

/** A registered base URI row. */
public record BaseUri(long id, String baseUri) {
}
