package com.dtoollookup.descriptive;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Free-form descriptive documents, at most one per (uuid, uri) pair.
 *
 * Documents handed out never carry the store-internal identifier.
 */
public interface DescriptiveMetadataStore {

    /** Field name of the store-internal identifier. */
    String INTERNAL_ID = "_id";

    Optional<Map<String, Object>> findOne(Map<String, Object> query);

    /**
     * Lazily stream matching documents in store-native order.
     * The stream holds a cursor; close it when done.
     */
    Stream<Map<String, Object>> findMany(Map<String, Object> query);

    /**
     * Replace the document stored under (uuid, uri) or insert it if there is none,
     * as one atomic operation.
     *
     * @return the stored document, without internal identifier
     */
    Map<String, Object> upsert(String uuid, String uri, Map<String, Object> document);

    long count();
}
