package com.dtoollookup.descriptive;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReplaceOptions;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * MongoDB collection of descriptive documents.
 */
@Repository
public class MongoDescriptiveMetadataStore implements DescriptiveMetadataStore {

    private static final Logger log = LoggerFactory.getLogger(MongoDescriptiveMetadataStore.class);

    private static final Bson NO_ID = Projections.excludeId();

    private final MongoCollection<Document> collection;

    @Autowired
    public MongoDescriptiveMetadataStore(
        MongoClient mongoClient,
        @Value("${lookup.mongo.database:dtool_info}") String databaseName,
        @Value("${lookup.mongo.collection:datasets}") String collectionName
    ) {
        this(mongoClient.getDatabase(databaseName).getCollection(collectionName));
        ensureIndexes();
        log.info("Descriptive metadata in {}.{}", databaseName, collectionName);
    }

    MongoDescriptiveMetadataStore(MongoCollection<Document> collection) {
        this.collection = collection;
    }

    void ensureIndexes() {
        collection.createIndex(Indexes.compoundIndex(Indexes.ascending("uuid"), Indexes.ascending("uri")),
            new IndexOptions().name("uuid_uri").unique(true));
        collection.createIndex(Indexes.ascending("base_uri"), new IndexOptions().name("base_uri"));
    }

    @Override
    public Optional<Map<String, Object>> findOne(Map<String, Object> query) {
        var found = collection.find(new Document(query)).projection(NO_ID).first();
        return Optional.ofNullable(found).map(MongoDescriptiveMetadataStore::withoutInternalId);
    }

    @Override
    public Stream<Map<String, Object>> findMany(Map<String, Object> query) {
        MongoCursor<Document> cursor = collection.find(new Document(query)).projection(NO_ID).iterator();
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED), false)
            .map(MongoDescriptiveMetadataStore::withoutInternalId)
            .onClose(cursor::close);
    }

    /**
     * Replace-or-insert on the unique (uuid, uri) index. When two upserts of an
     * unseen key race, the index rejects the losing insert; retrying it once
     * finds the winner's document and replaces it.
     */
    @Override
    public Map<String, Object> upsert(String uuid, String uri, Map<String, Object> document) {
        var replacement = new Document(withoutInternalId(document));
        try {
            replace(uuid, uri, replacement);
        } catch (MongoWriteException e) {
            if (e.getError().getCategory() != ErrorCategory.DUPLICATE_KEY) {
                throw e;
            }
            log.debug("Concurrent insert of descriptive document {} ({}), retrying as replace", uri, uuid);
            replace(uuid, uri, replacement);
        }
        return withoutInternalId(replacement);
    }

    private void replace(String uuid, String uri, Document replacement) {
        var result = collection.replaceOne(
            Filters.and(Filters.eq("uuid", uuid), Filters.eq("uri", uri)),
            replacement,
            new ReplaceOptions().upsert(true));
        log.debug("Upserted descriptive document {} ({}): matched={}, inserted={}",
            uri, uuid, result.getMatchedCount(), result.getUpsertedId() != null);
    }

    @Override
    public long count() {
        return collection.countDocuments();
    }

    static Map<String, Object> withoutInternalId(Map<String, Object> document) {
        var copy = new LinkedHashMap<String, Object>(document);
        copy.remove(INTERNAL_ID);
        return copy;
    }
}
