package com.dtoollookup.descriptive;

import com.mongodb.MongoWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteError;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonDocument;
import org.bson.BsonObjectId;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MongoDescriptiveMetadataStoreTest {

    @SuppressWarnings("unchecked")
    private final MongoCollection<Document> collection = mock(MongoCollection.class);
    @SuppressWarnings("unchecked")
    private final FindIterable<Document> findIterable = mock(FindIterable.class);

    private MongoDescriptiveMetadataStore store;

    @BeforeEach
    void setUp() {
        store = new MongoDescriptiveMetadataStore(collection);
        when(collection.find(any(Bson.class))).thenReturn(findIterable);
        when(findIterable.projection(any(Bson.class))).thenReturn(findIterable);
    }

    // -----------------------------------------------------------------------
    // upsert
    // -----------------------------------------------------------------------

    @Test
    void upsert_singleReplaceWithUpsertOnUuidAndUri() {
        when(collection.replaceOne(any(Bson.class), any(Document.class), any(ReplaceOptions.class)))
            .thenReturn(UpdateResult.acknowledged(0, 0L, new BsonObjectId(new ObjectId())));

        var stored = store.upsert("u-1", "s3://b/x", Map.of("uuid", "u-1", "uri", "s3://b/x", "name", "x"));

        var filter = ArgumentCaptor.forClass(Bson.class);
        var replacement = ArgumentCaptor.forClass(Document.class);
        var options = ArgumentCaptor.forClass(ReplaceOptions.class);
        verify(collection).replaceOne(filter.capture(), replacement.capture(), options.capture());

        assertEquals(
            Filters.and(Filters.eq("uuid", "u-1"), Filters.eq("uri", "s3://b/x")).toBsonDocument(),
            filter.getValue().toBsonDocument());
        assertTrue(options.getValue().isUpsert(), "Must be an atomic replace-or-insert");
        assertEquals("x", replacement.getValue().getString("name"));
        assertEquals(Map.of("uuid", "u-1", "uri", "s3://b/x", "name", "x"), stored);
    }

    @Test
    void upsert_stripsInternalId() {
        when(collection.replaceOne(any(Bson.class), any(Document.class), any(ReplaceOptions.class)))
            .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        var stored = store.upsert("u-1", "s3://b/x",
            Map.of("_id", new ObjectId(), "uuid", "u-1", "uri", "s3://b/x"));

        var replacement = ArgumentCaptor.forClass(Document.class);
        verify(collection).replaceOne(any(Bson.class), replacement.capture(), any(ReplaceOptions.class));
        assertFalse(replacement.getValue().containsKey("_id"));
        assertFalse(stored.containsKey("_id"));
    }

    @Test
    void upsert_retriesOnceWhenConcurrentInsertWins() {
        when(collection.replaceOne(any(Bson.class), any(Document.class), any(ReplaceOptions.class)))
            .thenThrow(writeError(11000, "E11000 duplicate key error collection: dtool_info.datasets index: uuid_uri"))
            .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        var stored = store.upsert("u-1", "s3://b/x", Map.of("uuid", "u-1", "uri", "s3://b/x", "name", "x"));

        verify(collection, times(2)).replaceOne(any(Bson.class), any(Document.class), any(ReplaceOptions.class));
        assertEquals("x", stored.get("name"));
    }

    @Test
    void upsert_otherWriteErrorsPropagate() {
        when(collection.replaceOne(any(Bson.class), any(Document.class), any(ReplaceOptions.class)))
            .thenThrow(writeError(2, "bad value"));

        assertThrows(MongoWriteException.class,
            () -> store.upsert("u-1", "s3://b/x", Map.of("uuid", "u-1", "uri", "s3://b/x")));
        verify(collection, times(1)).replaceOne(any(Bson.class), any(Document.class), any(ReplaceOptions.class));
    }

    // -----------------------------------------------------------------------
    // indexes
    // -----------------------------------------------------------------------

    @Test
    void ensureIndexes_uuidUriIsUnique() {
        store.ensureIndexes();

        var keys = ArgumentCaptor.forClass(Bson.class);
        var options = ArgumentCaptor.forClass(IndexOptions.class);
        verify(collection, times(2)).createIndex(keys.capture(), options.capture());

        assertEquals(new Document("uuid", 1).append("uri", 1).toBsonDocument(),
            keys.getAllValues().get(0).toBsonDocument());
        assertEquals("uuid_uri", options.getAllValues().get(0).getName());
        assertTrue(options.getAllValues().get(0).isUnique(), "One document per (uuid, uri)");
        assertFalse(options.getAllValues().get(1).isUnique());
    }

    // -----------------------------------------------------------------------
    // find
    // -----------------------------------------------------------------------

    @Test
    void findOne_excludesIdAndMapsMissingToEmpty() {
        when(findIterable.first()).thenReturn(null);

        assertTrue(store.findOne(Map.of("uri", "s3://b/x")).isEmpty());

        var projection = ArgumentCaptor.forClass(Bson.class);
        verify(findIterable).projection(projection.capture());
        assertEquals(new Document("_id", 0).toBsonDocument(), projection.getValue().toBsonDocument());
    }

    @Test
    void findOne_returnsDocument() {
        when(findIterable.first()).thenReturn(new Document("uri", "s3://b/x").append("readme", "hi"));

        assertEquals(Map.of("uri", "s3://b/x", "readme", "hi"), store.findOne(Map.of("uri", "s3://b/x")).orElseThrow());
    }

    @Test
    @SuppressWarnings("unchecked")
    void findMany_streamsAndClosesCursor() {
        MongoCursor<Document> cursor = mock(MongoCursor.class);
        when(findIterable.iterator()).thenReturn(cursor);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn(new Document("name", "a"), new Document("name", "b"));

        List<Map<String, Object>> found;
        try (var stream = store.findMany(Map.of("base_uri", "s3://b"))) {
            found = stream.toList();
        }

        assertEquals(List.of(Map.of("name", "a"), Map.of("name", "b")), found);
        verify(cursor).close();
    }

    @SuppressWarnings("deprecation")
    private static MongoWriteException writeError(int code, String message) {
        return new MongoWriteException(new WriteError(code, message, new BsonDocument()), new ServerAddress());
    }
}
