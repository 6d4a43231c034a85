package com.skanga.gateway.db.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skanga.gateway.db.UnsupportedDocumentStructureException;
import org.bson.BsonDateTime;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonRegularExpression;
import org.bson.BsonString;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.MaxKey;
import org.bson.types.MinKey;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DocumentSerializerTest {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testNonFiniteDoublesBecomeText() throws Exception {
        Document document = new Document("ratio", Double.NaN)
                .append("ceiling", Double.POSITIVE_INFINITY)
                .append("floor", new BsonDouble(Double.NEGATIVE_INFINITY))
                .append("readings", List.of(1.5, Double.NaN));

        Map<String, Object> serialized = DocumentSerializer.serialize(document);

        assertEquals("NaN", serialized.get("ratio"));
        assertEquals("Infinity", serialized.get("ceiling"));
        assertEquals("-Infinity", serialized.get("floor"));
        assertEquals(List.of(1.5, "NaN"), serialized.get("readings"));
        assertEquals("{\"ratio\":\"NaN\",\"ceiling\":\"Infinity\",\"floor\":\"-Infinity\",\"readings\":[1.5,\"NaN\"]}",
                objectMapper.writeValueAsString(serialized));
    }

    @Test
    void testTopLevelConversions() {
        ObjectId id = new ObjectId("507f1f77bcf86cd799439011");
        Document document = new Document("_id", id)
                .append("name", "Ada")
                .append("born", new Date(0L))
                .append("score", 9.5)
                .append("active", true)
                .append("nickname", null);

        Map<String, Object> serialized = DocumentSerializer.serialize(document);

        assertThat(serialized.keySet()).containsExactly("_id", "name", "born", "score", "active", "nickname");
        assertEquals("507f1f77bcf86cd799439011", serialized.get("_id"));
        assertEquals("1970-01-01T00:00:00Z", serialized.get("born"));
        assertEquals(9.5, serialized.get("score"));
        assertEquals(true, serialized.get("active"));
        assertNull(serialized.get("nickname"));
    }

    @Test
    void testNestedValuesConvertedAtEveryDepth() throws Exception {
        ObjectId ownerId = new ObjectId();
        Document document = new Document("order", new Document("owner", new Document("ref", ownerId))
                .append("lines", Arrays.asList(
                        new Document("placed", new Date(1_000L)),
                        Arrays.asList(new ObjectId("507f191e810c19729de860ea"), 3))));

        Map<String, Object> serialized = DocumentSerializer.serialize(document);

        @SuppressWarnings("unchecked")
        Map<String, Object> order = (Map<String, Object>) serialized.get("order");
        @SuppressWarnings("unchecked")
        Map<String, Object> owner = (Map<String, Object>) order.get("owner");
        assertEquals(ownerId.toHexString(), owner.get("ref"));

        List<?> lines = (List<?>) order.get("lines");
        assertEquals(Map.of("placed", "1970-01-01T00:00:01Z"), lines.get(0));
        assertEquals(List.of("507f191e810c19729de860ea", 3), lines.get(1));

        // Plain JSON types only, so the result survives a JSON round trip unchanged
        String json = objectMapper.writeValueAsString(serialized);
        assertEquals(serialized, objectMapper.readValue(json, LinkedHashMap.class));
    }

    @Test
    void testSiblingOrderKeptInNestedContainers() {
        Document document = new Document("a", new Document("z", 1).append("y", new Document("x", 1)).append("w", 2))
                .append("b", Arrays.asList(1, new Document("k", 1), 3));

        Map<String, Object> serialized = DocumentSerializer.serialize(document);

        @SuppressWarnings("unchecked")
        Map<String, Object> nested = (Map<String, Object>) serialized.get("a");
        assertThat(nested.keySet()).containsExactly("z", "y", "w");
        assertEquals(Arrays.asList(1, Map.of("k", 1), 3), serialized.get("b"));
    }

    @Test
    void testSpecialLeafTypes() {
        byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);
        String base64 = Base64.getEncoder().encodeToString(payload);
        UUID uuid = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");

        assertEquals("12.50", DocumentSerializer.serializeValue(new Decimal128(new BigDecimal("12.50"))));
        assertEquals(base64, DocumentSerializer.serializeValue(new Binary(payload)));
        assertEquals(base64, DocumentSerializer.serializeValue(payload));
        assertEquals(uuid.toString(), DocumentSerializer.serializeValue(uuid));
        assertEquals("MinKey", DocumentSerializer.serializeValue(new MinKey()));
        assertEquals("MaxKey", DocumentSerializer.serializeValue(new MaxKey()));
        assertEquals(42L, DocumentSerializer.serializeValue(42L));
    }

    @Test
    void testBsonValuesUnwrapped() {
        assertEquals("text", DocumentSerializer.serializeValue(new BsonString("text")));
        assertEquals(7, DocumentSerializer.serializeValue(new BsonInt32(7)));
        assertEquals("1970-01-01T00:00:02Z", DocumentSerializer.serializeValue(new BsonDateTime(2_000L)));
        assertEquals("Timestamp(1700000000, 3)", DocumentSerializer.serializeValue(new BsonTimestamp(1_700_000_000, 3)));
        assertEquals("/^ab/i", DocumentSerializer.serializeValue(new BsonRegularExpression("^ab", "i")));
    }

    @Test
    void testSerializeAll() {
        List<Document> documents = List.of(new Document("n", 1), new Document("n", 2));

        List<Map<String, Object>> serialized = DocumentSerializer.serializeAll(documents);

        assertThat(serialized).extracting(document -> document.get("n")).containsExactly(1, 2);
    }

    @Test
    void testCyclicMapRejected() {
        Map<String, Object> parent = new HashMap<>();
        Map<String, Object> child = new HashMap<>();
        parent.put("child", child);
        child.put("parent", parent);

        UnsupportedDocumentStructureException exception = assertThrows(UnsupportedDocumentStructureException.class,
                () -> DocumentSerializer.serialize(parent));
        assertTrue(exception.getMessage().contains("cyclic"));
    }

    @Test
    void testSelfContainingListRejected() {
        List<Object> items = new ArrayList<>();
        items.add(1);
        items.add(items);

        assertThrows(UnsupportedDocumentStructureException.class, () -> DocumentSerializer.serializeValue(items));
    }

    @Test
    void testSharedSubdocumentIsNotACycle() {
        Document shared = new Document("v", 1);
        Document document = new Document("left", shared).append("right", shared);

        Map<String, Object> serialized = DocumentSerializer.serialize(document);

        assertEquals(serialized.get("left"), serialized.get("right"));
    }

    @Test
    void testDepthLimit() {
        Document withinLimit = nestedDocument(DocumentSerializer.MAX_DEPTH);
        Document beyondLimit = nestedDocument(DocumentSerializer.MAX_DEPTH + 1);

        assertDoesNotThrow(() -> DocumentSerializer.serialize(withinLimit));
        UnsupportedDocumentStructureException exception = assertThrows(UnsupportedDocumentStructureException.class,
                () -> DocumentSerializer.serialize(beyondLimit));
        assertTrue(exception.getMessage().contains(String.valueOf(DocumentSerializer.MAX_DEPTH)));
    }

    @Test
    void testVeryDeepNestingDoesNotOverflowStack() {
        Document deep = nestedDocument(10_000);

        assertThrows(UnsupportedDocumentStructureException.class, () -> DocumentSerializer.serialize(deep));
    }

    /**
     * Builds a document with the given number of nested document levels, the root counting as one.
     */
    private static Document nestedDocument(int levels) {
        Document root = new Document();
        Document current = root;
        for (int i = 1; i < levels; i++) {
            Document next = new Document();
            current.put("child", next);
            current = next;
        }
        current.put("leaf", "value");
        return root;
    }
}
