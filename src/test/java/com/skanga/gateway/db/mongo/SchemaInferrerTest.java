package com.skanga.gateway.db.mongo;

import com.skanga.gateway.db.UnsupportedDocumentStructureException;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SchemaInferrerTest {

    private static Map<String, Object> field(List<Map<String, Object>> descriptors, String fieldName) {
        return descriptors.stream()
                .filter(descriptor -> fieldName.equals(descriptor.get("field_name")))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No descriptor for " + fieldName));
    }

    @Test
    void testEmptySample() {
        assertTrue(SchemaInferrer.infer(new ArrayList<Document>()).isEmpty());
    }

    @Test
    void testMixedTypesReportedOnce() {
        List<Document> sample = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            sample.add(new Document("code", i));
        }
        for (int i = 0; i < 40; i++) {
            sample.add(new Document("code", "C" + i));
        }

        List<Map<String, Object>> descriptors = SchemaInferrer.infer(sample);

        assertEquals(1, descriptors.size());
        Map<String, Object> code = descriptors.get(0);
        assertEquals(List.of("int", "string"), code.get("types_found"));
        assertEquals(100, code.get("document_count"));
        assertEquals(true, code.get("nullable"));
        assertEquals(List.of(0, 1, 2), code.get("sample_values"));
    }

    @Test
    void testNestedFieldsUseDottedPaths() {
        Document document = new Document("name", "Ada")
                .append("address", new Document("city", "London").append("geo", new Document("lat", 51.5)))
                .append("tags", Arrays.asList("math", new Document("nested", "in array")));

        List<Map<String, Object>> descriptors = SchemaInferrer.infer(List.of(document));

        assertThat(descriptors).extracting(descriptor -> descriptor.get("field_name"))
                .containsExactly("address", "address.city", "address.geo", "address.geo.lat", "name", "tags");
        assertEquals(List.of("object"), field(descriptors, "address").get("types_found"));
        assertEquals(List.of("double"), field(descriptors, "address.geo.lat").get("types_found"));
        assertEquals(List.of("array"), field(descriptors, "tags").get("types_found"));
    }

    @Test
    void testDescriptorShape() {
        List<Map<String, Object>> descriptors = SchemaInferrer.infer(List.of(new Document("a", 1)));

        assertThat(descriptors.get(0).keySet())
                .containsExactly("field_name", "types_found", "sample_values", "nullable", "document_count");
    }

    @Test
    void testSamplesAreSerializedAndCapped() {
        List<Document> sample = new ArrayList<>();
        List<ObjectId> ids = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            ObjectId id = new ObjectId();
            ids.add(id);
            sample.add(new Document("_id", id));
        }

        Map<String, Object> idField = SchemaInferrer.infer(sample).get(0);

        assertEquals(List.of(ids.get(0).toHexString(), ids.get(1).toHexString(), ids.get(2).toHexString()),
                idField.get("sample_values"));
        assertEquals(List.of("objectId"), idField.get("types_found"));
    }

    @Test
    void testTypeNames() {
        assertEquals("null", SchemaInferrer.typeName(null));
        assertEquals("string", SchemaInferrer.typeName("x"));
        assertEquals("int", SchemaInferrer.typeName(1));
        assertEquals("long", SchemaInferrer.typeName(1L));
        assertEquals("double", SchemaInferrer.typeName(1.5));
        assertEquals("decimal", SchemaInferrer.typeName(Decimal128.parse("1.5")));
        assertEquals("bool", SchemaInferrer.typeName(false));
        assertEquals("objectId", SchemaInferrer.typeName(new ObjectId()));
        assertEquals("date", SchemaInferrer.typeName(new Date()));
        assertEquals("object", SchemaInferrer.typeName(new Document()));
        assertEquals("array", SchemaInferrer.typeName(List.of(1)));
        assertEquals("binData", SchemaInferrer.typeName(new Binary(new byte[]{1})));
        assertEquals("timestamp", SchemaInferrer.typeName(new BsonTimestamp(1, 1)));
    }

    @Test
    void testNullValuesCounted() {
        List<Document> sample = List.of(new Document("email", null), new Document("email", "a@b.c"));

        Map<String, Object> email = SchemaInferrer.infer(sample).get(0);

        assertEquals(List.of("null", "string"), email.get("types_found"));
        assertEquals(Arrays.asList(null, "a@b.c"), email.get("sample_values"));
    }

    @Test
    void testCyclicDocumentRejected() {
        Map<String, Object> parent = new HashMap<>();
        Map<String, Object> child = new HashMap<>();
        parent.put("child", child);
        child.put("name", "loop");
        child.put("parent", parent);

        assertThrows(UnsupportedDocumentStructureException.class, () -> SchemaInferrer.infer(List.of(parent)));
    }
}
