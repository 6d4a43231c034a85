package com.skanga.gateway.db.mongo;

import com.skanga.gateway.db.mongo.DocumentSerializer.Lineage;
import org.bson.BsonValue;
import org.bson.types.Binary;
import org.bson.types.Code;
import org.bson.types.Decimal128;
import org.bson.types.MaxKey;
import org.bson.types.MinKey;
import org.bson.types.ObjectId;
import org.bson.types.Symbol;

import java.math.BigDecimal;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Date;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Infers an approximate schema from sampled documents.
 *
 * <p>Nested documents contribute dotted paths such as {@code address.city}; arrays are
 * treated as leaves. Each field reports every type name observed, a few sample
 * values and the number of documents sampled. The result is best effort: a field
 * absent from the sample is unknown, so {@code nullable} is always {@code true}.
 */
public final class SchemaInferrer {
    public static final int MAX_SAMPLES_KEPT = 5;
    public static final int MAX_SAMPLES_REPORTED = 3;

    private SchemaInferrer() {
    }

    /**
     * @param sampleDocuments documents in the order they were read
     * @return one descriptor per field path, sorted by path; empty when there are no samples
     */
    public static List<Map<String, Object>> infer(List<? extends Map<String, ?>> sampleDocuments) {
        if (sampleDocuments.isEmpty()) {
            return new ArrayList<>();
        }

        Map<String, FieldStats> fieldsByPath = new TreeMap<>();
        for (Map<String, ?> sampleDocument : sampleDocuments) {
            analyzeDocument(sampleDocument, fieldsByPath);
        }

        List<Map<String, Object>> descriptors = new ArrayList<>(fieldsByPath.size());
        for (Map.Entry<String, FieldStats> field : fieldsByPath.entrySet()) {
            FieldStats stats = field.getValue();
            Map<String, Object> descriptor = new LinkedHashMap<>();
            descriptor.put("field_name", field.getKey());
            descriptor.put("types_found", new ArrayList<>(stats.types));
            descriptor.put("sample_values",
                    new ArrayList<>(stats.samples.subList(0, Math.min(MAX_SAMPLES_REPORTED, stats.samples.size()))));
            descriptor.put("nullable", true);
            descriptor.put("document_count", sampleDocuments.size());
            descriptors.add(descriptor);
        }
        return descriptors;
    }

    private static void analyzeDocument(Map<String, ?> document, Map<String, FieldStats> fieldsByPath) {
        Deque<PendingDocument> worklist = new ArrayDeque<>();
        worklist.push(new PendingDocument(document, "", Lineage.root(document)));

        while (!worklist.isEmpty()) {
            PendingDocument pending = worklist.pop();
            for (Map.Entry<?, ?> entry : pending.document().entrySet()) {
                String fieldPath = pending.pathPrefix() + entry.getKey();
                Object fieldValue = entry.getValue();

                FieldStats stats = fieldsByPath.computeIfAbsent(fieldPath, path -> new FieldStats());
                stats.types.add(typeName(fieldValue));
                if (stats.samples.size() < MAX_SAMPLES_KEPT) {
                    stats.samples.add(DocumentSerializer.serializeValue(fieldValue));
                }

                if (fieldValue instanceof Map) {
                    worklist.push(new PendingDocument((Map<?, ?>) fieldValue, fieldPath + ".",
                            pending.lineage().descend(fieldValue)));
                }
            }
        }
    }

    /**
     * Names a value's type using MongoDB's {@code $type} aliases.
     */
    static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof BsonValue && !(value instanceof Map) && !(value instanceof List)) {
            return bsonTypeName((BsonValue) value);
        }
        if (value instanceof String || value instanceof Character) {
            return "string";
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return "int";
        }
        if (value instanceof Long) {
            return "long";
        }
        if (value instanceof Double || value instanceof Float) {
            return "double";
        }
        if (value instanceof Decimal128 || value instanceof BigDecimal) {
            return "decimal";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof ObjectId) {
            return "objectId";
        }
        if (value instanceof Date || value instanceof TemporalAccessor) {
            return "date";
        }
        if (value instanceof Map) {
            return "object";
        }
        if (value instanceof Iterable || value instanceof Object[]) {
            return "array";
        }
        if (value instanceof Binary || value instanceof byte[] || value instanceof UUID) {
            return "binData";
        }
        if (value instanceof Pattern) {
            return "regex";
        }
        if (value instanceof Code) {
            return "javascript";
        }
        if (value instanceof Symbol) {
            return "symbol";
        }
        if (value instanceof MinKey) {
            return "minKey";
        }
        if (value instanceof MaxKey) {
            return "maxKey";
        }
        return value.getClass().getSimpleName();
    }

    private static String bsonTypeName(BsonValue bsonValue) {
        return switch (bsonValue.getBsonType()) {
            case NULL -> "null";
            case UNDEFINED -> "undefined";
            case STRING -> "string";
            case INT32 -> "int";
            case INT64 -> "long";
            case DOUBLE -> "double";
            case DECIMAL128 -> "decimal";
            case BOOLEAN -> "bool";
            case OBJECT_ID -> "objectId";
            case DATE_TIME -> "date";
            case TIMESTAMP -> "timestamp";
            case BINARY -> "binData";
            case REGULAR_EXPRESSION -> "regex";
            case JAVASCRIPT -> "javascript";
            case JAVASCRIPT_WITH_SCOPE -> "javascriptWithScope";
            case SYMBOL -> "symbol";
            case DB_POINTER -> "dbPointer";
            case MIN_KEY -> "minKey";
            case MAX_KEY -> "maxKey";
            case DOCUMENT -> "object";
            case ARRAY -> "array";
            default -> bsonValue.getBsonType().name().toLowerCase();
        };
    }

    private record PendingDocument(Map<?, ?> document, String pathPrefix, Lineage lineage) {
    }

    private static final class FieldStats {
        private final Set<String> types = new LinkedHashSet<>();
        private final List<Object> samples = new ArrayList<>();
    }
}
