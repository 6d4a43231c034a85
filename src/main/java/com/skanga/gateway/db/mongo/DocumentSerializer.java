package com.skanga.gateway.db.mongo;

import com.skanga.gateway.db.UnsupportedDocumentStructureException;
import org.bson.BsonRegularExpression;
import org.bson.BsonTimestamp;
import org.bson.BsonValue;
import org.bson.types.Binary;
import org.bson.types.Code;
import org.bson.types.Decimal128;
import org.bson.types.MaxKey;
import org.bson.types.MinKey;
import org.bson.types.ObjectId;
import org.bson.types.Symbol;

import java.time.Instant;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Date;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Converts driver documents into plain JSON-safe values: maps, lists, strings, numbers,
 * booleans and null. Every leaf at every depth is converted; identifiers and dates
 * become strings.
 *
 * <p>Nesting is walked with an explicit worklist rather than recursion. Structures
 * deeper than {@link #MAX_DEPTH} and containers that contain themselves are rejected
 * with {@link UnsupportedDocumentStructureException}.
 */
public final class DocumentSerializer {
    public static final int MAX_DEPTH = 100;

    private DocumentSerializer() {
    }

    /**
     * @param document a driver document or any other string-keyed map
     * @return an ordered, JSON-safe copy
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> serialize(Map<String, ?> document) {
        return (Map<String, Object>) serializeValue(document);
    }

    public static List<Map<String, Object>> serializeAll(List<? extends Map<String, ?>> documents) {
        List<Map<String, Object>> serialized = new ArrayList<>(documents.size());
        for (Map<String, ?> document : documents) {
            serialized.add(serialize(document));
        }
        return serialized;
    }

    /**
     * Converts any value a document can hold.
     *
     * @param value leaf or container
     * @return a JSON-safe equivalent
     */
    public static Object serializeValue(Object value) {
        if (!isContainer(value)) {
            return convertLeaf(value);
        }

        Object root = newTarget(value);
        Deque<PendingContainer> worklist = new ArrayDeque<>();
        worklist.push(new PendingContainer(value, root, Lineage.root(value)));

        while (!worklist.isEmpty()) {
            PendingContainer pending = worklist.pop();
            if (pending.source() instanceof Map) {
                Map<String, Object> target = castMap(pending.target());
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) pending.source()).entrySet()) {
                    target.put(String.valueOf(entry.getKey()), convertChild(entry.getValue(), pending, worklist));
                }
            } else {
                List<Object> target = castList(pending.target());
                for (Object element : elements(pending.source())) {
                    target.add(convertChild(element, pending, worklist));
                }
            }
        }
        return root;
    }

    private static Object convertChild(Object child, PendingContainer parent, Deque<PendingContainer> worklist) {
        if (!isContainer(child)) {
            return convertLeaf(child);
        }
        Lineage lineage = parent.lineage().descend(child);
        Object childTarget = newTarget(child);
        // Placed now so sibling order is kept, filled when the worklist reaches it
        worklist.push(new PendingContainer(child, childTarget, lineage));
        return childTarget;
    }

    static boolean isContainer(Object value) {
        return value instanceof Map || value instanceof Iterable || value instanceof Object[];
    }

    static Iterable<?> elements(Object container) {
        if (container instanceof Object[]) {
            return Arrays.asList((Object[]) container);
        }
        return (Iterable<?>) container;
    }

    private static Object newTarget(Object container) {
        return container instanceof Map ? new LinkedHashMap<String, Object>() : new ArrayList<>();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object target) {
        return (Map<String, Object>) target;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> castList(Object target) {
        return (List<Object>) target;
    }

    /**
     * Converts a non-container value.
     */
    static Object convertLeaf(Object value) {
        if (value instanceof Decimal128 || isNonFinite(value)) {
            return value.toString();
        }
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        if (value instanceof ObjectId) {
            return ((ObjectId) value).toHexString();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof BsonValue) {
            return convertBsonValue((BsonValue) value);
        }
        if (value instanceof Binary) {
            return Base64.getEncoder().encodeToString(((Binary) value).getData());
        }
        if (value instanceof byte[]) {
            return Base64.getEncoder().encodeToString((byte[]) value);
        }
        if (value instanceof Code) {
            return ((Code) value).getCode();
        }
        if (value instanceof Symbol) {
            return ((Symbol) value).getSymbol();
        }
        if (value instanceof Pattern) {
            return ((Pattern) value).pattern();
        }
        if (value instanceof MinKey) {
            return "MinKey";
        }
        if (value instanceof MaxKey) {
            return "MaxKey";
        }
        if (value instanceof UUID || value instanceof Character || value instanceof Enum) {
            return value.toString();
        }
        return String.valueOf(value);
    }

    // NaN and the infinities have no JSON number form
    private static boolean isNonFinite(Object value) {
        if (value instanceof Double) {
            return !Double.isFinite((Double) value);
        }
        if (value instanceof Float) {
            return !Float.isFinite((Float) value);
        }
        return false;
    }

    private static Object convertBsonValue(BsonValue bsonValue) {
        return switch (bsonValue.getBsonType()) {
            case NULL, UNDEFINED -> null;
            case STRING -> bsonValue.asString().getValue();
            case INT32 -> bsonValue.asInt32().getValue();
            case INT64 -> bsonValue.asInt64().getValue();
            case DOUBLE -> convertLeaf(bsonValue.asDouble().getValue());
            case BOOLEAN -> bsonValue.asBoolean().getValue();
            case DECIMAL128 -> bsonValue.asDecimal128().getValue().toString();
            case OBJECT_ID -> bsonValue.asObjectId().getValue().toHexString();
            case DATE_TIME -> Instant.ofEpochMilli(bsonValue.asDateTime().getValue()).toString();
            case TIMESTAMP -> formatTimestamp(bsonValue.asTimestamp());
            case BINARY -> Base64.getEncoder().encodeToString(bsonValue.asBinary().getData());
            case SYMBOL -> bsonValue.asSymbol().getSymbol();
            case JAVASCRIPT -> bsonValue.asJavaScript().getCode();
            case JAVASCRIPT_WITH_SCOPE -> bsonValue.asJavaScriptWithScope().getCode();
            case REGULAR_EXPRESSION -> formatRegex(bsonValue.asRegularExpression());
            case MIN_KEY -> "MinKey";
            case MAX_KEY -> "MaxKey";
            default -> bsonValue.toString();
        };
    }

    private static String formatTimestamp(BsonTimestamp timestamp) {
        return "Timestamp(" + timestamp.getTime() + ", " + timestamp.getInc() + ")";
    }

    private static String formatRegex(BsonRegularExpression regex) {
        return "/" + regex.getPattern() + "/" + regex.getOptions();
    }

    private record PendingContainer(Object source, Object target, Lineage lineage) {
    }

    /**
     * The chain of containers from the root to the one being walked, used to detect
     * cycles and to bound nesting depth.
     */
    record Lineage(Object container, Lineage parent, int depth) {

        static Lineage root(Object container) {
            return new Lineage(container, null, 1);
        }

        Lineage descend(Object child) {
            if (depth + 1 > MAX_DEPTH) {
                throw new UnsupportedDocumentStructureException(
                        "Document nesting exceeds maximum depth of " + MAX_DEPTH);
            }
            for (Lineage ancestor = this; ancestor != null; ancestor = ancestor.parent) {
                if (ancestor.container == child) {
                    throw new UnsupportedDocumentStructureException("Document contains a cyclic reference");
                }
            }
            return new Lineage(child, this, depth + 1);
        }
    }
}
