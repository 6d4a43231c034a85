package com.skanga.gateway.db.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skanga.gateway.config.ResourceManager;
import com.skanga.gateway.db.MalformedQueryException;
import com.skanga.gateway.db.MissingCollectionException;
import org.bson.BSONException;
import org.bson.Document;
import org.bson.json.JsonParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed document-store command such as
 * {@code {"collection": "users", "operation": "find", "filter": {"active": true}, "limit": 10}}.
 *
 * <p>The command text must be strict JSON holding a single object. Values are then read
 * as MongoDB Extended JSON, so filters may use {@code $oid} and {@code $date}. Only {@code collection} and {@code operation} are checked when parsing;
 * the payload accessors validate their field when an operation reads it, so unused
 * fields never fail a command.
 */
public final class DocumentCommand {
    private static final ObjectMapper strictMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final Document command;
    private final String collection;
    private final DocumentOperation operation;

    private DocumentCommand(Document command, String collection, DocumentOperation operation) {
        this.command = command;
        this.collection = collection;
        this.operation = operation;
    }

    /**
     * Parses a command.
     *
     * @param queryJson JSON object text
     * @return the parsed command
     * @throws MalformedQueryException                                     if the text is not a JSON object
     * @throws MissingCollectionException                                  if {@code collection} is absent or blank
     * @throws com.skanga.gateway.db.UnsupportedQueryOperationException if {@code operation} is unknown
     */
    public static DocumentCommand parse(String queryJson) {
        if (queryJson == null || queryJson.isBlank()) {
            throw new MalformedQueryException(ResourceManager.getErrorMessage("query.json.invalid"));
        }
        JsonNode commandTree;
        try {
            commandTree = strictMapper.readTree(queryJson);
        } catch (JsonProcessingException e) {
            throw new MalformedQueryException(ResourceManager.getErrorMessage("query.json.invalid"), e);
        }
        if (commandTree == null || !commandTree.isObject()) {
            throw new MalformedQueryException(ResourceManager.getErrorMessage("query.json.not.object"));
        }

        Document command;
        try {
            command = Document.parse(queryJson);
        } catch (JsonParseException | BSONException e) {
            throw new MalformedQueryException(ResourceManager.getErrorMessage("query.json.invalid"), e);
        }

        Object collectionValue = command.get("collection");
        if (collectionValue != null && !(collectionValue instanceof String)) {
            throw new MalformedQueryException(ResourceManager.getErrorMessage("query.collection.not.string"));
        }
        String collection = (String) collectionValue;
        if (collection == null || collection.isBlank()) {
            throw new MissingCollectionException();
        }

        Object operationValue = command.get("operation");
        DocumentOperation operation;
        if (operationValue == null) {
            operation = DocumentOperation.FIND;
        } else if (operationValue instanceof String) {
            operation = DocumentOperation.fromWireName((String) operationValue);
        } else {
            throw new MalformedQueryException(ResourceManager.getErrorMessage("query.operation.not.string"));
        }

        return new DocumentCommand(command, collection, operation);
    }

    public String collection() {
        return collection;
    }

    public DocumentOperation operation() {
        return operation;
    }

    /**
     * @return the query filter, an empty document when absent
     */
    public Document filter() {
        Document filter = optionalDocument("filter");
        return filter == null ? new Document() : filter;
    }

    public Document projection() {
        return optionalDocument("projection");
    }

    /**
     * @return sort keys in the order given by the caller, or null
     */
    public Document sort() {
        return optionalDocument("sort");
    }

    public Integer skip() {
        return optionalInteger("skip");
    }

    public Integer limit() {
        return optionalInteger("limit");
    }

    /**
     * @return the document for {@code insert_one}, an empty document when absent
     */
    public Document document() {
        Document document = optionalDocument("document");
        return document == null ? new Document() : document;
    }

    /**
     * @return documents for {@code insert_many}, an empty list when absent
     */
    public List<Document> documents() {
        return documentList("documents");
    }

    /**
     * @return stages for {@code aggregate} in the order given, an empty list when absent
     */
    public List<Document> pipeline() {
        return documentList("pipeline");
    }

    /**
     * @return true when {@code update} is an array of aggregation stages rather than an update document
     */
    public boolean isPipelineUpdate() {
        return command.get("update") instanceof List;
    }

    /**
     * @return the update document, an empty document when absent
     */
    public Document update() {
        Document update = optionalDocument("update");
        return update == null ? new Document() : update;
    }

    public List<Document> updatePipeline() {
        return documentList("update");
    }

    private Document optionalDocument(String fieldName) {
        Object fieldValue = command.get(fieldName);
        if (fieldValue == null) {
            return null;
        }
        if (fieldValue instanceof Document) {
            return (Document) fieldValue;
        }
        throw wrongType(fieldName, "an object");
    }

    private Integer optionalInteger(String fieldName) {
        Object fieldValue = command.get(fieldName);
        if (fieldValue == null) {
            return null;
        }
        if (fieldValue instanceof Integer) {
            return (Integer) fieldValue;
        }
        if (fieldValue instanceof Long) {
            long longValue = (Long) fieldValue;
            if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
                return (int) longValue;
            }
        }
        throw wrongType(fieldName, "an integer");
    }

    private List<Document> documentList(String fieldName) {
        Object fieldValue = command.get(fieldName);
        if (fieldValue == null) {
            return Collections.emptyList();
        }
        if (!(fieldValue instanceof List)) {
            throw wrongType(fieldName, "an array of objects");
        }
        List<Document> documents = new ArrayList<>();
        for (Object element : (List<?>) fieldValue) {
            if (!(element instanceof Document)) {
                throw wrongType(fieldName, "an array of objects");
            }
            documents.add((Document) element);
        }
        return documents;
    }

    private static MalformedQueryException wrongType(String fieldName, String expected) {
        return new MalformedQueryException(ResourceManager.getErrorMessage("query.field.wrong.type", fieldName, expected));
    }

    @Override
    public String toString() {
        return "DocumentCommand[collection=" + collection + ", operation=" + operation.wireName() + "]";
    }
}
