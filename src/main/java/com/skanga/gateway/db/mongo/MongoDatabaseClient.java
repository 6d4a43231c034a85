package com.skanga.gateway.db.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertManyResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import com.skanga.gateway.db.BackendDriverException;
import com.skanga.gateway.db.DatabaseBackend;
import com.skanga.gateway.db.DatabaseClient;
import org.bson.BsonValue;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MongoDB client using the official MongoDB Java sync driver.
 * Queries are JSON document commands (see {@link DocumentCommand}); every returned
 * document goes through {@link DocumentSerializer}.
 */
public final class MongoDatabaseClient implements DatabaseClient {
    private static final Logger logger = LoggerFactory.getLogger(MongoDatabaseClient.class);
    public static final int SCHEMA_SAMPLE_SIZE = 100;

    private final MongoClient mongoClient;
    private final String databaseName;

    public MongoDatabaseClient(MongoClient mongoClient, String databaseName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
    }

    @Override
    public DatabaseBackend backend() {
        return DatabaseBackend.MONGODB;
    }

    /**
     * Parses and runs a document command.
     *
     * @param queryJson JSON command text
     * @param params    ignored, document commands carry their values inline
     * @return result records; write operations return a single summary record
     */
    @Override
    public List<Map<String, Object>> executeQuery(String queryJson, List<Object> params) {
        DocumentCommand command = DocumentCommand.parse(queryJson);
        logger.debug("Executing {}", command);

        try {
            MongoCollection<Document> collection = mongoClient.getDatabase(databaseName)
                    .getCollection(command.collection());
            return switch (command.operation()) {
                case FIND -> find(collection, command);
                case FIND_ONE -> findOne(collection, command);
                case AGGREGATE -> DocumentSerializer.serializeAll(
                        collection.aggregate(command.pipeline()).into(new ArrayList<>()));
                case COUNT -> singleRecord("count", collection.countDocuments(command.filter()));
                case INSERT_ONE -> insertOne(collection, command);
                case INSERT_MANY -> insertMany(collection, command);
                case UPDATE_ONE -> updateSummary(command.isPipelineUpdate()
                        ? collection.updateOne(command.filter(), command.updatePipeline())
                        : collection.updateOne(command.filter(), command.update()));
                case UPDATE_MANY -> updateSummary(command.isPipelineUpdate()
                        ? collection.updateMany(command.filter(), command.updatePipeline())
                        : collection.updateMany(command.filter(), command.update()));
                case DELETE_ONE -> deleteSummary(collection.deleteOne(command.filter()));
                case DELETE_MANY -> deleteSummary(collection.deleteMany(command.filter()));
            };
        } catch (MongoException | IllegalArgumentException e) {
            logger.error("Command {} failed: {}", command, e.getMessage());
            throw new BackendDriverException(backend(), e);
        }
    }

    private List<Map<String, Object>> find(MongoCollection<Document> collection, DocumentCommand command) {
        FindIterable<Document> cursor = collection.find(command.filter());
        Document projection = command.projection();
        if (projection != null) {
            cursor = cursor.projection(projection);
        }
        Document sort = command.sort();
        if (sort != null) {
            cursor = cursor.sort(sort);
        }
        Integer skip = command.skip();
        if (skip != null) {
            cursor = cursor.skip(skip);
        }
        Integer limit = command.limit();
        if (limit != null) {
            cursor = cursor.limit(limit);
        }
        return DocumentSerializer.serializeAll(cursor.into(new ArrayList<>()));
    }

    private List<Map<String, Object>> findOne(MongoCollection<Document> collection, DocumentCommand command) {
        FindIterable<Document> cursor = collection.find(command.filter());
        Document projection = command.projection();
        if (projection != null) {
            cursor = cursor.projection(projection);
        }
        Document document = cursor.first();
        List<Map<String, Object>> results = new ArrayList<>();
        if (document != null) {
            results.add(DocumentSerializer.serialize(document));
        }
        return results;
    }

    private List<Map<String, Object>> insertOne(MongoCollection<Document> collection, DocumentCommand command) {
        InsertOneResult insertResult = collection.insertOne(command.document());
        return singleRecord("inserted_id", stringifyId(insertResult.getInsertedId()));
    }

    private List<Map<String, Object>> insertMany(MongoCollection<Document> collection, DocumentCommand command) {
        List<Document> documents = command.documents();
        List<String> insertedIds = new ArrayList<>();
        if (documents.isEmpty()) {
            // The driver rejects an empty batch, nothing to insert is not an error here
            return singleRecord("inserted_ids", insertedIds);
        }
        InsertManyResult insertResult = collection.insertMany(documents);
        Map<Integer, BsonValue> idsByIndex = insertResult.getInsertedIds();
        for (int i = 0; i < documents.size(); i++) {
            insertedIds.add(stringifyId(idsByIndex.get(i)));
        }
        return singleRecord("inserted_ids", insertedIds);
    }

    private static List<Map<String, Object>> updateSummary(UpdateResult updateResult) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("matched", updateResult.getMatchedCount());
        summary.put("modified", updateResult.getModifiedCount());
        List<Map<String, Object>> results = new ArrayList<>();
        results.add(summary);
        return results;
    }

    private static List<Map<String, Object>> deleteSummary(DeleteResult deleteResult) {
        return singleRecord("deleted", deleteResult.getDeletedCount());
    }

    private static List<Map<String, Object>> singleRecord(String fieldName, Object fieldValue) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put(fieldName, fieldValue);
        List<Map<String, Object>> results = new ArrayList<>();
        results.add(summary);
        return results;
    }

    /**
     * Renders a generated identifier as text. Identifiers are opaque, an ObjectId becomes
     * its hex form and other values their natural string form.
     */
    static String stringifyId(BsonValue insertedId) {
        if (insertedId == null) {
            return null;
        }
        if (insertedId.isObjectId()) {
            return insertedId.asObjectId().getValue().toHexString();
        }
        if (insertedId.isString()) {
            return insertedId.asString().getValue();
        }
        if (insertedId.isDocument()) {
            return insertedId.asDocument().toJson();
        }
        return String.valueOf(DocumentSerializer.serializeValue(insertedId));
    }

    @Override
    public List<String> listDatabases() {
        try {
            return mongoClient.listDatabaseNames().into(new ArrayList<>());
        } catch (MongoException e) {
            throw new BackendDriverException(backend(), e);
        }
    }

    /**
     * @param database database to list, the configured one when null or blank
     */
    @Override
    public List<String> listTables(String database) {
        String targetDatabase = database == null || database.isBlank() ? databaseName : database;
        try {
            return mongoClient.getDatabase(targetDatabase).listCollectionNames().into(new ArrayList<>());
        } catch (MongoException | IllegalArgumentException e) {
            throw new BackendDriverException(backend(), e);
        }
    }

    /**
     * Infers the fields of a collection from up to {@value #SCHEMA_SAMPLE_SIZE} documents
     * in natural order. An empty collection yields an empty list.
     */
    @Override
    public List<Map<String, Object>> describeTable(String collectionName) {
        List<Document> sampleDocuments;
        try {
            sampleDocuments = mongoClient.getDatabase(databaseName).getCollection(collectionName)
                    .find()
                    .limit(SCHEMA_SAMPLE_SIZE)
                    .into(new ArrayList<>());
        } catch (MongoException | IllegalArgumentException e) {
            throw new BackendDriverException(backend(), e);
        }
        logger.debug("Sampled {} documents from collection {}", sampleDocuments.size(), collectionName);
        return SchemaInferrer.infer(sampleDocuments);
    }

    @Override
    public void close() {
        try {
            mongoClient.close();
            logger.info("MongoDB client closed");
        } catch (RuntimeException e) {
            logger.warn("Error closing MongoDB client: {}", e.getMessage(), e);
        }
    }
}
