package com.skanga.gateway.db;

import java.util.List;
import java.util.Map;

/**
 * Capability set shared by every backend. Implementations are bound to one live
 * connection pool for their whole lifetime; once closed they are not reused.
 *
 * <p>Result records preserve the backend's field order and row order. Schema
 * descriptors differ between relational and document backends, so callers must
 * not assume one layout.
 *
 * <p>Implementations are thread-safe: every call acquires its own pooled
 * connection and releases it before returning, on success or failure.
 */
public interface DatabaseClient extends AutoCloseable {

    DatabaseBackend backend();

    /**
     * Executes a backend query.
     *
     * @param query  SQL text for relational backends, a JSON document command for MongoDB
     * @param params positional parameters for relational backends; may be null or empty
     * @return materialized result records, empty for statements without a result set
     * @throws BackendDriverException if the driver rejects or fails the query
     */
    List<Map<String, Object>> executeQuery(String query, List<Object> params);

    default List<Map<String, Object>> executeQuery(String query) {
        return executeQuery(query, null);
    }

    /**
     * @return names of the databases visible to the configured user
     */
    List<String> listDatabases();

    /**
     * Lists tables or collections.
     *
     * @param database database to inspect, or null for the configured one
     * @return table or collection names
     */
    List<String> listTables(String database);

    /**
     * Describes a table's columns or infers a collection's fields.
     *
     * @param tableName table or collection name
     * @return one descriptor per column or field path
     */
    List<Map<String, Object>> describeTable(String tableName);

    /**
     * Releases the connection pool. Safe to call more than once.
     */
    @Override
    void close();
}
