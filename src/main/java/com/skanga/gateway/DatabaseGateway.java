package com.skanga.gateway;

import com.skanga.gateway.config.CliUtils;
import com.skanga.gateway.config.ConfigParams;
import com.skanga.gateway.db.ConnectionManager;
import com.skanga.gateway.db.DatabaseClient;
import com.skanga.gateway.format.ResultFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The four operations exposed to an agent-facing transport: run a query, list databases,
 * list tables (collections) and describe a table (collection). Every operation returns
 * text produced by {@link ResultFormatter}.
 *
 * <p>The gateway holds no client of its own. It asks the {@link ConnectionManager} for
 * the active client on every call, so after a disconnect every operation fails with
 * {@link com.skanga.gateway.db.NotConnectedException}.
 */
public class DatabaseGateway {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseGateway.class);

    private final ConnectionManager connectionManager;
    private final Map<String, Object> serverInfo;

    public DatabaseGateway(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
        this.serverInfo = new HashMap<>();
        this.serverInfo.put("name", CliUtils.SERVER_NAME);
        this.serverInfo.put("version", CliUtils.SERVER_VERSION);
    }

    /**
     * Loads configuration from the given arguments (and the usual fallbacks), connects
     * and returns a ready gateway.
     *
     * @param args command line arguments
     * @return a connected gateway
     * @throws IOException if a configured config file cannot be read
     */
    public static DatabaseGateway connect(String[] args) throws IOException {
        ConfigParams configParams = CliUtils.loadConfiguration(args);
        ConnectionManager connectionManager = new ConnectionManager(configParams);
        connectionManager.connect();
        logger.info("{} v{} ready", CliUtils.SERVER_NAME, CliUtils.SERVER_VERSION);
        return new DatabaseGateway(connectionManager);
    }

    /**
     * Runs a query, SQL for relational backends or a JSON document command for MongoDB.
     *
     * @param query      query text
     * @param formatType {@code "markdown"} or {@code "json"}
     * @return formatted results
     */
    public String executeQuery(String query, String formatType) {
        DatabaseClient client = connectionManager.client();
        logger.debug("execute_query on {} (format={})", client.backend().configName(), formatType);
        List<Map<String, Object>> results = client.executeQuery(query);
        return ResultFormatter.formatResults(results, formatType);
    }

    public String executeQuery(String query) {
        return executeQuery(query, ResultFormatter.FORMAT_JSON);
    }

    public String listDatabases(String formatType) {
        DatabaseClient client = connectionManager.client();
        logger.debug("list_databases on {}", client.backend().configName());
        return ResultFormatter.formatResults(client.listDatabases(), formatType);
    }

    public String listDatabases() {
        return listDatabases(ResultFormatter.FORMAT_JSON);
    }

    /**
     * @param database database to inspect, or null for the configured one
     */
    public String listTables(String database, String formatType) {
        DatabaseClient client = connectionManager.client();
        logger.debug("list_tables on {} (database={})", client.backend().configName(), database);
        return ResultFormatter.formatResults(client.listTables(database), formatType);
    }

    public String listTables(String database) {
        return listTables(database, ResultFormatter.FORMAT_JSON);
    }

    public String describeTable(String tableName, String formatType) {
        DatabaseClient client = connectionManager.client();
        logger.debug("describe_table on {} (table={})", client.backend().configName(), tableName);
        return ResultFormatter.formatResults(client.describeTable(tableName), formatType);
    }

    public String describeTable(String tableName) {
        return describeTable(tableName, ResultFormatter.FORMAT_JSON);
    }

    public Map<String, Object> getServerInfo() {
        return serverInfo;
    }

    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }
}
