package com.skanga.gateway.db;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.skanga.gateway.config.ConfigParams;
import com.skanga.gateway.db.mongo.MongoDatabaseClient;
import com.skanga.gateway.db.sql.MySqlClient;
import com.skanga.gateway.db.sql.PostgresClient;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Default factory: HikariCP pools for the relational backends and the MongoDB
 * driver's own pool for the document store.
 */
public class PooledClientFactory implements DatabaseClientFactory {
    private static final Logger logger = LoggerFactory.getLogger(PooledClientFactory.class);

    @Override
    public DatabaseClient createPostgres(ConfigParams configParams) {
        HikariConfig poolConfig = createPoolConfig(configParams, DatabaseBackend.POSTGRES);
        poolConfig.setDriverClassName("org.postgresql.Driver");
        poolConfig.addDataSourceProperty("cachePrepStmts", "true");
        poolConfig.addDataSourceProperty("prepStmtCacheSize", "250");
        poolConfig.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
        poolConfig.addDataSourceProperty("ApplicationName", "DBGateway");
        return new PostgresClient(new HikariDataSource(poolConfig));
    }

    @Override
    public DatabaseClient createMySql(ConfigParams configParams) {
        HikariConfig poolConfig = createPoolConfig(configParams, DatabaseBackend.MYSQL);
        poolConfig.setDriverClassName("com.mysql.cj.jdbc.Driver");
        poolConfig.addDataSourceProperty("cachePrepStmts", "true");
        poolConfig.addDataSourceProperty("prepStmtCacheSize", "250");
        poolConfig.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
        poolConfig.addDataSourceProperty("useServerPrepStmts", "true");
        poolConfig.addDataSourceProperty("cacheResultSetMetadata", "true");
        return new MySqlClient(new HikariDataSource(poolConfig));
    }

    @Override
    public DatabaseClient createMongo(ConfigParams configParams) {
        int port = configParams.portOrDefault(DatabaseBackend.MONGODB);
        MongoClientSettings.Builder settingsBuilder = MongoClientSettings.builder()
                .applyToClusterSettings(builder -> builder
                        .hosts(List.of(new ServerAddress(configParams.dbHost(), port))))
                .applyToConnectionPoolSettings(builder -> builder
                        .minSize(configParams.minPoolSize())
                        .maxSize(configParams.maxPoolSize()))
                .applyToSocketSettings(builder -> builder
                        .connectTimeout(configParams.connectionTimeoutMs(), TimeUnit.MILLISECONDS));

        if (configParams.dbUser() != null && !configParams.dbUser().isEmpty()) {
            settingsBuilder.credential(MongoCredential.createCredential(
                    configParams.dbUser(), configParams.authSource(), configParams.dbPassword().toCharArray()));
        }

        MongoClient mongoClient = MongoClients.create(settingsBuilder.build());
        try {
            // The driver connects lazily, ping so that bad hosts or credentials fail at startup
            mongoClient.getDatabase(configParams.dbName()).runCommand(new Document("ping", 1));
        } catch (RuntimeException e) {
            mongoClient.close();
            throw e;
        }
        return new MongoDatabaseClient(mongoClient, configParams.dbName());
    }

    /**
     * Builds the HikariCP settings shared by both relational backends.
     */
    HikariConfig createPoolConfig(ConfigParams configParams, DatabaseBackend backend) {
        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setJdbcUrl(jdbcUrl(configParams, backend));
        poolConfig.setUsername(configParams.dbUser());
        poolConfig.setPassword(configParams.dbPassword());
        poolConfig.setMinimumIdle(configParams.minPoolSize());
        poolConfig.setMaximumPoolSize(configParams.maxPoolSize());
        poolConfig.setConnectionTimeout(configParams.connectionTimeoutMs());
        poolConfig.setAutoCommit(true);
        poolConfig.setPoolName("DBGatewayPool-" + backend.configName());

        logger.info("Initializing {} connection pool with settings - Min: {}, Max: {}, Timeout: {}ms",
                backend.configName(), configParams.minPoolSize(), configParams.maxPoolSize(),
                configParams.connectionTimeoutMs());
        return poolConfig;
    }

    static String jdbcUrl(ConfigParams configParams, DatabaseBackend backend) {
        String scheme = switch (backend) {
            case POSTGRES -> "postgresql";
            case MYSQL -> "mysql";
            case MONGODB -> throw new IllegalArgumentException("MongoDB has no JDBC URL");
        };
        return String.format("jdbc:%s://%s:%d/%s", scheme, configParams.dbHost(),
                configParams.portOrDefault(backend), configParams.dbName());
    }
}
