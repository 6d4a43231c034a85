package com.skanga.gateway.db;

import com.skanga.gateway.config.ConfigParams;

/**
 * Builds a client together with its connection pool. Each method is called at most
 * once per connect cycle; failures from the underlying driver propagate as thrown.
 */
public interface DatabaseClientFactory {
    DatabaseClient createPostgres(ConfigParams configParams);

    DatabaseClient createMySql(ConfigParams configParams);

    DatabaseClient createMongo(ConfigParams configParams);
}
