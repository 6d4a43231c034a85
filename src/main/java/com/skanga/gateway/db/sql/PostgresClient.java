package com.skanga.gateway.db.sql;

import com.skanga.gateway.db.DatabaseBackend;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL client. Introspection uses the system catalogs and information_schema.
 */
public final class PostgresClient extends JdbcClient {
    private static final Logger logger = LoggerFactory.getLogger(PostgresClient.class);

    static final String LIST_DATABASES_SQL =
            "SELECT datname FROM pg_database WHERE datistemplate = false";
    static final String LIST_TABLES_SQL =
            "SELECT tablename FROM pg_tables WHERE schemaname = 'public'";
    static final String DESCRIBE_TABLE_SQL = """
            SELECT
                column_name AS column_name,
                data_type AS data_type,
                is_nullable AS is_nullable,
                column_default AS column_default,
                character_maximum_length AS character_maximum_length
            FROM information_schema.columns
            WHERE table_name = ?
            ORDER BY ordinal_position
            """;

    public PostgresClient(HikariDataSource dataSource) {
        super(dataSource);
    }

    @Override
    public DatabaseBackend backend() {
        return DatabaseBackend.POSTGRES;
    }

    @Override
    public List<String> listDatabases() {
        return firstColumn(executeQuery(LIST_DATABASES_SQL));
    }

    /**
     * Lists tables of the {@code public} schema. A PostgreSQL session cannot switch
     * databases, so the argument only scopes the pool's own database.
     */
    @Override
    public List<String> listTables(String database) {
        if (database != null) {
            logger.debug("Ignoring database '{}', PostgreSQL lists tables of the connected database only", database);
        }
        return firstColumn(executeQuery(LIST_TABLES_SQL));
    }

    @Override
    public List<Map<String, Object>> describeTable(String tableName) {
        return executeQuery(DESCRIBE_TABLE_SQL, Collections.singletonList(tableName));
    }
}
