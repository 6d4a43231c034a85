package com.skanga.gateway.db.sql;

import com.skanga.gateway.db.BackendDriverException;
import com.skanga.gateway.db.DatabaseBackend;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * MySQL client. {@link #listTables(String)} switches the catalog of the borrowed
 * connection and switches it back before the connection returns to the pool.
 */
public final class MySqlClient extends JdbcClient {
    static final String LIST_DATABASES_SQL = "SHOW DATABASES";
    static final String LIST_TABLES_SQL = "SHOW TABLES";
    static final String DESCRIBE_TABLE_SQL = """
            SELECT
                column_name AS column_name,
                data_type AS data_type,
                is_nullable AS is_nullable,
                column_default AS column_default,
                character_maximum_length AS character_maximum_length
            FROM information_schema.columns
            WHERE table_schema = DATABASE() AND table_name = ?
            ORDER BY ordinal_position
            """;

    public MySqlClient(HikariDataSource dataSource) {
        super(dataSource);
    }

    @Override
    public DatabaseBackend backend() {
        return DatabaseBackend.MYSQL;
    }

    @Override
    public List<String> listDatabases() {
        return firstColumn(executeQuery(LIST_DATABASES_SQL));
    }

    @Override
    public List<String> listTables(String database) {
        if (database == null) {
            return firstColumn(executeQuery(LIST_TABLES_SQL));
        }
        try (Connection dbConn = dataSource.getConnection()) {
            String originalCatalog = dbConn.getCatalog();
            dbConn.setCatalog(database);
            try {
                return firstColumn(runQuery(dbConn, LIST_TABLES_SQL, null));
            } finally {
                if (originalCatalog != null) {
                    dbConn.setCatalog(originalCatalog);
                }
            }
        } catch (SQLException e) {
            throw new BackendDriverException(backend(), e);
        }
    }

    @Override
    public List<Map<String, Object>> describeTable(String tableName) {
        return executeQuery(DESCRIBE_TABLE_SQL, Collections.singletonList(tableName));
    }
}
