package com.skanga.gateway.db.sql;

import com.skanga.gateway.db.BackendDriverException;
import com.skanga.gateway.db.DatabaseClient;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC logic shared by the relational clients. Queries are sent verbatim; the only
 * processing is positional parameter binding and materializing rows into ordered maps.
 * We use <a href="https://www.baeldung.com/hikaricp">HikariCP connection pooling</a>;
 * every call borrows one connection and returns it before completing.
 */
public abstract class JdbcClient implements DatabaseClient {
    private static final Logger logger = LoggerFactory.getLogger(JdbcClient.class);

    protected final HikariDataSource dataSource;

    protected JdbcClient(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Map<String, Object>> executeQuery(String sqlQuery, List<Object> paramList) {
        try (Connection dbConn = dataSource.getConnection()) {
            return runQuery(dbConn, sqlQuery, paramList);
        } catch (SQLException e) {
            logger.error("Query execution failed on {}: {} - Error: {}", backend().configName(),
                    abbreviate(sqlQuery, 100), e.getMessage());
            throw new BackendDriverException(backend(), e);
        }
    }

    /**
     * Runs one statement on an already borrowed connection.
     *
     * @return rows of the result set, or an empty list for statements without one
     */
    protected List<Map<String, Object>> runQuery(Connection dbConn, String sqlQuery, List<Object> paramList)
            throws SQLException {
        long startTime = System.currentTimeMillis();

        try (PreparedStatement prepStmt = dbConn.prepareStatement(sqlQuery)) {
            if (paramList != null && !paramList.isEmpty()) {
                logger.debug("Binding {} parameters to query", paramList.size());
                for (int i = 0; i < paramList.size(); i++) {
                    setParameterValue(prepStmt, i + 1, paramList.get(i));
                }
            }

            logger.debug("Executing query: {}", abbreviate(sqlQuery, 200));
            boolean isResultSet = prepStmt.execute();

            List<Map<String, Object>> resultRows = new ArrayList<>();
            if (isResultSet) {
                try (ResultSet resultSet = prepStmt.getResultSet()) {
                    ResultSetMetaData metaData = resultSet.getMetaData();
                    int columnCount = metaData.getColumnCount();

                    List<String> resultColumns = new ArrayList<>(columnCount);
                    for (int i = 1; i <= columnCount; i++) {
                        resultColumns.add(metaData.getColumnLabel(i));
                    }

                    while (resultSet.next()) {
                        Map<String, Object> currRow = new LinkedHashMap<>();
                        for (int i = 1; i <= columnCount; i++) {
                            currRow.put(resultColumns.get(i - 1), resultSet.getObject(i));
                        }
                        resultRows.add(currRow);
                    }
                }
            } else {
                logger.debug("Statement affected {} rows", prepStmt.getUpdateCount());
            }

            logger.debug("Query completed in {}ms, returned {} rows",
                    System.currentTimeMillis() - startTime, resultRows.size());
            return resultRows;
        }
    }

    /**
     * Sets a parameter value in a PreparedStatement with appropriate type handling.
     * Handles common Java types and converts them to appropriate SQL types.
     *
     * @param prepStmt   The PreparedStatement to set the parameter on
     * @param paramIndex The 1-based parameter index
     * @param paramValue The parameter value to set
     * @throws SQLException if parameter setting fails
     */
    static void setParameterValue(PreparedStatement prepStmt, int paramIndex, Object paramValue) throws SQLException {
        if (paramValue == null) {
            prepStmt.setNull(paramIndex, java.sql.Types.NULL);
        } else if (paramValue instanceof String) {
            prepStmt.setString(paramIndex, (String) paramValue);
        } else if (paramValue instanceof Integer) {
            prepStmt.setInt(paramIndex, (Integer) paramValue);
        } else if (paramValue instanceof Long) {
            prepStmt.setLong(paramIndex, (Long) paramValue);
        } else if (paramValue instanceof Double) {
            prepStmt.setDouble(paramIndex, (Double) paramValue);
        } else if (paramValue instanceof Float) {
            prepStmt.setFloat(paramIndex, (Float) paramValue);
        } else if (paramValue instanceof Boolean) {
            prepStmt.setBoolean(paramIndex, (Boolean) paramValue);
        } else if (paramValue instanceof BigDecimal) {
            prepStmt.setBigDecimal(paramIndex, (BigDecimal) paramValue);
        } else if (paramValue instanceof java.sql.Date) {
            prepStmt.setDate(paramIndex, (java.sql.Date) paramValue);
        } else if (paramValue instanceof java.sql.Time) {
            prepStmt.setTime(paramIndex, (java.sql.Time) paramValue);
        } else if (paramValue instanceof java.sql.Timestamp) {
            prepStmt.setTimestamp(paramIndex, (java.sql.Timestamp) paramValue);
        } else if (paramValue instanceof java.util.Date) {
            prepStmt.setTimestamp(paramIndex, new java.sql.Timestamp(((java.util.Date) paramValue).getTime()));
        } else {
            // Let the driver map anything else (java.time types, UUID, byte[])
            prepStmt.setObject(paramIndex, paramValue);
        }
    }

    /**
     * Reads a single-column introspection query into a list of strings.
     */
    protected List<String> firstColumn(List<Map<String, Object>> resultRows) {
        List<String> values = new ArrayList<>(resultRows.size());
        for (Map<String, Object> currRow : resultRows) {
            Object firstValue = currRow.values().iterator().next();
            values.add(firstValue == null ? null : firstValue.toString());
        }
        return values;
    }

    /**
     * Closes the connection pool and releases all database resources.
     * This method is idempotent and safe to call multiple times.
     */
    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            try {
                dataSource.close();
                logger.info("{} connection pool closed", backend().configName());
            } catch (RuntimeException e) {
                logger.warn("Error closing {} connection pool: {}", backend().configName(), e.getMessage(), e);
            }
        }
    }

    static String abbreviate(String sqlQuery, int maxLength) {
        if (sqlQuery == null) {
            return "null";
        }
        return sqlQuery.length() > maxLength ? sqlQuery.substring(0, maxLength) + "..." : sqlQuery;
    }
}
