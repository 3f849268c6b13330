package com.skanga.sqlgate.db;

import com.skanga.sqlgate.config.DatabaseEngine;
import com.skanga.sqlgate.context.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out the connection a context uses for a logical database. The first request for a name
 * borrows a connection from that database's pool and caches it in the context; later requests
 * in the same context get the cached connection back. Contexts never share connections.
 */
public class ConnectionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private static final EngineDialect SQLITE_DIALECT = new SqliteDialect();
    private static final EngineDialect MYSQL_DIALECT = new MysqlDialect();

    private final DataSourceRegistry dataSourceRegistry;

    public ConnectionRegistry(DataSourceRegistry dataSourceRegistry) {
        this.dataSourceRegistry = dataSourceRegistry;
    }

    /**
     * @param context      the caller's context, which owns the returned connection
     * @param databaseName logical database name
     * @return an open connection with auto-commit disabled
     * @throws SQLException if a connection cannot be obtained
     * @throws com.skanga.sqlgate.config.ConfigurationException if the name is not configured
     */
    public Connection getConnection(ExecutionContext context, String databaseName) throws SQLException {
        Connection cached = context.cachedConnection(databaseName);
        if (cached != null) {
            if (!cached.isClosed()) {
                return cached;
            }
            logger.debug("Cached connection for database {} was closed, borrowing a new one", databaseName);
            context.evictConnection(databaseName);
        }

        Connection dbConn = dataSourceRegistry.dataSource(databaseName).getConnection();
        try {
            if (dbConn.getAutoCommit()) {
                dbConn.setAutoCommit(false);
            }
        } catch (SQLException e) {
            dbConn.close();
            throw e;
        }
        context.cacheConnection(databaseName, dbConn);
        logger.debug("Connection for database {} cached for user {}", databaseName, context.currentUser());
        return dbConn;
    }

    public EngineDialect dialectFor(String databaseName) {
        return dataSourceRegistry.descriptor(databaseName).engine() == DatabaseEngine.CLIENT_SERVER
                ? MYSQL_DIALECT : SQLITE_DIALECT;
    }
}
