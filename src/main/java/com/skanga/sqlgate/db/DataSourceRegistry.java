package com.skanga.sqlgate.db;

import com.skanga.sqlgate.config.ConfigParams;
import com.skanga.sqlgate.config.ConfigurationException;
import com.skanga.sqlgate.config.DatabaseDescriptor;
import com.skanga.sqlgate.config.DatabaseEngine;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide connection pools, one per logical database, created on first use.
 * Contexts borrow connections from these pools and keep them until they are closed.
 * This class is thread-safe.
 */
public class DataSourceRegistry implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DataSourceRegistry.class);

    private final ConfigParams configParams;
    private final Map<String, DataSource> dataSources = new ConcurrentHashMap<>();

    public DataSourceRegistry(ConfigParams configParams) {
        this.configParams = configParams;
    }

    /**
     * Returns the pool of a logical database, creating it on first use.
     *
     * @param databaseName logical database name
     * @return the pool
     * @throws ConfigurationException if the name is not configured or its pool cannot be set up
     */
    public DataSource dataSource(String databaseName) {
        DatabaseDescriptor descriptor = configParams.requireDatabase(databaseName);
        return dataSources.computeIfAbsent(descriptor.name(), name -> createPool(descriptor));
    }

    /**
     * Uses an externally managed data source for a configured database instead of a pool built
     * from its descriptor. The data source must hand out connections with auto-commit disabled
     * or tolerate it being disabled.
     */
    public void register(String databaseName, DataSource dataSource) {
        DatabaseDescriptor descriptor = configParams.requireDatabase(databaseName);
        dataSources.put(descriptor.name(), dataSource);
    }

    public DatabaseDescriptor descriptor(String databaseName) {
        return configParams.requireDatabase(databaseName);
    }

    private HikariDataSource createPool(DatabaseDescriptor descriptor) {
        // Load the database driver
        try {
            Class.forName(descriptor.engine().driverClassName());
        } catch (ClassNotFoundException e) {
            logger.error("Failed to load database driver: {}", descriptor.engine().driverClassName(), e);
            throw new ConfigurationException("Database driver not found: " + descriptor.engine().driverClassName(), e);
        }

        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setPoolName("sqlgate-" + descriptor.name());
        poolConfig.setDriverClassName(descriptor.engine().driverClassName());
        poolConfig.setMaximumPoolSize(configParams.maxConnections());
        poolConfig.setConnectionTimeout(configParams.connectionTimeoutMs());
        poolConfig.setIdleTimeout(configParams.idleTimeoutMs());                       // 10 minutes default
        poolConfig.setMaxLifetime(configParams.maxLifetimeMs());                       // 30 minutes
        poolConfig.setLeakDetectionThreshold(configParams.leakDetectionThresholdMs()); // 1 minute
        poolConfig.setAutoCommit(false);
        // Connection failures surface per statement, not at pool creation
        poolConfig.setInitializationFailTimeout(-1);

        if (descriptor.engine() == DatabaseEngine.EMBEDDED_FILE) {
            Path databaseFile = descriptor.resolveFilePath(configParams.dataDirectory());
            try {
                Files.createDirectories(databaseFile.getParent());
            } catch (IOException e) {
                throw new ConfigurationException("Cannot create data directory for database "
                        + descriptor.name() + ": " + databaseFile.getParent(), e);
            }
            poolConfig.setJdbcUrl(descriptor.jdbcUrl(configParams.dataDirectory()));
            poolConfig.addDataSourceProperty("busy_timeout", String.valueOf(configParams.connectionTimeoutMs()));
            poolConfig.addDataSourceProperty("journal_mode", "WAL");
        } else {
            poolConfig.setJdbcUrl(descriptor.jdbcUrl(configParams.dataDirectory()));
            poolConfig.setUsername(descriptor.user());
            poolConfig.setPassword(descriptor.password());
        }

        HikariDataSource pool = new HikariDataSource(poolConfig);
        logger.info("Connection pool created for database {}", descriptor);
        return pool;
    }

    /**
     * Closes every pool this registry created. Registered external data sources are left open.
     */
    @Override
    public void close() {
        for (Map.Entry<String, DataSource> entry : dataSources.entrySet()) {
            if (entry.getValue() instanceof HikariDataSource) {
                HikariDataSource pool = (HikariDataSource) entry.getValue();
                if (!pool.isClosed()) {
                    pool.close();
                    logger.info("Connection pool closed for database {}", entry.getKey());
                }
            }
        }
        dataSources.clear();
    }
}
