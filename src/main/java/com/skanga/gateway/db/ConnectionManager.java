package com.skanga.gateway.db;

import com.skanga.gateway.config.ConfigParams;
import com.skanga.gateway.config.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns backend selection and the lifecycle of the single active {@link DatabaseClient}.
 * The manager is an ordinary object: create one per process (or per test) and pass it
 * to whoever needs the client.
 *
 * <p>The manager is the only component that opens or closes connection pools.
 * Lifecycle methods are synchronized; {@link #client()} only reads a volatile field
 * so concurrent queries never contend on the manager.
 */
public class ConnectionManager {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final ConfigParams configParams;
    private final DatabaseClientFactory clientFactory;
    private volatile DatabaseClient activeClient;

    /**
     * Creates a manager that builds real pools (HikariCP or the MongoDB driver pool).
     *
     * @param configParams connection configuration
     */
    public ConnectionManager(ConfigParams configParams) {
        this(configParams, new PooledClientFactory());
    }

    /**
     * Creates a manager with a custom client factory.
     * Useful for testing or when pools are managed externally.
     *
     * @param configParams  connection configuration
     * @param clientFactory factory used to build the client on {@link #connect()}
     */
    public ConnectionManager(ConfigParams configParams, DatabaseClientFactory clientFactory) {
        this.configParams = configParams;
        this.clientFactory = clientFactory;
    }

    /**
     * Resolves the configured backend and opens its connection pool.
     *
     * @throws UnsupportedBackendException if the backend identity is unknown; no pool is created
     * @throws IllegalStateException       if a client is already active
     */
    public synchronized void connect() {
        if (activeClient != null) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("connection.already.connected"));
        }
        DatabaseBackend backend = DatabaseBackend.fromConfig(configParams.dbBackend());

        logger.info("Connecting to {} at {}", backend.configName(), configParams.maskSensitive());
        DatabaseClient newClient = switch (backend) {
            case POSTGRES -> clientFactory.createPostgres(configParams);
            case MYSQL -> clientFactory.createMySql(configParams);
            case MONGODB -> clientFactory.createMongo(configParams);
        };
        activeClient = newClient;
        logger.info("Connected to {} database '{}'", backend.configName(), configParams.dbName());
    }

    /**
     * Closes the active client and its pool. Does nothing when not connected.
     */
    public synchronized void disconnect() {
        DatabaseClient currentClient = activeClient;
        if (currentClient == null) {
            return;
        }
        activeClient = null;
        currentClient.close();
        logger.info("Disconnected from {}", currentClient.backend().configName());
    }

    /**
     * Returns the active client.
     *
     * @return the client bound to the current pool
     * @throws NotConnectedException before {@link #connect()} or after {@link #disconnect()}
     */
    public DatabaseClient client() {
        DatabaseClient currentClient = activeClient;
        if (currentClient == null) {
            throw new NotConnectedException();
        }
        return currentClient;
    }

    /**
     * @return the backend of the active client
     * @throws NotConnectedException when not connected
     */
    public DatabaseBackend backend() {
        return client().backend();
    }

    public boolean isConnected() {
        return activeClient != null;
    }

    public ConfigParams getConfigParams() {
        return configParams;
    }
}
