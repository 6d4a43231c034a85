package com.skanga.gateway.db;

import com.skanga.gateway.config.ConfigParams;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConnectionManagerTest {
    @Mock
    DatabaseClientFactory clientFactory;

    @Mock
    DatabaseClient client;

    private static ConfigParams configFor(String backend) {
        return ConfigParams.defaultConfig(backend, "localhost", 0, "user", "pass", "appdb");
    }

    @Test
    void testClient_BeforeConnect() {
        ConnectionManager manager = new ConnectionManager(configFor("postgres"), clientFactory);

        assertFalse(manager.isConnected());
        assertThrows(NotConnectedException.class, manager::client);
        verifyNoInteractions(clientFactory);
    }

    @Test
    void testConnect_Postgres() {
        ConfigParams config = configFor("postgres");
        when(clientFactory.createPostgres(config)).thenReturn(client);
        ConnectionManager manager = new ConnectionManager(config, clientFactory);

        manager.connect();

        assertTrue(manager.isConnected());
        assertSame(client, manager.client());
        verify(clientFactory).createPostgres(config);
        verifyNoMoreInteractions(clientFactory);
    }

    @Test
    void testConnect_MySql() {
        ConfigParams config = configFor("MySQL");
        when(clientFactory.createMySql(config)).thenReturn(client);
        ConnectionManager manager = new ConnectionManager(config, clientFactory);

        manager.connect();

        assertSame(client, manager.client());
        verify(clientFactory, never()).createPostgres(any());
        verify(clientFactory, never()).createMongo(any());
    }

    @Test
    void testConnect_Mongo() {
        ConfigParams config = configFor("mongodb");
        when(clientFactory.createMongo(config)).thenReturn(client);
        when(client.backend()).thenReturn(DatabaseBackend.MONGODB);
        ConnectionManager manager = new ConnectionManager(config, clientFactory);

        manager.connect();

        assertEquals(DatabaseBackend.MONGODB, manager.backend());
    }

    @Test
    void testConnect_UnknownBackendCreatesNoPool() {
        ConnectionManager manager = new ConnectionManager(configFor("oracle"), clientFactory);

        UnsupportedBackendException exception = assertThrows(UnsupportedBackendException.class, manager::connect);

        assertEquals("oracle", exception.getBackendName());
        assertFalse(manager.isConnected());
        verifyNoInteractions(clientFactory);
    }

    @Test
    void testConnect_FactoryFailurePropagates() {
        ConfigParams config = configFor("postgres");
        RuntimeException poolFailure = new RuntimeException("Connection refused");
        when(clientFactory.createPostgres(config)).thenThrow(poolFailure);
        ConnectionManager manager = new ConnectionManager(config, clientFactory);

        RuntimeException thrown = assertThrows(RuntimeException.class, manager::connect);

        assertSame(poolFailure, thrown);
        assertFalse(manager.isConnected());
        verify(clientFactory, times(1)).createPostgres(config);
    }

    @Test
    void testConnect_WhileConnected() {
        ConfigParams config = configFor("postgres");
        when(clientFactory.createPostgres(config)).thenReturn(client);
        ConnectionManager manager = new ConnectionManager(config, clientFactory);
        manager.connect();

        assertThrows(IllegalStateException.class, manager::connect);
        verify(clientFactory, times(1)).createPostgres(config);
        assertSame(client, manager.client());
    }

    @Test
    void testDisconnect_ClosesClient() {
        ConfigParams config = configFor("postgres");
        when(clientFactory.createPostgres(config)).thenReturn(client);
        when(client.backend()).thenReturn(DatabaseBackend.POSTGRES);
        ConnectionManager manager = new ConnectionManager(config, clientFactory);
        manager.connect();

        manager.disconnect();

        verify(client).close();
        assertFalse(manager.isConnected());
        assertThrows(NotConnectedException.class, manager::client);
    }

    @Test
    void testDisconnect_Idempotent() {
        ConfigParams config = configFor("postgres");
        when(clientFactory.createPostgres(config)).thenReturn(client);
        when(client.backend()).thenReturn(DatabaseBackend.POSTGRES);
        ConnectionManager manager = new ConnectionManager(config, clientFactory);
        manager.connect();

        manager.disconnect();
        manager.disconnect();

        verify(client, times(1)).close();
    }

    @Test
    void testDisconnect_NeverConnected() {
        ConnectionManager manager = new ConnectionManager(configFor("postgres"), clientFactory);

        assertDoesNotThrow(manager::disconnect);
    }

    @Test
    void testReconnectAfterDisconnect() {
        ConfigParams config = configFor("postgres");
        DatabaseClient secondClient = mock(DatabaseClient.class);
        when(clientFactory.createPostgres(config)).thenReturn(client, secondClient);
        when(client.backend()).thenReturn(DatabaseBackend.POSTGRES);
        ConnectionManager manager = new ConnectionManager(config, clientFactory);

        manager.connect();
        manager.disconnect();
        manager.connect();

        assertSame(secondClient, manager.client());
    }

    @Test
    void testGetConfigParams() {
        ConfigParams config = configFor("postgres");
        ConnectionManager manager = new ConnectionManager(config, clientFactory);

        assertSame(config, manager.getConfigParams());
    }
}
