package com.mike.leadscout.service.scrape;

import com.mike.leadscout.entity.ConnectionStatus;
import com.mike.leadscout.entity.Platform;
import com.mike.leadscout.entity.PlatformConnection;
import com.mike.leadscout.repository.PlatformConnectionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PlatformConnectionServiceTest {

    private PlatformConnectionRepository repository;
    private PlatformConnectionService service;
    private PlatformConnection connection;

    @BeforeEach
    void setUp() {
        repository = mock(PlatformConnectionRepository.class);
        service = new PlatformConnectionService(repository, Clock.systemUTC());
        connection = PlatformConnection.builder().id(1L).userId(2L).platform(Platform.LINKEDIN)
                .status(ConnectionStatus.CONNECTED).build();
        when(repository.findById(1L)).thenReturn(Optional.of(connection));
        when(repository.save(any(PlatformConnection.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void errorThenSuccessRestoresConnected() {
        service.markError(1L, "Timeout: page load");
        assertEquals(ConnectionStatus.ERROR, connection.getStatus());
        assertEquals("Timeout: page load", connection.getLastError());

        service.markChecked(1L);
        assertEquals(ConnectionStatus.CONNECTED, connection.getStatus());
        assertNull(connection.getLastError());
        assertNotNull(connection.getLastCheckedAt());
    }

    @Test
    void errorDoesNotReviveDisconnectedConnection() {
        connection.setStatus(ConnectionStatus.DISCONNECTED);

        service.markError(1L, "boom");

        assertEquals(ConnectionStatus.DISCONNECTED, connection.getStatus());
        verify(repository, never()).save(any());
    }

    @Test
    void disconnectMarksDisconnected() {
        Optional<PlatformConnection> result = service.disconnect(1L);

        assertTrue(result.isPresent());
        assertEquals(ConnectionStatus.DISCONNECTED, connection.getStatus());
        assertTrue(service.disconnect(99L).isEmpty());
    }
}
