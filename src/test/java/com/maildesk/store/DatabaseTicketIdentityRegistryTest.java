package com.maildesk.store;

import com.maildesk.domain.TicketIdentity;
import com.maildesk.exception.IdentityConflictException;
import com.maildesk.exception.StorageException;
import com.maildesk.mapper.TicketIdentityMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * DatabaseTicketIdentityRegistry unit tests
 */
@ExtendWith(MockitoExtension.class)
class DatabaseTicketIdentityRegistryTest {

    private static final String KEY = "alice@example.com|help: login broken";

    @Mock
    private TicketIdentityMapper mapper;

    @InjectMocks
    private DatabaseTicketIdentityRegistry registry;

    @Test
    @DisplayName("Known key is answered from the loaded cache")
    void testCachedKey() {
        when(mapper.findAll()).thenReturn(List.of(TicketIdentity.builder()
                .conversationKey(KEY).ticketId("TKT-1").build()));
        registry.load();

        TicketResolution resolution = registry.resolveOrCreate(KEY);

        assertThat(resolution).isEqualTo(new TicketResolution("TKT-1", false));
        verify(mapper, never()).insertIfAbsent(any());
    }

    @Test
    @DisplayName("Key stored by another instance is picked up without inserting")
    void testStoredElsewhere() {
        when(mapper.findByKey(KEY)).thenReturn(TicketIdentity.builder()
                .conversationKey(KEY).ticketId("TKT-2").build());

        TicketResolution resolution = registry.resolveOrCreate(KEY);

        assertThat(resolution.ticketId()).isEqualTo("TKT-2");
        assertThat(resolution.created()).isFalse();
        verify(mapper, never()).insertIfAbsent(any());
    }

    @Test
    @DisplayName("New key is inserted and read back")
    void testCreate() {
        ArgumentCaptor<TicketIdentity> captor = ArgumentCaptor.forClass(TicketIdentity.class);
        when(mapper.insertIfAbsent(captor.capture())).thenReturn(1);
        when(mapper.findByKey(KEY)).thenReturn(null).thenAnswer(inv -> captor.getValue());

        TicketResolution resolution = registry.resolveOrCreate(KEY);

        assertThat(resolution.created()).isTrue();
        assertThat(resolution.ticketId()).isEqualTo(captor.getValue().getTicketId());
        assertThat(registry.find(KEY)).contains(resolution.ticketId());
    }

    @Test
    @DisplayName("Losing an insert race returns the winner's id")
    void testLostRace() {
        when(mapper.insertIfAbsent(any(TicketIdentity.class))).thenReturn(0);
        when(mapper.findByKey(KEY)).thenReturn(null).thenReturn(TicketIdentity.builder()
                .conversationKey(KEY).ticketId("TKT-WINNER").build());

        TicketResolution resolution = registry.resolveOrCreate(KEY);

        assertThat(resolution).isEqualTo(new TicketResolution("TKT-WINNER", false));
    }

    @Test
    @DisplayName("Missing row after insert is an identity conflict")
    void testConflict() {
        when(mapper.insertIfAbsent(any(TicketIdentity.class))).thenReturn(1);
        when(mapper.findByKey(KEY)).thenReturn(null);

        assertThatThrownBy(() -> registry.resolveOrCreate(KEY)).isInstanceOf(IdentityConflictException.class);
    }

    @Test
    @DisplayName("Database errors surface as storage errors")
    void testDatabaseError() {
        when(mapper.findByKey(KEY)).thenThrow(new RuntimeException("SQLITE_BUSY"));

        assertThatThrownBy(() -> registry.resolveOrCreate(KEY)).isInstanceOf(StorageException.class);
    }
}
