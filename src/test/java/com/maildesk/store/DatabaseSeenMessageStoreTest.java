package com.maildesk.store;

import com.maildesk.domain.SeenMessage;
import com.maildesk.exception.StorageException;
import com.maildesk.mapper.SeenMessageMapper;
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
 * DatabaseSeenMessageStore unit tests
 */
@ExtendWith(MockitoExtension.class)
class DatabaseSeenMessageStoreTest {

    @Mock
    private SeenMessageMapper mapper;

    @InjectMocks
    private DatabaseSeenMessageStore store;

    @Test
    @DisplayName("Load reads every stored uid")
    void testLoad() {
        when(mapper.findAllUids()).thenReturn(List.of("u-1", "u-2"));

        store.load();

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.has("u-2")).isTrue();
    }

    @Test
    @DisplayName("markSeen inserts once")
    void testMarkSeen() {
        when(mapper.insertIfAbsent(any(SeenMessage.class))).thenReturn(1);

        store.markSeen("u-9");
        store.markSeen("u-9");

        ArgumentCaptor<SeenMessage> captor = ArgumentCaptor.forClass(SeenMessage.class);
        verify(mapper, times(1)).insertIfAbsent(captor.capture());
        assertThat(captor.getValue().getMessageUid()).isEqualTo("u-9");
        assertThat(captor.getValue().getSeenAt()).isNotBlank();
        assertThat(store.has("u-9")).isTrue();
    }

    @Test
    @DisplayName("Failed insert leaves the uid unseen")
    void testMarkSeenFailure() {
        when(mapper.insertIfAbsent(any(SeenMessage.class))).thenThrow(new RuntimeException("database is locked"));

        assertThatThrownBy(() -> store.markSeen("u-9")).isInstanceOf(StorageException.class);
        assertThat(store.has("u-9")).isFalse();
    }

    @Test
    @DisplayName("Reset truncates table and cache")
    void testReset() {
        when(mapper.findAllUids()).thenReturn(List.of("u-1"));
        store.load();

        store.reset();

        verify(mapper).deleteAll();
        assertThat(store.size()).isZero();
    }
}
