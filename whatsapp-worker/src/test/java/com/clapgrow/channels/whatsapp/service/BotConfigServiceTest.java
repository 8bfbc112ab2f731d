package com.clapgrow.channels.whatsapp.service;

import com.clapgrow.channels.common.retry.RetryPolicy;
import com.clapgrow.channels.whatsapp.concurrent.KeyedSequencer;
import com.clapgrow.channels.whatsapp.dto.BotConfigUpdateRequest;
import com.clapgrow.channels.whatsapp.entity.BotConfigEntity;
import com.clapgrow.channels.whatsapp.exception.ChannelNotFoundException;
import com.clapgrow.channels.whatsapp.repository.BotConfigRepository;
import com.clapgrow.channels.whatsapp.repository.ChannelRepository;
import com.clapgrow.channels.whatsapp.store.StoreFailureClassifier;
import com.clapgrow.channels.whatsapp.store.StoreRetryPolicyResolver;
import com.clapgrow.channels.whatsapp.store.StoreWriteRetrier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BotConfigServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private BotConfigRepository botConfigRepository;

    @Mock
    private ChannelRepository channelRepository;

    private BotConfigService service;

    @BeforeEach
    void setUp() {
        StoreWriteRetrier retrier = new StoreWriteRetrier(new StoreFailureClassifier(),
            new StoreRetryPolicyResolver(new RetryPolicy(true, 0, 0, 1.0, 2, 0.0)));
        service = new BotConfigService(botConfigRepository, channelRepository, retrier, new KeyedSequencer(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testGet_UnknownChannel_ThrowsNotFound() {
        // Arrange
        when(channelRepository.existsById("missing")).thenReturn(false);

        // Act & Assert
        assertThrows(ChannelNotFoundException.class, () -> service.get("missing"));
        verifyNoInteractions(botConfigRepository);
    }

    @Test
    void testGet_NoStoredConfig_CreatesDisabledDefault() {
        // Arrange
        when(channelRepository.existsById("sales-1")).thenReturn(true);
        when(botConfigRepository.findById("sales-1")).thenReturn(Optional.empty());
        when(botConfigRepository.save(any(BotConfigEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        BotConfigEntity config = service.get("sales-1");

        // Assert
        assertEquals("sales-1", config.getChannelId());
        assertFalse(config.isEnabled());
        assertEquals("", config.getProductDetails());
        assertEquals("", config.getSalesStrategy());
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), config.getUpdatedAt());
    }

    @Test
    void testGet_StoredConfig_ReturnedWithoutWrite() {
        // Arrange
        BotConfigEntity stored = new BotConfigEntity("sales-1");
        stored.setEnabled(true);
        when(channelRepository.existsById("sales-1")).thenReturn(true);
        when(botConfigRepository.findById("sales-1")).thenReturn(Optional.of(stored));

        // Act
        BotConfigEntity config = service.get("sales-1");

        // Assert
        assertSame(stored, config);
        verify(botConfigRepository, never()).save(any());
    }

    @Test
    void testUpdate_PartialRequest_KeepsUnsetFields() {
        // Arrange
        BotConfigEntity stored = new BotConfigEntity("sales-1");
        stored.setProductDetails("Running shoes, sizes 38-46");
        stored.setSalesStrategy("Offer free shipping");
        when(channelRepository.existsById("sales-1")).thenReturn(true);
        when(botConfigRepository.findById("sales-1")).thenReturn(Optional.of(stored));
        when(botConfigRepository.save(any(BotConfigEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        BotConfigUpdateRequest request = new BotConfigUpdateRequest();
        request.setEnabled(true);
        request.setSalesStrategy("Mention the weekend discount");
        request.setUpdatedByUid("user-7");
        request.setUpdatedByEmail("ops@example.com");

        // Act
        BotConfigEntity saved = service.update("sales-1", request);

        // Assert
        assertTrue(saved.isEnabled());
        assertEquals("Running shoes, sizes 38-46", saved.getProductDetails());
        assertEquals("Mention the weekend discount", saved.getSalesStrategy());
        assertEquals("user-7", saved.getUpdatedByUid());
        assertEquals("ops@example.com", saved.getUpdatedByEmail());
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), saved.getUpdatedAt());
    }

    @Test
    void testUpdate_TransientSaveFailure_IsRetried() {
        // Arrange
        BotConfigEntity stored = new BotConfigEntity("sales-1");
        when(channelRepository.existsById("sales-1")).thenReturn(true);
        when(botConfigRepository.findById("sales-1")).thenReturn(Optional.of(stored));
        when(botConfigRepository.save(stored))
            .thenThrow(new QueryTimeoutException("lock timeout"))
            .thenReturn(stored);

        BotConfigUpdateRequest request = new BotConfigUpdateRequest();
        request.setEnabled(false);

        // Act
        BotConfigEntity saved = service.update("sales-1", request);

        // Assert
        assertSame(stored, saved);
        verify(botConfigRepository, times(2)).save(stored);
    }

    @Test
    void testRecordFailure_LongError_TruncatedTo1000Chars() {
        // Arrange
        BotConfigEntity stored = new BotConfigEntity("sales-1");
        when(botConfigRepository.findById("sales-1")).thenReturn(Optional.of(stored));

        // Act
        service.recordFailure("sales-1", "x".repeat(1500));

        // Assert
        ArgumentCaptor<BotConfigEntity> captor = ArgumentCaptor.forClass(BotConfigEntity.class);
        verify(botConfigRepository).save(captor.capture());
        assertEquals(1000, captor.getValue().getLastError().length());
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), captor.getValue().getLastErrorAt());
    }

    @Test
    void testRecordAutoReply_ClearsLastError() {
        // Arrange
        BotConfigEntity stored = new BotConfigEntity("sales-1");
        stored.setLastError("Responder returned HTTP 500");
        stored.setLastErrorAt(LocalDateTime.of(2024, 4, 30, 9, 0));
        when(botConfigRepository.findById("sales-1")).thenReturn(Optional.of(stored));

        // Act
        service.recordAutoReply("sales-1");

        // Assert
        assertNull(stored.getLastError());
        assertNull(stored.getLastErrorAt());
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), stored.getLastAutoReplyAt());
        verify(botConfigRepository).save(stored);
    }

    @Test
    void testRecordAutoReply_NoConfig_DoesNothing() {
        // Arrange
        when(botConfigRepository.findById("sales-1")).thenReturn(Optional.empty());

        // Act
        service.recordAutoReply("sales-1");

        // Assert
        verify(botConfigRepository, never()).save(any());
    }
}
