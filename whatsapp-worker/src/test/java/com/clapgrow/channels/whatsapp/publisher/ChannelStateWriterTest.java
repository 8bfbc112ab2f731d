package com.clapgrow.channels.whatsapp.publisher;

import com.clapgrow.channels.whatsapp.entity.ChannelEntity;
import com.clapgrow.channels.whatsapp.enums.ChannelStatus;
import com.clapgrow.channels.whatsapp.repository.ChannelRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChannelStateWriterTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 10, 0);

    @Mock
    private ChannelRepository channelRepository;

    private ChannelStateWriter writer;

    @BeforeEach
    void setUp() {
        writer = new ChannelStateWriter(channelRepository, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        when(channelRepository.save(any(ChannelEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void testApply_UnknownChannel_SeedsDefaults() {
        // Arrange
        when(channelRepository.findById("channel-1")).thenReturn(Optional.empty());

        // Act
        ChannelEntity channel = writer.apply("channel-1", ChannelUpdate.builder().status(ChannelStatus.CONNECTING).build());

        // Assert
        assertEquals("channel-1", channel.getId());
        assertEquals(ChannelStatus.CONNECTING, channel.getStatus());
        assertFalse(channel.isLinked());
        assertNull(channel.getQr());
        assertEquals(NOW, channel.getCreatedAt());
        assertEquals(NOW, channel.getUpdatedAt());
    }

    @Test
    void testApply_StatusOnly_KeepsOtherFields() {
        // Arrange
        ChannelEntity existing = ChannelStateWriter.seed("channel-1", NOW.minusDays(1));
        existing.setDisplayName("Sales");
        existing.setQr("2@payload");
        existing.setUpdatedAt(NOW.minusDays(1));
        when(channelRepository.findById("channel-1")).thenReturn(Optional.of(existing));

        // Act
        ChannelEntity channel = writer.apply("channel-1", ChannelUpdate.builder().status(ChannelStatus.QR).build());

        // Assert
        assertEquals("Sales", channel.getDisplayName());
        assertEquals("2@payload", channel.getQr());
        assertEquals(ChannelStatus.QR, channel.getStatus());
    }

    @Test
    void testApply_ErrorSetAndCleared() {
        // Arrange
        ChannelEntity existing = ChannelStateWriter.seed("channel-1", NOW);
        when(channelRepository.findById("channel-1")).thenReturn(Optional.of(existing));

        // Act
        writer.apply("channel-1", ChannelUpdate.builder().lastError(ChannelError.of("LOGGED_OUT", "gone")).build());

        // Assert
        assertEquals("LOGGED_OUT", existing.getLastErrorCode());
        assertEquals(NOW, existing.getLastErrorAt());

        // Act
        writer.apply("channel-1", ChannelUpdate.builder().clearLastError().build());

        // Assert
        assertNull(existing.getLastErrorCode());
        assertNull(existing.getLastErrorMessage());
        assertNull(existing.getLastErrorAt());
    }

    @Test
    void testApply_ClockNotMoving_UpdatedAtStillIncreases() {
        // Arrange
        ChannelEntity existing = ChannelStateWriter.seed("channel-1", NOW);
        existing.setUpdatedAt(NOW);
        when(channelRepository.findById("channel-1")).thenReturn(Optional.of(existing));

        // Act
        writer.apply("channel-1", ChannelUpdate.builder().status(ChannelStatus.CONNECTING).build());
        LocalDateTime first = existing.getUpdatedAt();
        writer.apply("channel-1", ChannelUpdate.builder().status(ChannelStatus.QR).build());

        // Assert
        assertEquals(NOW.plus(1, ChronoUnit.MILLIS), first);
        assertTrue(existing.getUpdatedAt().isAfter(first));
    }
}
