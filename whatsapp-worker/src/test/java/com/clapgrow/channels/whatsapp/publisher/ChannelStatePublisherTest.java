package com.clapgrow.channels.whatsapp.publisher;

import com.clapgrow.channels.common.retry.RetryPolicy;
import com.clapgrow.channels.whatsapp.entity.ChannelEntity;
import com.clapgrow.channels.whatsapp.enums.ChannelStatus;
import com.clapgrow.channels.whatsapp.exception.StoreWriteException;
import com.clapgrow.channels.whatsapp.store.StoreFailureClassifier;
import com.clapgrow.channels.whatsapp.store.StoreRetryPolicyResolver;
import com.clapgrow.channels.whatsapp.store.StoreWriteRetrier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChannelStatePublisherTest {

    @Mock
    private ChannelStateWriter writer;

    private ChannelStatePublisher publisher;

    @BeforeEach
    void setUp() {
        StoreWriteRetrier retrier = new StoreWriteRetrier(new StoreFailureClassifier(),
            new StoreRetryPolicyResolver(new RetryPolicy(true, 0, 0, 1.0, 2, 0.0)));
        publisher = new ChannelStatePublisher(writer, retrier, Runnable::run);
    }

    @Test
    void testPublish_TransientFailure_IsRetried() {
        // Arrange
        ChannelEntity saved = new ChannelEntity("channel-1");
        ChannelUpdate update = ChannelUpdate.builder().status(ChannelStatus.CONNECTING).build();
        when(writer.apply("channel-1", update))
            .thenThrow(new QueryTimeoutException("lock timeout"))
            .thenReturn(saved);

        // Act
        ChannelEntity result = publisher.publish("channel-1", update).join();

        // Assert
        assertSame(saved, result);
        verify(writer, times(2)).apply("channel-1", update);
    }

    @Test
    void testPublish_RetriesExhausted_FailsFutureWithoutThrowing() {
        // Arrange
        when(writer.apply(eq("channel-1"), any())).thenThrow(new QueryTimeoutException("store down"));

        // Act
        CompletableFuture<ChannelEntity> result =
            publisher.publish("channel-1", ChannelUpdate.builder().status(ChannelStatus.ERROR).build());

        // Assert
        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(StoreWriteException.class, e.getCause());
        verify(writer, times(3)).apply(eq("channel-1"), any());
    }

    @Test
    void testPublish_SameChannel_WrittenInPublishOrder() {
        // Arrange
        ChannelUpdate first = ChannelUpdate.builder().status(ChannelStatus.CONNECTING).build();
        ChannelUpdate second = ChannelUpdate.builder().status(ChannelStatus.QR).build();
        when(writer.apply(eq("channel-1"), any())).thenReturn(new ChannelEntity("channel-1"));

        // Act
        publisher.publish("channel-1", first);
        publisher.publish("channel-1", second);

        // Assert
        InOrder order = inOrder(writer);
        order.verify(writer).apply("channel-1", first);
        order.verify(writer).apply("channel-1", second);
    }

    @Test
    void testReleaseStaleChannels_SkipsSupervised_DisconnectsTheRest() {
        // Arrange
        when(writer.liveChannelIds()).thenReturn(List.of("sales-1", "support-1"));
        when(writer.apply(eq("support-1"), any())).thenReturn(new ChannelEntity("support-1"));

        // Act
        List<String> released = publisher.releaseStaleChannels(Set.of("sales-1"));

        // Assert
        assertEquals(List.of("support-1"), released);
        ArgumentCaptor<ChannelUpdate> update = ArgumentCaptor.forClass(ChannelUpdate.class);
        verify(writer).apply(eq("support-1"), update.capture());
        verify(writer, never()).apply(eq("sales-1"), any());
        assertEquals(ChannelStatus.DISCONNECTED, update.getValue().get(ChannelUpdate.Field.STATUS));
        assertTrue(update.getValue().has(ChannelUpdate.Field.QR));
        assertNull(update.getValue().get(ChannelUpdate.Field.QR));
        assertEquals(Boolean.FALSE, update.getValue().get(ChannelUpdate.Field.LINKED));
    }
}
