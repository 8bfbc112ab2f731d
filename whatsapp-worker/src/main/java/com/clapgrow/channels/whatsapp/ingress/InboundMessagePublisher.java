package com.clapgrow.channels.whatsapp.ingress;

import com.clapgrow.channels.whatsapp.config.AutoReplyProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Hands stored inbound messages to the auto-reply pipeline, keyed by channel id.
 *
 * <p>A failed publish is logged and the message is not answered automatically; it stays stored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundMessagePublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final AutoReplyProperties properties;

    public void publish(InboundMessageEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize inbound message: channelId={}, messageId={}",
                event.channelId(), event.messageId(), e);
            return;
        }
        kafkaTemplate.send(properties.getTopic(), event.channelId(), payload)
            .whenComplete((result, error) -> {
                if (error != null) {
                    log.error("Failed to publish inbound message: channelId={}, messageId={}, error={}",
                        event.channelId(), event.messageId(), error.getMessage());
                } else {
                    log.debug("Inbound message published: channelId={}, messageId={}, partition={}",
                        event.channelId(), event.messageId(), result.getRecordMetadata().partition());
                }
            });
    }
}
