package com.clapgrow.channels.common.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Base Kafka client properties shared by the channel workers.
 *
 * <p>Consumers commit manually and read from the earliest offset so that an event
 * is never skipped; producers are idempotent with a single in-flight request so that
 * events for one key keep their order.
 */
public final class KafkaConfigHelper {

    private KafkaConfigHelper() {
    }

    public static Map<String, Object> createBaseConsumerProperties(String bootstrapServers, String groupId) {
        Map<String, Object> configProps = new HashMap<>();

        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);

        // A reply can wait on the responder for tens of seconds; keep batches small
        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 5);
        configProps.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        configProps.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000);
        configProps.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 300000);
        configProps.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);

        configProps.put(
            ConsumerConfig.PARTITION_ASSIGNMENT_STRATEGY_CONFIG,
            "org.apache.kafka.clients.consumer.CooperativeStickyAssignor"
        );
        return configProps;
    }

    public static Map<String, Object> createBaseProducerProperties(String bootstrapServers) {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.ACKS_CONFIG, "all");
        configProps.put(ProducerConfig.RETRIES_CONFIG, 3);
        configProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
        configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        configProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000);
        configProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);
        return configProps;
    }

    /**
     * Prefixes a consumer group id with the environment name, e.g.
     * {@code buildGroupId("whatsapp-autoreply", "prod")} gives {@code "prod-whatsapp-autoreply"}.
     * A null or blank prefix returns the base id unchanged.
     */
    public static String buildGroupId(String baseGroupId, String environmentPrefix) {
        if (environmentPrefix != null && !environmentPrefix.trim().isEmpty()) {
            return environmentPrefix.trim() + "-" + baseGroupId;
        }
        return baseGroupId;
    }
}
