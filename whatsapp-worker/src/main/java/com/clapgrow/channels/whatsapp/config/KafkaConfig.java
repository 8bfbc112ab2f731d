package com.clapgrow.channels.whatsapp.config;

import com.clapgrow.channels.common.kafka.KafkaConfigHelper;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.SaslConfigs;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;

import java.util.Map;

/**
 * Inbound messages are keyed by channel id so that one channel's messages are handled in order.
 */
@Configuration
@EnableKafka
public class KafkaConfig {

    private static final String SECURITY_PROTOCOL = "security.protocol";

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${kafka.consumer.group-id:whatsapp-autoreply}")
    private String baseGroupId;

    @Value("${kafka.consumer.environment-prefix:}")
    private String environmentPrefix;

    @Value("${kafka.consumer.concurrency:3}")
    private int concurrency;

    @Value("${kafka.topic.partitions:6}")
    private int partitions;

    @Value("${spring.kafka.msk-iam-enabled:false}")
    private boolean mskIamEnabled;

    @Bean
    public NewTopic inboundMessagesTopic(AutoReplyProperties properties) {
        return TopicBuilder.name(properties.getTopic())
            .partitions(partitions)
            .replicas(1)
            .build();
    }

    @Bean
    public ProducerFactory<String, String> producerFactory() {
        Map<String, Object> configProps = KafkaConfigHelper.createBaseProducerProperties(bootstrapServers);
        applySecurity(configProps);
        return new DefaultKafkaProducerFactory<>(configProps);
    }

    @Bean
    public KafkaTemplate<String, String> kafkaTemplate() {
        return new KafkaTemplate<>(producerFactory());
    }

    @Bean
    public ConsumerFactory<String, String> consumerFactory() {
        String groupId = KafkaConfigHelper.buildGroupId(baseGroupId, environmentPrefix);
        Map<String, Object> configProps = KafkaConfigHelper.createBaseConsumerProperties(
            bootstrapServers, groupId);
        applySecurity(configProps);
        return new DefaultKafkaConsumerFactory<>(configProps);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
            new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory());
        factory.setConcurrency(concurrency);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        return factory;
    }

    private void applySecurity(Map<String, Object> configProps) {
        if (mskIamEnabled) {
            configProps.put(SECURITY_PROTOCOL, "SASL_SSL");
            configProps.put(SaslConfigs.SASL_MECHANISM, "AWS_MSK_IAM");
            configProps.put(SaslConfigs.SASL_JAAS_CONFIG,
                "software.amazon.msk.auth.iam.IAMLoginModule required;");
            configProps.put(SaslConfigs.SASL_CLIENT_CALLBACK_HANDLER_CLASS,
                "software.amazon.msk.auth.iam.IAMClientCallbackHandler");
        }
    }
}
