package com.phillippitts.voicebridge.config.queue;

import com.phillippitts.voicebridge.config.properties.QueueProperties;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the queue topics so the broker creates them on startup.
 *
 * <p>Only active with {@code voicebridge.queue.enabled=true}; without topic beans the Kafka admin
 * never contacts the broker.
 */
@Configuration
@ConditionalOnProperty(prefix = "voicebridge.queue", name = "enabled", havingValue = "true")
public class KafkaQueueConfig {

    @Bean
    public NewTopic segmentsTopic(QueueProperties props) {
        return TopicBuilder.name(props.getSegmentsTopic())
                .partitions(props.getPartitions())
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic resultsTopic(QueueProperties props) {
        return TopicBuilder.name(props.getResultsTopic())
                .partitions(props.getPartitions())
                .replicas(1)
                .build();
    }
}
