package com.acme.commandengine.kafka;

import com.acme.commandengine.config.MessagingConfig;
import com.acme.commandengine.spi.EventBus;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Creates the shared Kafka producer and the two buses on top of it. The producer is idempotent
 * and waits for all in-sync replicas, so an acknowledged write is durable.
 */
@Factory
public class KafkaEventBusFactory {

  private final String bootstrapServers;

  public KafkaEventBusFactory(
      @Value("${kafka.bootstrap.servers:localhost:9092}") String bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  @Singleton
  @Bean(preDestroy = "close")
  public Producer<String, String> kafkaProducer() {
    return new KafkaProducer<>(producerProperties());
  }

  @Singleton
  @Named("eventBus")
  public EventBus eventBus(Producer<String, String> producer, MessagingConfig messagingConfig) {
    return new KafkaEventBus(
        producer, messagingConfig.getTopicNaming().getEventTopic(), messagingConfig);
  }

  @Singleton
  @Named("flowBus")
  public EventBus flowBus(Producer<String, String> producer, MessagingConfig messagingConfig) {
    return new KafkaEventBus(
        producer, messagingConfig.getTopicNaming().getFlowTopic(), messagingConfig);
  }

  Properties producerProperties() {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
    props.put(ProducerConfig.LINGER_MS_CONFIG, 0);
    return props;
  }
}
