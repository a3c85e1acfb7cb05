package com.acme.commandengine.kafka;

import com.acme.commandengine.config.MessagingConfig;
import com.acme.commandengine.core.Jsons;
import com.acme.commandengine.core.TransientException;
import com.acme.commandengine.domain.Event;
import com.acme.commandengine.spi.EventBus;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes events as JSON to a Kafka topic, keyed by aggregate id so one aggregate's events keep
 * their order within a partition. The send is awaited: {@link #write} only returns after the
 * broker acknowledged the record.
 */
public class KafkaEventBus implements EventBus {
  private static final Logger LOG = LoggerFactory.getLogger(KafkaEventBus.class);

  static final String HEADER_EVENT_NAME = "eventName";
  static final String HEADER_CONTEXT_NAME = "contextName";
  static final String HEADER_AGGREGATE_NAME = "aggregateName";

  private final Producer<String, String> producer;
  private final String baseTopic;
  private final MessagingConfig.TopicNaming topicNaming;

  public KafkaEventBus(
      Producer<String, String> producer, String baseTopic, MessagingConfig messagingConfig) {
    this.producer = producer;
    this.baseTopic = baseTopic;
    this.topicNaming = messagingConfig.getTopicNaming();
  }

  @Override
  public void write(Event event) {
    String topic = topicNaming.buildTopic(baseTopic, event.contextName());
    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, event.aggregate().id().toString(), Jsons.toJson(event));
    addHeader(record, HEADER_EVENT_NAME, event.name());
    addHeader(record, HEADER_CONTEXT_NAME, event.contextName());
    addHeader(record, HEADER_AGGREGATE_NAME, event.aggregate().name());

    try {
      RecordMetadata metadata = producer.send(record).get();
      LOG.debug(
          "Wrote {} ({}) to {}-{}@{}",
          event.name(),
          event.id(),
          metadata.topic(),
          metadata.partition(),
          metadata.offset());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientException("Interrupted while publishing to Kafka topic " + topic, e);
    } catch (ExecutionException e) {
      LOG.error("Failed to publish event {} to Kafka topic {}", event.id(), topic, e.getCause());
      throw new TransientException("Failed to publish to Kafka topic " + topic, e.getCause());
    }
  }

  String baseTopic() {
    return baseTopic;
  }

  private static void addHeader(ProducerRecord<String, String> record, String key, String value) {
    record.headers().add(key, value.getBytes(StandardCharsets.UTF_8));
  }
}
