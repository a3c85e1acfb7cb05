package com.acme.commandengine.publish;

import com.acme.commandengine.core.EventPublishingException;
import com.acme.commandengine.domain.Event;
import com.acme.commandengine.spi.EventBus;
import com.acme.commandengine.spi.EventStore;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes committed events to the event bus and the flow bus, then marks them published in the
 * store. The first failing write aborts the batch; events left unmarked are picked up again by
 * {@link UnpublishedEventRecovery}.
 */
public class EventPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(EventPublisher.class);

  private final EventBus eventBus;
  private final EventBus flowBus;
  private final EventStore store;

  public EventPublisher(EventBus eventBus, EventBus flowBus, EventStore store) {
    this.eventBus = eventBus;
    this.flowBus = flowBus;
    this.store = store;
  }

  /**
   * @param events committed events of one aggregate, ordered by revision
   * @throws EventPublishingException naming the event whose write failed
   */
  public void publishEvents(UUID aggregateId, List<Event> events) {
    if (events.isEmpty()) {
      return;
    }
    for (Event event : events) {
      write(eventBus, "eventbus", event);
      write(flowBus, "flowbus", event);
    }
    long fromRevision = events.get(0).revision();
    long toRevision = events.get(events.size() - 1).revision();
    try {
      store.markEventsAsPublished(aggregateId, fromRevision, toRevision);
    } catch (RuntimeException e) {
      Event last = events.get(events.size() - 1);
      throw new EventPublishingException(
          String.format(
              "Failed to mark revisions %d..%d of %s published",
              fromRevision, toRevision, aggregateId),
          last.id(),
          e);
    }
    LOG.debug("Published revisions {}..{} of {}", fromRevision, toRevision, aggregateId);
  }

  /** Writes a rejection or failure event to both buses. It is never stored or marked. */
  public void publishOutcome(Event outcome) {
    write(eventBus, "eventbus", outcome);
    write(flowBus, "flowbus", outcome);
  }

  private static void write(EventBus bus, String busName, Event event) {
    try {
      bus.write(event);
    } catch (RuntimeException e) {
      throw new EventPublishingException(event.id(), busName, e);
    }
  }
}
