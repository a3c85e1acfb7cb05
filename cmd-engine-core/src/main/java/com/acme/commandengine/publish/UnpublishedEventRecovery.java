package com.acme.commandengine.publish;

import com.acme.commandengine.domain.Event;
import com.acme.commandengine.spi.EventStore;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes the gap between saving and publishing: events that were stored but never marked
 * published (the process died in between) are published again, one at a time, in position order.
 */
public class UnpublishedEventRecovery {
  private static final Logger LOG = LoggerFactory.getLogger(UnpublishedEventRecovery.class);

  private final EventStore store;
  private final EventPublisher publisher;

  public UnpublishedEventRecovery(EventStore store, EventPublisher publisher) {
    this.store = store;
    this.publisher = publisher;
  }

  /** @return the number of events republished */
  public int republishAll() {
    int count = 0;
    try (Stream<Event> unpublished = store.getUnpublishedEventStream()) {
      Iterator<Event> events = unpublished.iterator();
      while (events.hasNext()) {
        Event event = events.next();
        publisher.publishEvents(event.aggregate().id(), List.of(event));
        count++;
      }
    }
    if (count > 0) {
      LOG.info("Republished {} unpublished event(s)", count);
    }
    return count;
  }
}
