package com.acme.commandengine.spi;

import com.acme.commandengine.domain.Event;

/** An outgoing at-least-once channel. {@link #write} returns once the channel accepted the event. */
public interface EventBus {

  void write(Event event);
}
