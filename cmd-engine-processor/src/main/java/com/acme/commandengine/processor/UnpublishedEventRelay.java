package com.acme.commandengine.processor;

import com.acme.commandengine.config.EngineConfig;
import com.acme.commandengine.publish.UnpublishedEventRecovery;
import com.acme.commandengine.spi.FatalErrorHandler;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Republishes events that were stored but never marked published, once, while the application
 * starts and before commands are accepted.
 */
@Singleton
public class UnpublishedEventRelay implements ApplicationEventListener<StartupEvent> {
  private static final Logger LOG = LoggerFactory.getLogger(UnpublishedEventRelay.class);

  private final UnpublishedEventRecovery recovery;
  private final EngineConfig config;
  private final FatalErrorHandler fatalErrorHandler;

  public UnpublishedEventRelay(
      UnpublishedEventRecovery recovery, EngineConfig config, FatalErrorHandler fatalErrorHandler) {
    this.recovery = recovery;
    this.config = config;
    this.fatalErrorHandler = fatalErrorHandler;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    if (!config.isRecoverUnpublishedOnStartup()) {
      LOG.info("Recovery of unpublished events is disabled");
      return;
    }
    try {
      int count = recovery.republishAll();
      LOG.info("Startup recovery republished {} event(s)", count);
    } catch (RuntimeException e) {
      fatalErrorHandler.onFatalError("Failed to republish unpublished events", e);
    }
  }
}
