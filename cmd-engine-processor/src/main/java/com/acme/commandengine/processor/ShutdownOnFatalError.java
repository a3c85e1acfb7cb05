package com.acme.commandengine.processor;

import com.acme.commandengine.spi.FatalErrorHandler;
import io.micronaut.context.ApplicationContext;
import jakarta.inject.Singleton;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops the application context on the first fatal error. The stop runs on its own thread so a
 * command worker reporting the error is not asked to shut down its own executor.
 */
@Singleton
public class ShutdownOnFatalError implements FatalErrorHandler {
  private static final Logger LOG = LoggerFactory.getLogger(ShutdownOnFatalError.class);

  private final ApplicationContext applicationContext;
  private final AtomicBoolean stopping = new AtomicBoolean();

  public ShutdownOnFatalError(ApplicationContext applicationContext) {
    this.applicationContext = applicationContext;
  }

  @Override
  public void onFatalError(String message, Throwable cause) {
    LOG.error("Fatal error, stopping: {}", message, cause);
    if (!stopping.compareAndSet(false, true)) {
      return;
    }
    Thread stopper = new Thread(this::stop, "fatal-error-shutdown");
    stopper.setDaemon(false);
    stopper.start();
  }

  private void stop() {
    if (applicationContext.isRunning()) {
      applicationContext.stop();
    }
  }
}
