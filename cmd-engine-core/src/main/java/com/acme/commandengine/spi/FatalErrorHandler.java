package com.acme.commandengine.spi;

/** Receives infrastructure failures the engine cannot recover from in-process. */
@FunctionalInterface
public interface FatalErrorHandler {

  void onFatalError(String message, Throwable cause);
}
