package com.acme.commandengine.core;

/**
 * Infrastructure failure that may succeed when the whole command is run again. The pipeline does
 * not classify these; the caller decides whether to retry.
 */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
