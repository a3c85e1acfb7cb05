package com.acme.commandengine.core;

/** Infrastructure failure that will not go away by trying again. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
