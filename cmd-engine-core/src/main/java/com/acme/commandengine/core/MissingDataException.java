package com.acme.commandengine.core;

public class MissingDataException extends IllegalArgumentException {
  public MissingDataException(String message) {
    super(message);
  }
}
