package com.acme.commandengine.core;

/** Malformed payload handed to {@code authorize}. */
public class InvalidAuthorizationException extends IllegalArgumentException {
  public InvalidAuthorizationException(String message) {
    super(message);
  }
}
