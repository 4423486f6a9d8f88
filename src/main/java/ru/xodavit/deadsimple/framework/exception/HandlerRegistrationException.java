package ru.xodavit.deadsimple.framework.exception;

public class HandlerRegistrationException extends RuntimeException {
  public HandlerRegistrationException(String message) {
    super(message);
  }

  public HandlerRegistrationException(String message, Throwable cause) {
    super(message, cause);
  }

  public HandlerRegistrationException(Throwable cause) {
    super(cause);
  }
}
