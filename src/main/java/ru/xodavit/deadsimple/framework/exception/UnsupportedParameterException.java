package ru.xodavit.deadsimple.framework.exception;

public class UnsupportedParameterException extends RuntimeException {
  public UnsupportedParameterException(String message) {
    super(message);
  }

  public UnsupportedParameterException(String message, Throwable cause) {
    super(message, cause);
  }

  public UnsupportedParameterException(Throwable cause) {
    super(cause);
  }
}
