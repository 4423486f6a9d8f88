package ru.xodavit.deadsimple.framework.exception;

public class RequestHandleException extends RuntimeException {
  public RequestHandleException(String message, Throwable cause) {
    super(message, cause);
  }
}
