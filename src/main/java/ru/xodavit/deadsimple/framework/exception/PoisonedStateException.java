package ru.xodavit.deadsimple.framework.exception;

/**
 * Thrown on every acquisition of a shared state whose earlier holder failed while holding the
 * lock. The value may be half-mutated and is never handed out again.
 */
public class PoisonedStateException extends RuntimeException {
  public PoisonedStateException(String message, Throwable cause) {
    super(message, cause);
  }
}
