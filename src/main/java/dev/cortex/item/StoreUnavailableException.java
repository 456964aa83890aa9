package dev.cortex.item;

/** Underlying item store failed (I/O, connection, constraint). Propagated, not retried. */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
