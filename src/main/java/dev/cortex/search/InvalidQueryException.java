package dev.cortex.search;

/** Search parameters out of range (limit, offset, weight, mode). */
public class InvalidQueryException extends IllegalArgumentException {

  public InvalidQueryException(String message) {
    super(message);
  }
}
