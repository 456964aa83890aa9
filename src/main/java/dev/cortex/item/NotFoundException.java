package dev.cortex.item;

/** Raised when an item or project id does not exist. */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }

  public static NotFoundException item(long id) {
    return new NotFoundException("Context item " + id + " not found");
  }
}
