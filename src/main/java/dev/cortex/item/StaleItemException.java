package dev.cortex.item;

/**
 * Raised by {@link ItemStore#upsert} when the stored version of an item no longer matches the
 * version the caller read. The mutation pipeline retries the whole read-modify-write cycle.
 */
public class StaleItemException extends RuntimeException {

  private final long itemId;

  public StaleItemException(long itemId, long expectedVersion) {
    super("Context item %d changed concurrently (expected version %d)"
        .formatted(itemId, expectedVersion));
    this.itemId = itemId;
  }

  public long getItemId() {
    return itemId;
  }
}
