package dev.cortex.item;

import java.util.Optional;

/**
 * Persistence port for context items.
 *
 * <p>Implementations must write an item's content and vector atomically, and must make {@link
 * #upsert} a compare-and-swap on {@link ContextItem#version()}. Failures of the underlying store
 * surface as {@link StoreUnavailableException}.
 */
public interface ItemStore {

  Optional<ContextItem> get(long id);

  /**
   * Lazily scans items matching {@code criteria}. Each call to {@link Iterable#iterator()} starts a
   * fresh, finite scan. Implementations may push the criteria down or return a superset; callers
   * re-check every item.
   */
  Iterable<ContextItem> scan(ItemCriteria criteria);

  /**
   * Inserts or replaces an item.
   *
   * <p>An item with version {@code 0} must not exist yet; an existing item is replaced only when
   * its stored version equals {@code item.version()}. The stored copy carries {@code version + 1}
   * and is returned.
   *
   * @throws StaleItemException if the version check fails
   */
  ContextItem upsert(ContextItem item);

  /** Allocates a fresh, never reused item id. */
  long nextId();

  /**
   * Removes an item permanently.
   *
   * @return {@code true} if a row was removed
   */
  boolean delete(long id);
}
