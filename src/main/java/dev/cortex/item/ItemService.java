package dev.cortex.item;

import dev.cortex.embedding.EmbeddingGenerator;
import dev.cortex.embedding.EmbeddingUnavailableException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Service;

/**
 * Mutation pipeline for context items: validation, embedding, and versioned writes.
 *
 * <p>Embedding always happens before the write and never while a store lock is held. Writes are a
 * compare-and-swap on the item version; on a conflict the whole read-patch-embed-write cycle is
 * retried through a {@link RetryTemplate}. A content change recomputes the vector in the same
 * write; if embedding fails the item is stored without a vector rather than with the vector of
 * the previous content.
 */
@Service
public class ItemService {

  private static final Logger log = LoggerFactory.getLogger(ItemService.class);

  /** Listing order: newest first, id as tie-break. */
  public static final Comparator<ContextItem> NEWEST_FIRST =
      Comparator.comparing(ContextItem::createdAt)
          .thenComparingLong(ContextItem::id)
          .reversed();

  private final ItemStore store;
  private final EmbeddingGenerator embeddingGenerator;
  private final Validator validator;
  private final Clock clock;
  private final RetryTemplate retryTemplate;
  private final int maxListLimit;

  public ItemService(
      ItemStore store,
      EmbeddingGenerator embeddingGenerator,
      Validator validator,
      Clock clock,
      MutationProperties properties,
      ListingProperties listing) {
    this.store = store;
    this.embeddingGenerator = embeddingGenerator;
    this.validator = validator;
    this.clock = clock;
    this.maxListLimit = listing.maxLimit();
    RetryTemplateBuilder builder =
        RetryTemplate.builder()
            .maxAttempts(properties.maxAttempts())
            .retryOn(StaleItemException.class);
    if (properties.backoffMs() > 0) {
      builder.fixedBackoff(properties.backoffMs());
    } else {
      builder.noBackoff();
    }
    this.retryTemplate = builder.build();
  }

  /**
   * Creates an item, embedding its content first. Embedding failure is not fatal: the item is
   * stored without a vector and a warning is logged.
   *
   * @throws IllegalArgumentException if the draft fails validation
   */
  public ContextItem create(ContextItemDraft draft) {
    validate(draft);
    long id = store.nextId();
    float[] vector = embedOrNull(draft.content(), id);
    Instant now = Instant.now(clock);
    ContextItem item =
        new ContextItem(
            id,
            draft.title(),
            draft.content(),
            draft.contentTypeOrDefault(),
            draft.tags(),
            draft.extraMetadata(),
            draft.source(),
            draft.projectId(),
            true,
            now,
            now,
            vector,
            0);
    ContextItem stored = store.upsert(item);
    log.debug("Created context item {} (vector: {})", id, stored.hasVector());
    return stored;
  }

  /**
   * Applies a partial update. The vector is recomputed iff the content changes; a metadata-only
   * patch keeps the stored vector as is.
   *
   * @throws NotFoundException if no item has this id
   * @throws StaleItemException if the item kept changing concurrently for every attempt
   */
  public ContextItem update(long id, ContextItemPatch patch) {
    validate(patch);
    return retryTemplate.execute(
        context -> {
          if (context.getRetryCount() > 0) {
            log.debug("Retrying update of item {} (attempt {})", id, context.getRetryCount() + 1);
          }
          ContextItem current = store.get(id).orElseThrow(() -> NotFoundException.item(id));
          ContextItem patched = patch.applyTo(current, Instant.now(clock));
          if (patch.changesContent(current)) {
            patched = patched.withVector(embedOrNull(patched.content(), id));
          }
          return store.upsert(patched);
        });
  }

  /**
   * Marks an item inactive. No embedding work is done; deleting an already inactive item returns
   * it unchanged.
   *
   * @throws NotFoundException if no item has this id
   */
  public ContextItem softDelete(long id) {
    return retryTemplate.execute(
        context -> {
          ContextItem current = store.get(id).orElseThrow(() -> NotFoundException.item(id));
          if (!current.active()) {
            return current;
          }
          return store.upsert(current.withActive(false, Instant.now(clock)));
        });
  }

  /**
   * Removes an item permanently.
   *
   * @throws NotFoundException if no item has this id
   */
  public void hardDelete(long id) {
    if (!store.delete(id)) {
      throw NotFoundException.item(id);
    }
    log.info("Hard-deleted context item {}", id);
  }

  /**
   * Looks up an item. Soft-deleted items are reported as missing unless {@code includeInactive}.
   *
   * @throws NotFoundException if the item does not exist or is inactive
   */
  public ContextItem get(long id, boolean includeInactive) {
    return store
        .get(id)
        .filter(item -> includeInactive || item.active())
        .orElseThrow(() -> NotFoundException.item(id));
  }

  public ContextItem get(long id) {
    return get(id, false);
  }

  /**
   * Filter-only listing, newest first. Only the newest {@code offset + limit} matches are held in
   * memory while the store is scanned.
   *
   * @param criteria item filter
   * @param limit page size, between 0 and {@code cortex.listing.max-limit}
   * @param offset entries to skip, {@code >= 0}
   */
  public List<ContextItem> list(ItemCriteria criteria, int limit, int offset) {
    if (limit < 0 || offset < 0) {
      throw new IllegalArgumentException(
          "limit and offset must be >= 0, got limit=%d offset=%d".formatted(limit, offset));
    }
    if (limit > maxListLimit) {
      throw new IllegalArgumentException(
          "limit must be <= %d, got: %d".formatted(maxListLimit, limit));
    }
    int keep = (int) Math.min(Integer.MAX_VALUE, (long) offset + limit);
    if (keep == 0) {
      return List.of();
    }
    // Oldest retained entry at the head.
    PriorityQueue<ContextItem> newest = new PriorityQueue<>(NEWEST_FIRST.reversed());
    for (ContextItem item : store.scan(criteria)) {
      if (!criteria.matches(item)) {
        continue;
      }
      if (newest.size() < keep) {
        newest.add(item);
      } else if (NEWEST_FIRST.compare(item, newest.peek()) < 0) {
        newest.poll();
        newest.add(item);
      }
    }
    List<ContextItem> ordered = new ArrayList<>(newest);
    ordered.sort(NEWEST_FIRST);
    if (offset >= ordered.size()) {
      return List.of();
    }
    return List.copyOf(ordered.subList(offset, ordered.size()));
  }

  /**
   * Recomputes the vector of one item from its current content.
   *
   * @throws NotFoundException if no item has this id
   * @throws EmbeddingUnavailableException if the model cannot produce a vector
   */
  public ContextItem reembed(long id) {
    return retryTemplate.execute(
        context -> {
          ContextItem current = store.get(id).orElseThrow(() -> NotFoundException.item(id));
          float[] vector = embeddingGenerator.embed(current.content());
          return store.upsert(current.withVector(vector));
        });
  }

  /**
   * Gives a vector to every item that lacks one. Items whose embedding still fails are skipped.
   *
   * @return number of items that gained a vector
   */
  public int reembedMissing() {
    List<Long> missing = new ArrayList<>();
    for (ContextItem item : store.scan(ItemCriteria.everything())) {
      if (!item.hasVector()) {
        missing.add(item.id());
      }
    }
    int repaired = 0;
    for (long id : missing) {
      try {
        if (reembed(id).hasVector()) {
          repaired++;
        }
      } catch (EmbeddingUnavailableException e) {
        log.warn("Item {} still has no vector: {}", id, e.getMessage());
      } catch (NotFoundException e) {
        log.debug("Item {} disappeared before it could be re-embedded", id);
      }
    }
    log.info("Re-embedded {} of {} items without a vector", repaired, missing.size());
    return repaired;
  }

  private float @Nullable [] embedOrNull(String content, long id) {
    try {
      return embeddingGenerator.embed(content);
    } catch (EmbeddingUnavailableException e) {
      log.warn("Storing item {} without a vector: {}", id, e.getMessage());
      return null;
    }
  }

  private <T> void validate(T input) {
    Set<ConstraintViolation<T>> violations = validator.validate(input);
    if (!violations.isEmpty()) {
      String messages =
          violations.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .sorted()
              .collect(Collectors.joining(", "));
      throw new IllegalArgumentException("Validation failed: " + messages);
    }
  }
}
