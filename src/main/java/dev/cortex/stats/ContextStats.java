package dev.cortex.stats;

import dev.cortex.item.ContentType;
import java.time.Instant;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Snapshot of store statistics.
 *
 * @param totalItems all items, including soft-deleted ones
 * @param activeItems items not soft-deleted
 * @param contentTypes active item count per content type
 * @param itemsWithVector active items that carry an embedding
 * @param projectsCount active projects
 * @param embeddingDimension vector length produced by the embedding generator
 * @param lastUpdated most recent item mutation, absent for an empty store
 */
public record ContextStats(
    long totalItems,
    long activeItems,
    Map<ContentType, Long> contentTypes,
    long itemsWithVector,
    long projectsCount,
    int embeddingDimension,
    @Nullable Instant lastUpdated) {

  public ContextStats {
    contentTypes = Map.copyOf(contentTypes);
  }
}
