package dev.cortex.stats;

import dev.cortex.embedding.EmbeddingGenerator;
import dev.cortex.item.ContentType;
import dev.cortex.item.ContextItem;
import dev.cortex.item.ItemCriteria;
import dev.cortex.item.ItemStore;
import dev.cortex.project.ProjectService;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;

/** Computes {@link ContextStats} with one pass over the item store. */
@Service
public class ContextStatsService {

  private final ItemStore itemStore;
  private final ProjectService projectService;
  private final EmbeddingGenerator embeddingGenerator;

  public ContextStatsService(
      ItemStore itemStore, ProjectService projectService, EmbeddingGenerator embeddingGenerator) {
    this.itemStore = itemStore;
    this.projectService = projectService;
    this.embeddingGenerator = embeddingGenerator;
  }

  /**
   * Returns statistics, optionally restricted to one project's items. The project count is always
   * global.
   */
  public ContextStats stats(@Nullable String projectId) {
    ItemCriteria criteria = new ItemCriteria(projectId, null, null, true);
    long total = 0;
    long active = 0;
    long withVector = 0;
    Map<ContentType, Long> perType = new EnumMap<>(ContentType.class);
    Instant lastUpdated = null;

    for (ContextItem item : itemStore.scan(criteria)) {
      if (!criteria.matches(item)) {
        continue;
      }
      total++;
      if (lastUpdated == null || item.updatedAt().isAfter(lastUpdated)) {
        lastUpdated = item.updatedAt();
      }
      if (!item.active()) {
        continue;
      }
      active++;
      perType.merge(item.contentType(), 1L, Long::sum);
      if (item.hasVector()) {
        withVector++;
      }
    }

    return new ContextStats(
        total,
        active,
        perType,
        withVector,
        projectService.countActive(),
        embeddingGenerator.dimension(),
        lastUpdated);
  }
}
