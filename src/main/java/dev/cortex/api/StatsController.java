package dev.cortex.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.cortex.item.ContentType;
import dev.cortex.stats.ContextStats;
import dev.cortex.stats.ContextStatsService;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST adapter for store statistics. */
@RestController
@RequestMapping("/api/stats")
public class StatsController {

  private final ContextStatsService statsService;

  public StatsController(ContextStatsService statsService) {
    this.statsService = statsService;
  }

  @GetMapping
  public StatsResponse stats(
      @RequestParam(name = "project_id", required = false) @Nullable String projectId) {
    return StatsResponse.from(statsService.stats(projectId));
  }

  /** JSON view of {@link ContextStats}; content types keyed by their wire value. */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record StatsResponse(
      long totalItems,
      long activeItems,
      Map<String, Long> contentTypes,
      long itemsWithEmbedding,
      long projectsCount,
      int embeddingDimension,
      @Nullable Instant lastUpdated) {

    static StatsResponse from(ContextStats stats) {
      Map<String, Long> byType = new TreeMap<>();
      for (Map.Entry<ContentType, Long> entry : stats.contentTypes().entrySet()) {
        byType.put(entry.getKey().value(), entry.getValue());
      }
      return new StatsResponse(
          stats.totalItems(),
          stats.activeItems(),
          byType,
          stats.itemsWithVector(),
          stats.projectsCount(),
          stats.embeddingDimension(),
          stats.lastUpdated());
    }
  }
}
