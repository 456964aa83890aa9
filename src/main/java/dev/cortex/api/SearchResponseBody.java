package dev.cortex.api;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.cortex.search.ScoredItem;
import dev.cortex.search.SearchMode;
import dev.cortex.search.SearchResponse;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** JSON view of a search page. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchResponseBody(
    List<Hit> items,
    long total,
    int limit,
    int offset,
    String query,
    SearchMode searchType,
    SearchMode effectiveSearchType,
    boolean degraded,
    List<String> warnings,
    double executionTimeMs) {

  static SearchResponseBody from(SearchResponse response) {
    return new SearchResponseBody(
        response.items().stream().map(Hit::from).toList(),
        response.total(),
        response.limit(),
        response.offset(),
        response.query(),
        response.mode(),
        response.effectiveMode(),
        response.degraded(),
        response.warnings(),
        response.executionTimeMs());
  }

  /**
   * One ranked item: the item fields at top level plus {@code combined_score} and, when computed,
   * the per-component scores.
   */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Hit(
      @JsonUnwrapped ItemResponse item,
      double combinedScore,
      @Nullable Double semanticScore,
      @Nullable Double keywordScore) {

    static Hit from(ScoredItem scored) {
      return new Hit(
          ItemResponse.from(scored.item()),
          scored.combinedScore(),
          scored.semanticScore(),
          scored.keywordScore());
    }
  }
}
