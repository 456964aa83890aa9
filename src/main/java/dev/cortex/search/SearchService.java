package dev.cortex.search;

import dev.cortex.embedding.EmbeddingGenerator;
import dev.cortex.embedding.EmbeddingUnavailableException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Search orchestration: validates the request, embeds the query when the mode needs it, and
 * delegates ranking to {@link HybridRanker}.
 *
 * <p>When the query embedding cannot be produced (model down or timed out), semantic and hybrid
 * searches degrade to keyword-only scoring instead of failing. The response reports the requested
 * and the effective mode plus a warning. Hybrid searches with a semantic weight of 0 never call the
 * model.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final HybridRanker ranker;
  private final EmbeddingGenerator embeddingGenerator;
  private final SearchProperties properties;
  private final Clock clock;

  public SearchService(
      HybridRanker ranker,
      EmbeddingGenerator embeddingGenerator,
      SearchProperties properties,
      Clock clock) {
    this.ranker = ranker;
    this.embeddingGenerator = embeddingGenerator;
    this.properties = properties;
    this.clock = clock;
  }

  /** Searches with the configured query timeout as deadline. */
  public SearchResponse search(SearchRequest request) {
    return search(request, SearchCancellation.deadline(clock, properties.getQueryTimeout()));
  }

  /**
   * Runs a ranked search.
   *
   * @param request query, mode, filters and page
   * @param cancellation cooperative cancellation signal
   * @return the requested page with the total match count
   * @throws InvalidQueryException if the page size exceeds the configured maximum
   * @throws SearchCancelledException if {@code cancellation} fires before ranking completes
   */
  public SearchResponse search(SearchRequest request, SearchCancellation cancellation) {
    if (request.limit() > properties.getMaxLimit()) {
      throw new InvalidQueryException(
          "limit must be <= %d, got: %d".formatted(properties.getMaxLimit(), request.limit()));
    }
    double weight =
        request.semanticWeight() != null
            ? request.semanticWeight()
            : properties.getDefaultSemanticWeight();

    SearchMode effectiveMode = request.mode();
    List<String> warnings = new ArrayList<>();
    ScoringContext context;
    if (needsQueryVector(request.mode(), weight)) {
      try {
        context = new ScoringContext(request.query(), embeddingGenerator.embed(request.query()));
      } catch (EmbeddingUnavailableException e) {
        log.warn(
            "Query embedding unavailable, falling back to keyword search: {}", e.getMessage());
        effectiveMode = SearchMode.KEYWORD;
        warnings.add(
            "Semantic scoring unavailable (%s); results use keyword matching only."
                .formatted(e.getMessage()));
        context = ScoringContext.keywordOnly(request.query());
      }
    } else {
      context = ScoringContext.keywordOnly(request.query());
    }

    HybridRanker.RankedPage page =
        ranker.rank(
            context,
            effectiveMode,
            weight,
            request.filters(),
            request.limit(),
            request.offset(),
            cancellation);

    log.debug(
        "Search mode={} effective={} query='{}' total={} in {} ms",
        request.mode().value(),
        effectiveMode.value(),
        request.query(),
        page.total(),
        page.elapsedMs());

    return new SearchResponse(
        page.items(),
        page.total(),
        request.limit(),
        request.offset(),
        request.query(),
        request.mode(),
        effectiveMode,
        effectiveMode != request.mode(),
        warnings,
        page.elapsedMs());
  }

  private static boolean needsQueryVector(SearchMode mode, double weight) {
    return switch (mode) {
      case SEMANTIC -> true;
      case KEYWORD -> false;
      case HYBRID -> weight > 0.0;
    };
  }
}
