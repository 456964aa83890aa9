package dev.cortex.search;

import dev.cortex.item.ContextItem;
import dev.cortex.item.ItemCriteria;
import dev.cortex.item.ItemStore;
import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import org.jspecify.annotations.Nullable;

/**
 * Brute-force ranker: scans every candidate matching the filters, scores it, and keeps the best
 * {@code offset + limit} entries in a bounded heap.
 *
 * <p>Scoring per mode:
 *
 * <ul>
 *   <li>{@code SEMANTIC} - semantic score only; items without a vector are skipped
 *   <li>{@code KEYWORD} - keyword score only
 *   <li>{@code HYBRID} - {@code w * semantic + (1 - w) * keyword}; a missing vector contributes 0
 * </ul>
 *
 * <p>Items with a combined score of 0 are never returned. The ranker holds no per-call state and
 * only reads from the store.
 */
public final class HybridRanker {

  private final ItemStore store;
  private final RelevanceScorer semanticScorer;
  private final RelevanceScorer keywordScorer;
  private final int batchSize;

  public HybridRanker(
      ItemStore store,
      RelevanceScorer semanticScorer,
      RelevanceScorer keywordScorer,
      int batchSize) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
    }
    this.store = store;
    this.semanticScorer = semanticScorer;
    this.keywordScorer = keywordScorer;
    this.batchSize = batchSize;
  }

  /**
   * Ranks the candidates matching {@code filters}.
   *
   * @param context query terms and, for semantic scoring, the query vector
   * @param mode scoring mode actually applied
   * @param semanticWeight weight {@code w} used in hybrid mode
   * @param filters candidate filter, re-checked on every candidate
   * @param limit page size
   * @param offset entries to skip
   * @param cancellation polled before the scan and every {@code batchSize} candidates
   * @throws SearchCancelledException if {@code cancellation} fires during the scan
   */
  public RankedPage rank(
      ScoringContext context,
      SearchMode mode,
      double semanticWeight,
      ItemCriteria filters,
      int limit,
      int offset,
      SearchCancellation cancellation) {
    long started = System.nanoTime();
    checkCancelled(cancellation);

    int keep = (int) Math.min(Integer.MAX_VALUE, (long) offset + limit);
    // Worst retained entry at the head.
    PriorityQueue<ScoredItem> best = new PriorityQueue<>(ScoredItem.RANKING.reversed());
    long total = 0;
    long scanned = 0;

    for (ContextItem item : store.scan(filters)) {
      if (++scanned % batchSize == 0) {
        checkCancelled(cancellation);
      }
      if (!filters.matches(item)) {
        continue;
      }
      ScoredItem scored = score(context, mode, semanticWeight, item);
      if (scored == null) {
        continue;
      }
      total++;
      if (keep == 0) {
        continue;
      }
      if (best.size() < keep) {
        best.add(scored);
      } else if (ScoredItem.RANKING.compare(scored, best.peek()) < 0) {
        best.poll();
        best.add(scored);
      }
    }

    List<ScoredItem> ordered = new ArrayList<>(best);
    ordered.sort(ScoredItem.RANKING);
    List<ScoredItem> page =
        offset >= ordered.size() ? List.of() : List.copyOf(ordered.subList(offset, ordered.size()));
    double elapsedMs = (System.nanoTime() - started) / 1_000_000.0;
    return new RankedPage(page, total, elapsedMs);
  }

  /** Scores one candidate, or returns {@code null} when it is not a match in this mode. */
  private @Nullable ScoredItem score(
      ScoringContext context, SearchMode mode, double semanticWeight, ContextItem item) {
    Double semantic = null;
    Double keyword = null;
    double combined;
    switch (mode) {
      case SEMANTIC -> {
        if (!item.hasVector()) {
          return null;
        }
        semantic = semanticScorer.score(context, item);
        combined = semantic;
      }
      case KEYWORD -> {
        keyword = keywordScorer.score(context, item);
        combined = keyword;
      }
      case HYBRID -> {
        double sem = 0.0;
        if (context.hasQueryVector()) {
          sem = semanticScorer.score(context, item);
          semantic = sem;
        }
        double kw = keywordScorer.score(context, item);
        keyword = kw;
        combined = semanticWeight * sem + (1.0 - semanticWeight) * kw;
      }
      default -> throw new IllegalStateException("Unhandled search mode: " + mode);
    }
    if (!(combined > 0.0)) {
      return null;
    }
    return new ScoredItem(item, combined, semantic, keyword);
  }

  private static void checkCancelled(SearchCancellation cancellation) {
    if (cancellation.isCancelled()) {
      throw new SearchCancelledException("Search cancelled before ranking completed");
    }
  }

  /**
   * Ranker output.
   *
   * @param items the requested page, best first
   * @param total matches before pagination
   * @param elapsedMs time from scan start until the page was built
   */
  public record RankedPage(List<ScoredItem> items, long total, double elapsedMs) {}
}
