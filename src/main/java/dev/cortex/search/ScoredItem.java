package dev.cortex.search;

import dev.cortex.item.ContextItem;
import java.util.Comparator;
import org.jspecify.annotations.Nullable;

/**
 * A ranked search hit.
 *
 * @param item the matching item
 * @param combinedScore score used for ordering, in {@code (0, 1]}
 * @param semanticScore semantic component, absent when it was not computed
 * @param keywordScore keyword component, absent when it was not computed
 */
public record ScoredItem(
    ContextItem item,
    double combinedScore,
    @Nullable Double semanticScore,
    @Nullable Double keywordScore) {

  /** Result order: score desc, then newest first, then highest id first. A total order. */
  public static final Comparator<ScoredItem> RANKING =
      Comparator.comparingDouble(ScoredItem::combinedScore)
          .thenComparing(s -> s.item().createdAt())
          .thenComparingLong(s -> s.item().id())
          .reversed();
}
