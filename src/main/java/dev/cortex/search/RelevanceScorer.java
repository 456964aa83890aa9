package dev.cortex.search;

import dev.cortex.item.ContextItem;

/** Scores one item against a query. Implementations return values in {@code [0, 1]}. */
@FunctionalInterface
public interface RelevanceScorer {

  double score(ScoringContext context, ContextItem item);
}
