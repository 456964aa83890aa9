package dev.cortex.search;

import dev.cortex.item.ContextItem;
import java.util.Set;

/**
 * Keyword relevance from distinct query terms found in the item:
 *
 * <pre>
 *   score = (2 * titleMatches + contentMatches) / (2 * queryTerms + contentTermCap)
 * </pre>
 *
 * <p>Title matches count double. The result is clamped to {@code [0, 1]}; a query without terms
 * scores 0 for every item.
 */
public class TermOverlapScorer implements RelevanceScorer {

  private final int contentTermCap;

  public TermOverlapScorer(int contentTermCap) {
    if (contentTermCap < 0) {
      throw new IllegalArgumentException("contentTermCap must be >= 0, got: " + contentTermCap);
    }
    this.contentTermCap = contentTermCap;
  }

  @Override
  public double score(ScoringContext context, ContextItem item) {
    Set<String> queryTerms = context.terms();
    if (queryTerms.isEmpty()) {
      return 0.0;
    }
    Set<String> titleTerms = Tokenizer.distinctTerms(item.title());
    Set<String> contentTerms = Tokenizer.distinctTerms(item.content());
    int titleMatches = 0;
    int contentMatches = 0;
    for (String term : queryTerms) {
      if (titleTerms.contains(term)) {
        titleMatches++;
      }
      if (contentTerms.contains(term)) {
        contentMatches++;
      }
    }
    double raw =
        (2.0 * titleMatches + contentMatches) / (2.0 * queryTerms.size() + contentTermCap);
    return Math.min(1.0, raw);
  }
}
