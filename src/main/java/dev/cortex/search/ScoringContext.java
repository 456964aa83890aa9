package dev.cortex.search;

import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Per-query data shared by all scorers: the raw query, its distinct terms, and its embedding (absent
 * in keyword-only scoring).
 */
public final class ScoringContext {

  private final String query;
  private final Set<String> terms;
  private final float @Nullable [] queryVector;

  public ScoringContext(String query, float @Nullable [] queryVector) {
    this.query = query;
    this.terms = Set.copyOf(Tokenizer.distinctTerms(query));
    this.queryVector = queryVector == null ? null : queryVector.clone();
  }

  public static ScoringContext keywordOnly(String query) {
    return new ScoringContext(query, null);
  }

  public String query() {
    return query;
  }

  public Set<String> terms() {
    return terms;
  }

  /** Query embedding, shared and not copied: scorers must not mutate it. */
  float @Nullable [] queryVector() {
    return queryVector;
  }

  public boolean hasQueryVector() {
    return queryVector != null;
  }

  @Override
  public String toString() {
    return "ScoringContext[query=%s, terms=%s, vector=%s]"
        .formatted(
            query,
            terms,
            queryVector == null ? "none" : queryVector.length + " dims");
  }
}
