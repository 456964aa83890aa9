package dev.cortex.search;

import dev.cortex.item.ContextItem;

/**
 * Semantic relevance: cosine similarity between query and item vectors, mapped from {@code [-1,
 * 1]} to {@code [0, 1]} as {@code (sim + 1) / 2}.
 *
 * <p>Scores 0 when either vector is missing, has zero magnitude, or the dimensions differ.
 */
public class CosineSimilarityScorer implements RelevanceScorer {

  @Override
  public double score(ScoringContext context, ContextItem item) {
    float[] query = context.queryVector();
    float[] vector = item.vector();
    if (query == null || vector == null || query.length != vector.length) {
      return 0.0;
    }
    double similarity = cosine(query, vector);
    if (Double.isNaN(similarity)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, (similarity + 1.0) / 2.0));
  }

  /** Raw cosine similarity, or {@code NaN} if either vector has zero magnitude. */
  static double cosine(float[] a, float[] b) {
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return Double.NaN;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
