package dev.cortex.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.cortex.fixture.ContextItemBuilder;
import dev.cortex.item.ContextItem;
import org.junit.jupiter.api.Test;

class CosineSimilarityScorerTest {

  private final CosineSimilarityScorer scorer = new CosineSimilarityScorer();

  private static double score(float[] query, ContextItem item) {
    return new CosineSimilarityScorer().score(new ScoringContext("q", query), item);
  }

  @Test
  void identicalDirectionScoresOne() {
    ContextItem item = new ContextItemBuilder().vector(2f, 0f, 0f).build();

    assertThat(score(new float[] {1f, 0f, 0f}, item)).isCloseTo(1.0, within(1e-9));
  }

  @Test
  void orthogonalVectorsScoreHalf() {
    ContextItem item = new ContextItemBuilder().vector(0f, 1f).build();

    assertThat(score(new float[] {1f, 0f}, item)).isCloseTo(0.5, within(1e-9));
  }

  @Test
  void oppositeVectorsScoreZero() {
    ContextItem item = new ContextItemBuilder().vector(-1f, 0f).build();

    assertThat(score(new float[] {1f, 0f}, item)).isCloseTo(0.0, within(1e-9));
  }

  @Test
  void missingOrIncompatibleVectorsScoreZero() {
    ContextItem noVector = new ContextItemBuilder().build();
    ContextItem shorter = new ContextItemBuilder().vector(1f).build();
    ContextItem zero = new ContextItemBuilder().vector(0f, 0f).build();

    assertThat(score(new float[] {1f, 0f}, noVector)).isZero();
    assertThat(score(new float[] {1f, 0f}, shorter)).isZero();
    assertThat(score(new float[] {1f, 0f}, zero)).isZero();
    assertThat(scorer.score(ScoringContext.keywordOnly("q"), shorter)).isZero();
  }

  @Test
  void rawCosineIsNaNForZeroMagnitude() {
    assertThat(CosineSimilarityScorer.cosine(new float[] {0f, 0f}, new float[] {1f, 0f})).isNaN();
  }
}
