package dev.cortex.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.cortex.fixture.ContextItemBuilder;
import dev.cortex.item.ContextItem;
import org.junit.jupiter.api.Test;

class TermOverlapScorerTest {

  private final TermOverlapScorer scorer = new TermOverlapScorer(1);

  private final ContextItem rust =
      new ContextItemBuilder().title("Rust ownership").content("borrow checker rules").build();

  @Test
  void titleMatchesCountDouble() {
    double titleOnly = scorer.score(ScoringContext.keywordOnly("ownership"), rust);
    double contentOnly = scorer.score(ScoringContext.keywordOnly("checker"), rust);

    assertThat(titleOnly).isCloseTo(2.0 / 3.0, within(1e-9));
    assertThat(contentOnly).isCloseTo(1.0 / 3.0, within(1e-9));
  }

  @Test
  void combinesTitleAndContentMatches() {
    double score = scorer.score(ScoringContext.keywordOnly("ownership rules"), rust);

    assertThat(score).isCloseTo(3.0 / 5.0, within(1e-9));
  }

  @Test
  void repeatedQueryTermsCountOnce() {
    assertThat(scorer.score(ScoringContext.keywordOnly("rules rules RULES"), rust))
        .isEqualTo(scorer.score(ScoringContext.keywordOnly("rules"), rust));
  }

  @Test
  void matchingIsCaseInsensitive() {
    assertThat(scorer.score(ScoringContext.keywordOnly("OWNERSHIP"), rust)).isPositive();
  }

  @Test
  void termInBothTitleAndContentIsClampedToOne() {
    ContextItem echo = new ContextItemBuilder().title("cache").content("cache").build();

    assertThat(new TermOverlapScorer(0).score(ScoringContext.keywordOnly("cache"), echo))
        .isEqualTo(1.0);
  }

  @Test
  void noOverlapScoresZero() {
    assertThat(scorer.score(ScoringContext.keywordOnly("navigation guards"), rust)).isZero();
  }

  @Test
  void queryWithoutTermsScoresZero() {
    assertThat(scorer.score(ScoringContext.keywordOnly(""), rust)).isZero();
    assertThat(scorer.score(ScoringContext.keywordOnly("?!"), rust)).isZero();
  }

  @Test
  void rejectsNegativeCap() {
    assertThatThrownBy(() -> new TermOverlapScorer(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
