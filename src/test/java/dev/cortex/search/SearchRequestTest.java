package dev.cortex.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.cortex.item.ItemCriteria;
import org.junit.jupiter.api.Test;

class SearchRequestTest {

  @Test
  void defaultsApplyForMissingQueryAndFilters() {
    SearchRequest request = new SearchRequest(null, SearchMode.HYBRID, null, null, 5, 0);

    assertThat(request.query()).isEmpty();
    assertThat(request.filters()).isEqualTo(ItemCriteria.activeOnly());
  }

  @Test
  void convenienceConstructorUsesFirstPage() {
    SearchRequest request = new SearchRequest("rust", SearchMode.KEYWORD);

    assertThat(request.limit()).isEqualTo(50);
    assertThat(request.offset()).isZero();
    assertThat(request.semanticWeight()).isNull();
  }

  @Test
  void rejectsWeightOutsideUnitInterval() {
    SearchRequest request = new SearchRequest("q", SearchMode.HYBRID);

    assertThatThrownBy(() -> request.withSemanticWeight(1.5))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessageContaining("semanticWeight");
    assertThatThrownBy(() -> request.withSemanticWeight(-0.1))
        .isInstanceOf(InvalidQueryException.class);
    assertThatThrownBy(() -> request.withSemanticWeight(Double.NaN))
        .isInstanceOf(InvalidQueryException.class);
  }

  @Test
  void acceptsWeightBounds() {
    SearchRequest request = new SearchRequest("q", SearchMode.HYBRID);

    assertThat(request.withSemanticWeight(0.0).semanticWeight()).isZero();
    assertThat(request.withSemanticWeight(1.0).semanticWeight()).isEqualTo(1.0);
  }

  @Test
  void rejectsNegativePaging() {
    SearchRequest request = new SearchRequest("q", SearchMode.KEYWORD);

    assertThatThrownBy(() -> request.withPage(-1, 0)).isInstanceOf(InvalidQueryException.class);
    assertThatThrownBy(() -> request.withPage(1, -1)).isInstanceOf(InvalidQueryException.class);
  }

  @Test
  void rejectsMissingMode() {
    assertThatThrownBy(() -> new SearchRequest("q", null))
        .isInstanceOf(InvalidQueryException.class);
  }

  @Test
  void parsesModeNames() {
    assertThat(SearchMode.fromValue("Hybrid")).isEqualTo(SearchMode.HYBRID);
    assertThatThrownBy(() -> SearchMode.fromValue("fuzzy"))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessage("Unknown search mode: fuzzy");
  }
}
