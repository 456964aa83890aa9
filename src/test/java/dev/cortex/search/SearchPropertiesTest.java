package dev.cortex.search;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SearchPropertiesTest {

  @Test
  void defaultsAreValid() {
    assertThatCode(() -> new SearchProperties().validate()).doesNotThrowAnyException();
  }

  @Test
  void rejectsWeightOutsideUnitInterval() {
    SearchProperties properties = new SearchProperties();
    properties.setDefaultSemanticWeight(1.2);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("default-semantic-weight");
  }

  @Test
  void rejectsNonPositiveMaxLimit() {
    SearchProperties properties = new SearchProperties();
    properties.setMaxLimit(0);

    assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void rejectsZeroQueryTimeout() {
    SearchProperties properties = new SearchProperties();
    properties.setQueryTimeout(Duration.ZERO);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("query-timeout");
  }
}
