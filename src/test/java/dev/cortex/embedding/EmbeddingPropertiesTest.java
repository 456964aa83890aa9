package dev.cortex.embedding;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class EmbeddingPropertiesTest {

  @Test
  void rejectsNonPositiveDimension() {
    assertThatThrownBy(() -> new EmbeddingProperties(0, Duration.ofSeconds(5), 2))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("dimension");
  }

  @Test
  void rejectsMissingTimeout() {
    assertThatThrownBy(() -> new EmbeddingProperties(384, null, 2))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("timeout");
  }

  @Test
  void rejectsEmptyWorkerPool() {
    assertThatThrownBy(() -> new EmbeddingProperties(384, Duration.ofSeconds(5), 0))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("worker-threads");
  }
}
