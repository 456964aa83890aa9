package dev.cortex.embedding;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Embedding settings bound from {@code cortex.embedding.*}.
 *
 * @param dimension expected vector length {@code D} (384 for all-MiniLM-L6-v2)
 * @param timeout maximum time a single embedding call may take before it is abandoned
 * @param workerThreads size of the pool that runs model calls
 */
@ConfigurationProperties(prefix = "cortex.embedding")
public record EmbeddingProperties(int dimension, Duration timeout, int workerThreads) {

  public EmbeddingProperties {
    if (dimension < 1) {
      throw new IllegalStateException("cortex.embedding.dimension must be positive, got: " + dimension);
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException("cortex.embedding.timeout must be a positive duration");
    }
    if (workerThreads < 1) {
      throw new IllegalStateException(
          "cortex.embedding.worker-threads must be at least 1, got: " + workerThreads);
    }
  }
}
