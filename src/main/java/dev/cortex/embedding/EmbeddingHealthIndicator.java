package dev.cortex.embedding;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the embedding model answers, under {@code /health/embedding}.
 *
 * <p>Each check embeds a short fixed text through the time-limited generator, so a stuck model is
 * reported DOWN after the configured timeout rather than blocking the endpoint.
 */
@Component
public class EmbeddingHealthIndicator implements HealthIndicator {

  static final String CHECK_TEXT = "health check";

  private final EmbeddingGenerator embeddingGenerator;

  public EmbeddingHealthIndicator(EmbeddingGenerator embeddingGenerator) {
    this.embeddingGenerator = embeddingGenerator;
  }

  @Override
  public Health health() {
    try {
      float[] vector = embeddingGenerator.embed(CHECK_TEXT);
      return Health.up()
          .withDetail("dimension", embeddingGenerator.dimension())
          .withDetail("vectorLength", vector.length)
          .build();
    } catch (EmbeddingUnavailableException e) {
      return Health.down()
          .withDetail("dimension", embeddingGenerator.dimension())
          .withDetail("error", e.getMessage())
          .build();
    }
  }
}
