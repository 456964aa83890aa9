package dev.cortex.item;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Mutation pipeline settings bound from {@code cortex.mutation.*}.
 *
 * @param maxAttempts how many times a read-modify-write cycle runs before a version conflict is
 *     reported to the caller
 * @param backoffMs pause between attempts
 */
@ConfigurationProperties(prefix = "cortex.mutation")
public record MutationProperties(int maxAttempts, long backoffMs) {

  public MutationProperties {
    if (maxAttempts < 1) {
      throw new IllegalStateException(
          "cortex.mutation.max-attempts must be at least 1, got: " + maxAttempts);
    }
    if (backoffMs < 0) {
      throw new IllegalStateException(
          "cortex.mutation.backoff-ms must be >= 0, got: " + backoffMs);
    }
  }
}
