package dev.cortex.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code cortex.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code default-semantic-weight} - weight of the semantic score in hybrid mode when the
 *       request does not give one (0.0 = keyword only, 1.0 = semantic only; default 0.7)
 *   <li>{@code max-limit} - largest page size a request may ask for (default 100)
 *   <li>{@code scan-batch-size} - candidates scored between two cancellation checks (default 64)
 *   <li>{@code content-term-cap} - constant added to the keyword score denominator (default 1)
 *   <li>{@code query-timeout} - deadline applied to a search when the caller gives none (default
 *       10s)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "cortex.search")
public class SearchProperties {

  private double defaultSemanticWeight = 0.7;
  private int maxLimit = 100;
  private int scanBatchSize = 64;
  private int contentTermCap = 1;
  private Duration queryTimeout = Duration.ofSeconds(10);

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (defaultSemanticWeight < 0.0 || defaultSemanticWeight > 1.0) {
      throw new IllegalStateException(
          "cortex.search.default-semantic-weight must be in [0.0, 1.0], got: "
              + defaultSemanticWeight);
    }
    if (maxLimit < 1) {
      throw new IllegalStateException("cortex.search.max-limit must be >= 1, got: " + maxLimit);
    }
    if (scanBatchSize < 1) {
      throw new IllegalStateException(
          "cortex.search.scan-batch-size must be >= 1, got: " + scanBatchSize);
    }
    if (contentTermCap < 0) {
      throw new IllegalStateException(
          "cortex.search.content-term-cap must be >= 0, got: " + contentTermCap);
    }
    if (queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()) {
      throw new IllegalStateException("cortex.search.query-timeout must be a positive duration");
    }
  }

  public double getDefaultSemanticWeight() {
    return defaultSemanticWeight;
  }

  public void setDefaultSemanticWeight(double defaultSemanticWeight) {
    this.defaultSemanticWeight = defaultSemanticWeight;
  }

  public int getMaxLimit() {
    return maxLimit;
  }

  public void setMaxLimit(int maxLimit) {
    this.maxLimit = maxLimit;
  }

  public int getScanBatchSize() {
    return scanBatchSize;
  }

  public void setScanBatchSize(int scanBatchSize) {
    this.scanBatchSize = scanBatchSize;
  }

  public int getContentTermCap() {
    return contentTermCap;
  }

  public void setContentTermCap(int contentTermCap) {
    this.contentTermCap = contentTermCap;
  }

  public Duration getQueryTimeout() {
    return queryTimeout;
  }

  public void setQueryTimeout(Duration queryTimeout) {
    this.queryTimeout = queryTimeout;
  }
}
