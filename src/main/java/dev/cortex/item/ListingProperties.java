package dev.cortex.item;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Filter-only listing settings bound from {@code cortex.listing.*}.
 *
 * @param maxLimit largest page a single {@link ItemService#list} call may request
 */
@ConfigurationProperties(prefix = "cortex.listing")
public record ListingProperties(int maxLimit) {

  public ListingProperties {
    if (maxLimit < 1) {
      throw new IllegalStateException(
          "cortex.listing.max-limit must be at least 1, got: " + maxLimit);
    }
  }
}
