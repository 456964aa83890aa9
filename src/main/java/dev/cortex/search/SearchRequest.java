package dev.cortex.search;

import dev.cortex.item.ItemCriteria;
import org.jspecify.annotations.Nullable;

/**
 * A ranked search over context items.
 *
 * @param query free-text query; {@code null} is treated as empty
 * @param mode scoring mode
 * @param filters candidate filter; {@code null} means all active items
 * @param semanticWeight weight of the semantic score in hybrid mode, {@code [0, 1]}; {@code null}
 *     uses the configured default
 * @param limit page size, {@code >= 0}
 * @param offset entries to skip, {@code >= 0}
 */
public record SearchRequest(
    String query,
    SearchMode mode,
    ItemCriteria filters,
    @Nullable Double semanticWeight,
    int limit,
    int offset) {

  /** Page size used when the caller does not specify one. */
  public static final int DEFAULT_LIMIT = 50;

  /** Compact constructor validating input. */
  public SearchRequest {
    query = query == null ? "" : query;
    filters = filters == null ? ItemCriteria.activeOnly() : filters;
    if (mode == null) {
      throw new InvalidQueryException("Search mode is required");
    }
    if (limit < 0) {
      throw new InvalidQueryException("limit must be >= 0, got: " + limit);
    }
    if (offset < 0) {
      throw new InvalidQueryException("offset must be >= 0, got: " + offset);
    }
    if (semanticWeight != null
        && (semanticWeight.isNaN() || semanticWeight < 0.0 || semanticWeight > 1.0)) {
      throw new InvalidQueryException("semanticWeight must be in [0.0, 1.0], got: " + semanticWeight);
    }
  }

  /** Active items, default weight, first page. */
  public SearchRequest(String query, SearchMode mode) {
    this(query, mode, ItemCriteria.activeOnly(), null, DEFAULT_LIMIT, 0);
  }

  public SearchRequest withSemanticWeight(double weight) {
    return new SearchRequest(query, mode, filters, weight, limit, offset);
  }

  public SearchRequest withPage(int newLimit, int newOffset) {
    return new SearchRequest(query, mode, filters, semanticWeight, newLimit, newOffset);
  }

  public SearchRequest withFilters(ItemCriteria newFilters) {
    return new SearchRequest(query, mode, newFilters, semanticWeight, limit, offset);
  }
}
