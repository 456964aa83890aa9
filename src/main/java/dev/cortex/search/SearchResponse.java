package dev.cortex.search;

import java.util.List;

/**
 * One page of search results.
 *
 * @param items ranked hits for the requested page
 * @param total number of matches before pagination
 * @param limit requested page size
 * @param offset requested offset
 * @param query the query as executed
 * @param mode mode the caller asked for
 * @param effectiveMode mode actually used; differs from {@code mode} when degraded
 * @param degraded whether semantic scoring was skipped because no query embedding was available
 * @param warnings human-readable notes about degradation
 * @param executionTimeMs wall-clock time from scan start until the page was built
 */
public record SearchResponse(
    List<ScoredItem> items,
    long total,
    int limit,
    int offset,
    String query,
    SearchMode mode,
    SearchMode effectiveMode,
    boolean degraded,
    List<String> warnings,
    double executionTimeMs) {

  public SearchResponse {
    items = List.copyOf(items);
    warnings = List.copyOf(warnings);
  }
}
