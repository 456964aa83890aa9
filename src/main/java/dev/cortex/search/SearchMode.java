package dev.cortex.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How candidates are scored. */
public enum SearchMode {
  /** Cosine similarity against the query embedding; items without a vector are excluded. */
  SEMANTIC("semantic"),
  /** Term overlap with title and content. */
  KEYWORD("keyword"),
  /** Weighted sum of the semantic and keyword scores. */
  HYBRID("hybrid");

  private final String value;

  SearchMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static SearchMode fromValue(String value) {
    for (SearchMode mode : values()) {
      if (mode.value.equalsIgnoreCase(value)) {
        return mode;
      }
    }
    throw new InvalidQueryException("Unknown search mode: " + value);
  }
}
