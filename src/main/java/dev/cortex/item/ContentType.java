package dev.cortex.item;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of content held by a context item. Used as a filter dimension only. */
public enum ContentType {
  TEXT("text"),
  CODE("code"),
  MARKDOWN("markdown"),
  JSON("json");

  private final String value;

  ContentType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ContentType fromValue(String value) {
    for (ContentType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Invalid content type: " + value);
  }
}
