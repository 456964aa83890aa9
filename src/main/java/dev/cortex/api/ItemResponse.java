package dev.cortex.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.cortex.item.ContentType;
import dev.cortex.item.ContextItem;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** JSON view of a context item. The vector itself is not exposed, only whether one exists. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ItemResponse(
    long id,
    String title,
    String content,
    ContentType contentType,
    Set<String> tags,
    Map<String, Object> extraMetadata,
    @Nullable String source,
    @Nullable String projectId,
    @JsonProperty("is_active") boolean isActive,
    Instant createdAt,
    Instant updatedAt,
    boolean hasEmbedding,
    long version) {

  static ItemResponse from(ContextItem item) {
    return new ItemResponse(
        item.id(),
        item.title(),
        item.content(),
        item.contentType(),
        item.tags(),
        item.extraMetadata(),
        item.source(),
        item.projectId(),
        item.active(),
        item.createdAt(),
        item.updatedAt(),
        item.hasVector(),
        item.version());
  }
}
