package dev.cortex.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.cortex.item.ContentType;
import dev.cortex.item.ContextItemPatch;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** JSON body for {@code PUT /api/items/{id}}; absent fields stay unchanged. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ItemUpdateRequest(
    @Nullable String title,
    @Nullable String content,
    @Nullable ContentType contentType,
    @Nullable Set<String> tags,
    @Nullable Map<String, Object> extraMetadata,
    @Nullable String source,
    @Nullable String projectId,
    @Nullable Boolean isActive) {

  ContextItemPatch toPatch() {
    return new ContextItemPatch(
        title, content, contentType, tags, extraMetadata, source, projectId, isActive);
  }
}
