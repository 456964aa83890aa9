package dev.cortex.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.cortex.item.ContentType;
import dev.cortex.item.ContextItemDraft;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** JSON body for {@code POST /api/items}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ItemRequest(
    String title,
    String content,
    @Nullable ContentType contentType,
    @Nullable Set<String> tags,
    @Nullable Map<String, Object> extraMetadata,
    @Nullable String source,
    @Nullable String projectId) {

  ContextItemDraft toDraft() {
    return new ContextItemDraft(
        title,
        content,
        contentType,
        tags,
        extraMetadata,
        source != null ? source : "api",
        projectId);
  }
}
