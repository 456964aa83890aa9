package dev.cortex.item;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Input for creating a context item. Validated with Jakarta Bean Validation before any embedding
 * work happens.
 *
 * @param title item title, required
 * @param content snippet text, required (may be empty)
 * @param contentType content kind; {@code null} defaults to {@link ContentType#TEXT}
 * @param tags optional labels
 * @param extraMetadata optional opaque metadata
 * @param source optional origin label
 * @param projectId optional owning project
 */
public record ContextItemDraft(
    @NotBlank @Size(max = 500) String title,
    @NotNull String content,
    @Nullable ContentType contentType,
    @Nullable Set<String> tags,
    @Nullable Map<String, Object> extraMetadata,
    @Nullable String source,
    @Nullable String projectId) {

  public ContentType contentTypeOrDefault() {
    return contentType != null ? contentType : ContentType.TEXT;
  }
}
