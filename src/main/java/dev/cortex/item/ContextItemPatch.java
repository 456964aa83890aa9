package dev.cortex.item;

import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Partial update of a context item. {@code null} fields are left unchanged.
 *
 * <p>Setting {@code active} to {@code true} reactivates a soft-deleted item.
 */
public record ContextItemPatch(
    @Nullable @Size(min = 1, max = 500) String title,
    @Nullable String content,
    @Nullable ContentType contentType,
    @Nullable Set<String> tags,
    @Nullable Map<String, Object> extraMetadata,
    @Nullable String source,
    @Nullable String projectId,
    @Nullable Boolean active) {

  public static ContextItemPatch content(String content) {
    return new ContextItemPatch(null, content, null, null, null, null, null, null);
  }

  public static ContextItemPatch title(String title) {
    return new ContextItemPatch(title, null, null, null, null, null, null, null);
  }

  public static ContextItemPatch tags(Set<String> tags) {
    return new ContextItemPatch(null, null, null, tags, null, null, null, null);
  }

  public static ContextItemPatch reactivate() {
    return new ContextItemPatch(null, null, null, null, null, null, null, Boolean.TRUE);
  }

  /** Whether applying this patch to {@code item} changes its content. */
  public boolean changesContent(ContextItem item) {
    return content != null && !content.equals(item.content());
  }

  /**
   * Applies the patch, keeping the current vector and version. The caller decides whether the
   * vector must be recomputed.
   */
  ContextItem applyTo(ContextItem item, Instant now) {
    return new ContextItem(
        item.id(),
        title != null ? title : item.title(),
        content != null ? content : item.content(),
        contentType != null ? contentType : item.contentType(),
        tags != null ? tags : item.tags(),
        extraMetadata != null ? extraMetadata : item.extraMetadata(),
        source != null ? source : item.source(),
        projectId != null ? projectId : item.projectId(),
        active != null ? active : item.active(),
        item.createdAt(),
        now,
        item.vector(),
        item.version());
  }
}
