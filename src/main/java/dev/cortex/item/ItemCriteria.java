package dev.cortex.item;

import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Filter over context items. Dimensions combine with AND; values inside {@code tags} and {@code
 * contentTypes} combine with OR. A {@code null} or empty dimension does not filter.
 *
 * @param projectId exact project match
 * @param contentTypes item content type must be one of these
 * @param tags item must carry at least one of these tags
 * @param includeInactive whether soft-deleted items qualify
 */
public record ItemCriteria(
    @Nullable String projectId,
    @Nullable Set<ContentType> contentTypes,
    @Nullable Set<String> tags,
    boolean includeInactive) {

  public ItemCriteria {
    contentTypes = contentTypes == null || contentTypes.isEmpty() ? null : Set.copyOf(contentTypes);
    tags = tags == null || tags.isEmpty() ? null : Set.copyOf(tags);
  }

  /** All active items. */
  public static ItemCriteria activeOnly() {
    return new ItemCriteria(null, null, null, false);
  }

  /** Every item, active or not. */
  public static ItemCriteria everything() {
    return new ItemCriteria(null, null, null, true);
  }

  public static ItemCriteria forProject(String projectId) {
    return new ItemCriteria(projectId, null, null, false);
  }

  public boolean matches(ContextItem item) {
    if (!includeInactive && !item.active()) {
      return false;
    }
    if (projectId != null && !projectId.equals(item.projectId())) {
      return false;
    }
    if (contentTypes != null && !contentTypes.contains(item.contentType())) {
      return false;
    }
    if (tags != null) {
      for (String tag : item.tags()) {
        if (tags.contains(tag)) {
          return true;
        }
      }
      return false;
    }
    return true;
  }
}
