package dev.cortex.item;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of a stored context snippet.
 *
 * <p>Only {@code content} drives the embedding; {@code title}, {@code tags} and the other metadata
 * never affect {@code vector}. The vector is either absent or exactly as long as the generator's
 * dimension, and always reflects {@code content} as of the last successful embed.
 *
 * <p>{@code version} is the store's compare-and-swap token: {@code 0} for an item that has never
 * been written, incremented by the store on each successful upsert.
 *
 * @param id store-allocated identifier
 * @param title short human label
 * @param content the snippet text
 * @param contentType content kind, filter only
 * @param tags unordered labels, filter only
 * @param extraMetadata opaque key/value data, passed through untouched
 * @param source free-form origin label (e.g. "mcp", "api")
 * @param projectId optional project the item belongs to
 * @param active {@code false} once soft-deleted
 * @param createdAt creation instant
 * @param updatedAt instant of the last mutation
 * @param vector content embedding, or {@code null} when embedding failed
 * @param version row version for optimistic concurrency
 */
public record ContextItem(
    long id,
    String title,
    String content,
    ContentType contentType,
    Set<String> tags,
    Map<String, Object> extraMetadata,
    @Nullable String source,
    @Nullable String projectId,
    boolean active,
    Instant createdAt,
    Instant updatedAt,
    float @Nullable [] vector,
    long version) {

  public ContextItem {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(contentType, "contentType");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    if (version < 0) {
      throw new IllegalArgumentException("version must be >= 0, got: " + version);
    }
    tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    extraMetadata =
        extraMetadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraMetadata));
    vector = vector == null ? null : vector.clone();
  }

  /** Returns a copy of the vector, or {@code null} if the item has none. */
  @Override
  public float @Nullable [] vector() {
    return vector == null ? null : vector.clone();
  }

  public boolean hasVector() {
    return vector != null;
  }

  public ContextItem withVector(float @Nullable [] newVector) {
    return new ContextItem(
        id, title, content, contentType, tags, extraMetadata, source, projectId, active,
        createdAt, updatedAt, newVector, version);
  }

  public ContextItem withVersion(long newVersion) {
    return new ContextItem(
        id, title, content, contentType, tags, extraMetadata, source, projectId, active,
        createdAt, updatedAt, vector, newVersion);
  }

  public ContextItem withActive(boolean newActive, Instant now) {
    return new ContextItem(
        id, title, content, contentType, tags, extraMetadata, source, projectId, newActive,
        createdAt, now, vector, version);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ContextItem other)) {
      return false;
    }
    return id == other.id
        && active == other.active
        && version == other.version
        && title.equals(other.title)
        && content.equals(other.content)
        && contentType == other.contentType
        && tags.equals(other.tags)
        && extraMetadata.equals(other.extraMetadata)
        && Objects.equals(source, other.source)
        && Objects.equals(projectId, other.projectId)
        && createdAt.equals(other.createdAt)
        && updatedAt.equals(other.updatedAt)
        && Arrays.equals(vector, other.vector);
  }

  @Override
  public int hashCode() {
    int result =
        Objects.hash(
            id, title, content, contentType, tags, extraMetadata, source, projectId, active,
            createdAt, updatedAt, version);
    return 31 * result + Arrays.hashCode(vector);
  }

  @Override
  public String toString() {
    return "ContextItem[id=%d, title=%s, contentType=%s, projectId=%s, active=%s, version=%d, vector=%s]"
        .formatted(
            id,
            title,
            contentType.value(),
            projectId,
            active,
            version,
            vector == null ? "none" : vector.length + " dims");
  }
}
