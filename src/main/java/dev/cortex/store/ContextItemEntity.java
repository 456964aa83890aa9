package dev.cortex.store;

import dev.cortex.item.ContentType;
import dev.cortex.item.ContextItem;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;
import org.springframework.data.domain.Persistable;

/**
 * Row of the {@code context_items} table.
 *
 * <p>Content and vector live in the same row, so a single UPDATE writes both. Ids are allocated by
 * the {@code context_item_id_seq} sequence before the entity is built, hence {@link Persistable}
 * to tell Spring Data whether to persist or merge. The {@code version} column is a plain counter
 * checked by {@link JpaItemStore} under a row lock, not a JPA {@code @Version}.
 *
 * <p>Maps to the {@code context_items} table managed by Flyway migrations.
 */
@Entity
@Table(name = "context_items")
public class ContextItemEntity implements Persistable<Long> {

  @Id private Long id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String title;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String content;

  @Enumerated(EnumType.STRING)
  @Column(name = "content_type", nullable = false)
  private ContentType contentType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB", nullable = false)
  private List<String> tags = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "extra_metadata", columnDefinition = "JSONB", nullable = false)
  private Map<String, Object> extraMetadata = new LinkedHashMap<>();

  private String source;

  @Column(name = "project_id")
  private String projectId;

  @Column(nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @JdbcTypeCode(SqlTypes.ARRAY)
  @Column(columnDefinition = "REAL[]")
  private float[] vector;

  @Column(nullable = false)
  private long version;

  @Transient private boolean isNew;

  protected ContextItemEntity() {
    // JPA requires no-arg constructor
  }

  /** Builds a not-yet-persisted row from a domain item. */
  static ContextItemEntity newRow(ContextItem item, long storedVersion) {
    ContextItemEntity entity = new ContextItemEntity();
    entity.id = item.id();
    entity.createdAt = item.createdAt();
    entity.isNew = true;
    entity.copyFrom(item, storedVersion);
    return entity;
  }

  /** Overwrites every mutable column from the domain item. */
  void copyFrom(ContextItem item, long storedVersion) {
    this.title = item.title();
    this.content = item.content();
    this.contentType = item.contentType();
    this.tags = new ArrayList<>(item.tags());
    this.extraMetadata = new LinkedHashMap<>(item.extraMetadata());
    this.source = item.source();
    this.projectId = item.projectId();
    this.active = item.active();
    this.updatedAt = item.updatedAt();
    this.vector = item.vector();
    this.version = storedVersion;
  }

  ContextItem toDomain() {
    return new ContextItem(
        id,
        title,
        content,
        contentType,
        tags == null ? null : new LinkedHashSet<>(tags),
        extraMetadata,
        source,
        projectId,
        active,
        createdAt,
        updatedAt,
        vector,
        version);
  }

  @PostLoad
  @PostPersist
  void markNotNew() {
    this.isNew = false;
  }

  @Override
  public Long getId() {
    return id;
  }

  @Override
  public boolean isNew() {
    return isNew;
  }

  public long getVersion() {
    return version;
  }

  public float @Nullable [] getVector() {
    return vector;
  }
}
