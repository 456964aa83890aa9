package dev.cortex.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.cortex.project.ContextProject;
import java.time.Instant;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** JSON view of a project. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectResponse(
    String id,
    String name,
    @Nullable String description,
    Map<String, Object> settings,
    @JsonProperty("is_active") boolean isActive,
    Instant createdAt,
    Instant updatedAt) {

  static ProjectResponse from(ContextProject project) {
    return new ProjectResponse(
        project.getId(),
        project.getName(),
        project.getDescription(),
        project.getSettings(),
        project.isActive(),
        project.getCreatedAt(),
        project.getUpdatedAt());
  }
}
