package dev.cortex.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.cortex.project.ProjectDraft;
import dev.cortex.project.ProjectPatch;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** JSON body for creating ({@code POST}) or patching ({@code PUT}) a project. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectRequest(
    @Nullable String id,
    @Nullable String name,
    @Nullable String description,
    @Nullable Map<String, Object> settings,
    @Nullable Boolean isActive) {

  ProjectDraft toDraft() {
    return new ProjectDraft(id, name, description, settings);
  }

  ProjectPatch toPatch() {
    return new ProjectPatch(name, description, settings, isActive);
  }
}
