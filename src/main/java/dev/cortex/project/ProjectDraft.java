package dev.cortex.project;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Input for creating a project.
 *
 * @param id user-chosen key: letters, digits, dot, dash and underscore
 * @param name display name
 * @param description optional free text
 * @param settings optional opaque settings
 */
public record ProjectDraft(
    @NotBlank @Size(max = 255) @Pattern(regexp = "[A-Za-z0-9._-]+") String id,
    @NotBlank @Size(max = 255) String name,
    @Nullable String description,
    @Nullable Map<String, Object> settings) {}
