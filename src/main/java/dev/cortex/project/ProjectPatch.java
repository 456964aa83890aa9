package dev.cortex.project;

import jakarta.validation.constraints.Size;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Partial project update; {@code null} fields are left unchanged. */
public record ProjectPatch(
    @Nullable @Size(min = 1, max = 255) String name,
    @Nullable String description,
    @Nullable Map<String, Object> settings,
    @Nullable Boolean active) {}
