package com.example.audit.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A single issue reported by an analysis strategy.
 *
 * @param title       Short human-readable label
 * @param description Free-text explanation of the issue
 * @param severity    Severity label as reported (Critical, High, Medium, Low, Info/Informational)
 * @param locations   Location identifiers (usually file paths), insertion order preserved
 */
@JsonPropertyOrder({"title", "description", "severity", "locations"})
public record Finding(
        String title,
        String description,
        String severity,
        @JsonAlias({"file_paths", "filePaths"}) List<String> locations
) {
    /** Compact constructor: replaces nulls and removes duplicate locations, keeping the first occurrence. */
    public Finding {
        title = title != null ? title : "";
        description = description != null ? description : "";
        severity = severity != null ? severity : "";
        locations = locations == null
                ? List.of()
                : locations.stream().filter(Objects::nonNull).distinct().toList();
    }

    public static Finding of(String title, String description, String severity, String... locations) {
        return new Finding(title, description, severity, List.of(locations));
    }
}
