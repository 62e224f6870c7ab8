package com.resumebuilder.backend.service.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Top-level field names that differ between two resume contents, each list sorted by name.
 */
public record VersionDiff(List<String> added, List<String> removed, List<String> modified) {

    public VersionDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        modified = List.copyOf(modified);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }
}
