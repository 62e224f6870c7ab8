package com.resumebuilder.backend.dto;

import jakarta.validation.constraints.Size;

public record CreateVersionRequest(
        @Size(max = 255, message = "version_name must be at most 255 characters")
        String versionName,
        @Size(max = 1000, message = "changes_summary must be at most 1000 characters")
        String changesSummary
) {
}
