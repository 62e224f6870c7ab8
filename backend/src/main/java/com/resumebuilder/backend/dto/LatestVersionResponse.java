package com.resumebuilder.backend.dto;

// latestVersionNumber is null when the resume has no stored versions.
public record LatestVersionResponse(Integer latestVersionNumber) {
}
