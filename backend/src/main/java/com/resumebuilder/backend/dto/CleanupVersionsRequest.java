package com.resumebuilder.backend.dto;

// keepCount is optional; the configured default applies when it is absent.
public record CleanupVersionsRequest(Integer keepCount) {
}
