package com.resumebuilder.backend.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResumeCreateRequest(
        @NotBlank(message = "title is required")
        @Size(max = 255, message = "title must be at most 255 characters")
        String title,
        @Size(max = 1000, message = "description must be at most 1000 characters")
        String description,
        String templateId,
        JsonNode content
) {
}
