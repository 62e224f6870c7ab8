package com.resumebuilder.backend.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ResumeUpdateRequest(
        @Size(min = 1, max = 255, message = "title must be between 1 and 255 characters")
        String title,
        @Size(max = 1000, message = "description must be at most 1000 characters")
        String description,
        String templateId,
        @Pattern(regexp = "draft|published|archived", message = "status must be draft, published or archived")
        String status,
        JsonNode content
) {
}
