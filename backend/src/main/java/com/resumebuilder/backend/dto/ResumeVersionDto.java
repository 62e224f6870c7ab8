package com.resumebuilder.backend.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.resumebuilder.backend.entity.ResumeVersion;

import java.time.LocalDateTime;

public record ResumeVersionDto(
        String id,
        String resumeId,
        int versionNumber,
        String versionName,
        JsonNode content,
        String templateId,
        String createdBy,
        String changesSummary,
        LocalDateTime createdAt
) {
    public static ResumeVersionDto fromEntity(ResumeVersion version) {
        return new ResumeVersionDto(
                version.getId(),
                version.getResumeId(),
                version.getVersionNumber(),
                version.getVersionName(),
                version.getContent(),
                version.getTemplateId(),
                version.getCreatedBy(),
                version.getChangesSummary(),
                version.getCreatedAt()
        );
    }
}
