package com.resumebuilder.backend.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.resumebuilder.backend.entity.Resume;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResumeDto {
    private String id;
    private String title;
    private String description;
    private String templateId;
    private String status;
    private JsonNode content;
    private int lastVersionNumber;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ResumeDto fromEntity(Resume resume) {
        ResumeDto dto = new ResumeDto();
        dto.setId(resume.getId());
        dto.setTitle(resume.getTitle());
        dto.setDescription(resume.getDescription());
        dto.setTemplateId(resume.getTemplateId());
        dto.setStatus(resume.getStatus());
        dto.setContent(resume.getContent());
        dto.setLastVersionNumber(resume.getLastVersionNumber());
        dto.setCreatedAt(resume.getCreatedAt());
        dto.setUpdatedAt(resume.getUpdatedAt());
        return dto;
    }
}
