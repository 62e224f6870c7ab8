package com.resumebuilder.backend.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Immutable snapshot of a resume's content. Rows are only ever inserted or deleted.
 */
@Entity
@Table(name = "resume_versions",
        uniqueConstraints = @UniqueConstraint(
                name = "resume_versions_resume_id_version_number_key",
                columnNames = {"resume_id", "version_number"}),
        indexes = {
                @Index(name = "resume_versions_resume_id_idx", columnList = "resume_id"),
                @Index(name = "resume_versions_user_id_idx", columnList = "user_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ResumeVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "resume_id", nullable = false, updatable = false)
    private String resumeId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "version_number", nullable = false, updatable = false)
    private int versionNumber;

    @Column(name = "version_name", updatable = false)
    private String versionName;

    @Convert(converter = JsonNodeConverter.class)
    @Column(nullable = false, updatable = false, columnDefinition = "CLOB")
    private JsonNode content;

    @Column(name = "template_id", nullable = false, updatable = false)
    private String templateId;

    @Column(name = "created_by", updatable = false)
    private String createdBy;

    @Column(name = "changes_summary", updatable = false, columnDefinition = "CLOB")
    private String changesSummary;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public ResumeVersion(Resume resume, int versionNumber, String versionName, String changesSummary, String createdBy) {
        this.resumeId = resume.getId();
        this.userId = resume.getUserId();
        this.versionNumber = versionNumber;
        this.versionName = versionName;
        this.content = resume.getContent().deepCopy();
        this.templateId = resume.getTemplateId();
        this.changesSummary = changesSummary;
        this.createdBy = createdBy;
    }

    @PrePersist
    public void onCreate() {
        this.createdAt = LocalDateTime.now();
    }
}
