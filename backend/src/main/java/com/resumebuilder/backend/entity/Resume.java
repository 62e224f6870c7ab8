package com.resumebuilder.backend.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "resumes", indexes = {
        @Index(name = "resumes_user_id_idx", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
public class Resume {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "CLOB")
    private String description;

    @Column(name = "template_id", nullable = false)
    private String templateId;

    @Convert(converter = JsonNodeConverter.class)
    @Column(nullable = false, columnDefinition = "CLOB")
    private JsonNode content;

    @Column(nullable = false, length = 32)
    private String status; // draft, published, archived

    // Highest version number ever handed out for this resume; never decremented.
    @Column(name = "last_version_number", nullable = false)
    private int lastVersionNumber;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public Resume(String userId, String title, String description, String templateId, JsonNode content) {
        this.userId = userId;
        this.title = title;
        this.description = description;
        this.templateId = templateId;
        this.content = content;
        this.status = "draft";
        this.lastVersionNumber = 0;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public int allocateVersionNumber() {
        lastVersionNumber = lastVersionNumber + 1;
        return lastVersionNumber;
    }

    @PrePersist
    public void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    public void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
