package com.resumebuilder.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resumebuilder.backend.dto.ResumeCreateRequest;
import com.resumebuilder.backend.dto.ResumeUpdateRequest;
import com.resumebuilder.backend.entity.Resume;
import com.resumebuilder.backend.exception.InvalidOperationException;
import com.resumebuilder.backend.exception.NotFoundException;
import com.resumebuilder.backend.repository.ResumeRepository;
import com.resumebuilder.backend.repository.ResumeVersionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Owner-scoped access to the current, mutable state of each resume.
 */
@Slf4j
@Service
public class ResumeService {

    private final ResumeRepository resumeRepository;
    private final ResumeVersionRepository resumeVersionRepository;
    private final ObjectMapper objectMapper;
    private final String defaultTemplateId;

    public ResumeService(ResumeRepository resumeRepository,
                         ResumeVersionRepository resumeVersionRepository,
                         ObjectMapper objectMapper,
                         @Value("${app.resumes.default-template-id:modern}") String defaultTemplateId) {
        this.resumeRepository = resumeRepository;
        this.resumeVersionRepository = resumeVersionRepository;
        this.objectMapper = objectMapper;
        this.defaultTemplateId = defaultTemplateId;
    }

    @Transactional
    public Resume create(String userId, ResumeCreateRequest request) {
        String templateId = request.templateId() != null ? request.templateId() : defaultTemplateId;
        Resume resume = new Resume(userId, request.title(), request.description(), templateId,
                normalizeContent(request.content()));
        resume = resumeRepository.save(resume);
        log.info("Created resume {} for user {}", resume.getId(), userId);
        return resume;
    }

    @Transactional(readOnly = true)
    public List<Resume> list(String userId) {
        return resumeRepository.findByUserIdAndDeletedAtIsNullOrderByUpdatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public Resume get(String resumeId, String userId) {
        return resumeRepository.findByIdAndUserIdAndDeletedAtIsNull(resumeId, userId)
                .orElseThrow(NotFoundException::resume);
    }

    /**
     * Loads the resume and holds a row write lock on it until the surrounding transaction ends.
     * All version writes for a resume serialize on this lock.
     */
    @Transactional
    public Resume getForUpdate(String resumeId, String userId) {
        return resumeRepository.findActiveByIdAndUserIdForUpdate(resumeId, userId)
                .orElseThrow(NotFoundException::resume);
    }

    @Transactional
    public Resume update(String resumeId, String userId, ResumeUpdateRequest request) {
        Resume resume = getForUpdate(resumeId, userId);
        if (request.title() != null) {
            resume.setTitle(request.title());
        }
        if (request.description() != null) {
            resume.setDescription(request.description());
        }
        if (request.templateId() != null) {
            resume.setTemplateId(request.templateId());
        }
        if (request.status() != null) {
            resume.setStatus(request.status());
        }
        if (request.content() != null) {
            resume.setContent(normalizeContent(request.content()));
        }
        return resumeRepository.save(resume);
    }

    @Transactional
    public void updateContent(Resume resume, JsonNode content, String templateId) {
        resume.setContent(normalizeContent(content));
        resume.setTemplateId(templateId);
        resume.setUpdatedAt(LocalDateTime.now());
        resumeRepository.save(resume);
    }

    @Transactional
    public void delete(String resumeId, String userId) {
        Resume resume = getForUpdate(resumeId, userId);
        resume.setDeletedAt(LocalDateTime.now());
        resumeRepository.save(resume);
        log.info("Soft-deleted resume {} for user {}", resumeId, userId);
    }

    @Transactional(readOnly = true)
    public long countSnapshots(String resumeId) {
        return resumeVersionRepository.countByResumeId(resumeId);
    }

    private JsonNode normalizeContent(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return objectMapper.createObjectNode();
        }
        if (!content.isObject()) {
            throw new InvalidOperationException("INVALID_CONTENT", "Resume content must be a JSON object");
        }
        return content.deepCopy();
    }
}
