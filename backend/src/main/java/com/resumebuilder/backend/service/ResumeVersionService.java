package com.resumebuilder.backend.service;

import com.resumebuilder.backend.entity.Resume;
import com.resumebuilder.backend.entity.ResumeVersion;
import com.resumebuilder.backend.exception.InvalidOperationException;
import com.resumebuilder.backend.exception.NotFoundException;
import com.resumebuilder.backend.repository.ResumeVersionRepository;
import com.resumebuilder.backend.service.diff.ResumeContentDiffer;
import com.resumebuilder.backend.service.diff.VersionDiff;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Snapshot history of resumes: creation, lookup, restore, comparison and retention.
 * <p>
 * Every write locks the owning resume row first, so version numbers are allocated and the
 * "keep at least one snapshot" rule is checked without interference from concurrent writers.
 */
@Slf4j
@Service
public class ResumeVersionService {

    static final String RESTORE_VERSION_NAME = "Auto-save before restore";

    private final ResumeService resumeService;
    private final ResumeVersionRepository resumeVersionRepository;
    private final ResumeContentDiffer contentDiffer;
    private final VersionWriteExecutor writeExecutor;
    private final int defaultKeepCount;

    public record VersionComparison(ResumeVersion oldVersion, ResumeVersion newVersion, VersionDiff diff) {}

    public record RestoreResult(Resume resume, ResumeVersion safetySnapshot, ResumeVersion restoredFrom) {}

    public ResumeVersionService(ResumeService resumeService,
                                ResumeVersionRepository resumeVersionRepository,
                                ResumeContentDiffer contentDiffer,
                                VersionWriteExecutor writeExecutor,
                                @Value("${app.versions.default-keep-count:10}") int defaultKeepCount) {
        this.resumeService = resumeService;
        this.resumeVersionRepository = resumeVersionRepository;
        this.contentDiffer = contentDiffer;
        this.writeExecutor = writeExecutor;
        this.defaultKeepCount = defaultKeepCount;
    }

    public ResumeVersion createVersion(String resumeId, String userId, String versionName, String changesSummary) {
        return writeExecutor.execute("createVersion", () -> {
            Resume resume = resumeService.getForUpdate(resumeId, userId);
            return snapshot(resume, userId, versionName, changesSummary);
        });
    }

    @Transactional(readOnly = true)
    public List<ResumeVersion> listVersions(String resumeId, String userId) {
        resumeService.get(resumeId, userId);
        return resumeVersionRepository.findByResumeIdAndUserIdOrderByVersionNumberDesc(resumeId, userId);
    }

    @Transactional(readOnly = true)
    public ResumeVersion getVersion(String resumeId, String versionId, String userId) {
        resumeService.get(resumeId, userId);
        return findVersion(resumeId, versionId, userId);
    }

    @Transactional(readOnly = true)
    public Optional<Integer> getLatestVersionNumber(String resumeId, String userId) {
        resumeService.get(resumeId, userId);
        return resumeVersionRepository.findMaxVersionNumber(resumeId);
    }

    /**
     * Snapshots the current state, then overwrites the resume with the target version.
     * Both steps commit together or not at all.
     */
    public RestoreResult restoreVersion(String resumeId, String versionId, String userId) {
        return writeExecutor.execute("restoreVersion", () -> {
            Resume resume = resumeService.getForUpdate(resumeId, userId);
            ResumeVersion target = findVersion(resume.getId(), versionId, userId);

            ResumeVersion safetySnapshot = snapshot(resume, userId, RESTORE_VERSION_NAME,
                    "Restoring to version " + target.getVersionNumber());
            resumeService.updateContent(resume, target.getContent().deepCopy(), target.getTemplateId());

            log.info("Restored resume {} to version {} (pre-restore state saved as version {})",
                    resumeId, target.getVersionNumber(), safetySnapshot.getVersionNumber());
            return new RestoreResult(resume, safetySnapshot, target);
        });
    }

    @Transactional(readOnly = true)
    public VersionComparison compareVersions(String resumeId, String versionId1, String versionId2, String userId) {
        resumeService.get(resumeId, userId);
        ResumeVersion first = findVersion(resumeId, versionId1, userId);
        ResumeVersion second = findVersion(resumeId, versionId2, userId);

        List<ResumeVersion> ordered = Stream.of(first, second)
                .sorted(Comparator.comparingInt(ResumeVersion::getVersionNumber))
                .toList();
        ResumeVersion oldVersion = ordered.get(0);
        ResumeVersion newVersion = ordered.get(1);

        VersionDiff diff = contentDiffer.diff(oldVersion.getContent(), newVersion.getContent());
        return new VersionComparison(oldVersion, newVersion, diff);
    }

    /**
     * Diffs a stored version (old side) against the resume's live content (new side).
     */
    @Transactional(readOnly = true)
    public VersionDiff compareWithCurrent(String resumeId, String versionId, String userId) {
        Resume resume = resumeService.get(resumeId, userId);
        ResumeVersion version = findVersion(resumeId, versionId, userId);
        return contentDiffer.diff(version.getContent(), resume.getContent());
    }

    public void deleteVersion(String resumeId, String versionId, String userId) {
        writeExecutor.run("deleteVersion", () -> {
            Resume resume = resumeService.getForUpdate(resumeId, userId);
            ResumeVersion version = findVersion(resume.getId(), versionId, userId);

            long remaining = resumeService.countSnapshots(resume.getId());
            if (remaining <= 1) {
                log.warn("Refused to delete version {} of resume {}: it is the only version", versionId, resumeId);
                throw new InvalidOperationException("LAST_VERSION", "Cannot delete the only version");
            }
            resumeVersionRepository.delete(version);
            log.info("Deleted version {} of resume {}", version.getVersionNumber(), resumeId);
        });
    }

    public int deleteOldVersions(String resumeId, String userId) {
        return deleteOldVersions(resumeId, userId, defaultKeepCount);
    }

    /**
     * Keeps the {@code keepCount} newest versions and deletes the rest in one statement.
     *
     * @return number of versions deleted
     */
    public int deleteOldVersions(String resumeId, String userId, int keepCount) {
        if (keepCount < 1) {
            throw new InvalidOperationException("INVALID_KEEP_COUNT", "keepCount must be at least 1");
        }
        return writeExecutor.execute("deleteOldVersions", () -> {
            Resume resume = resumeService.getForUpdate(resumeId, userId);
            List<String> newestFirst = resumeVersionRepository.findIdsByResumeIdNewestFirst(resume.getId());
            if (newestFirst.size() <= keepCount) {
                return 0;
            }
            List<String> expired = newestFirst.subList(keepCount, newestFirst.size());
            int deleted = resumeVersionRepository.deleteByIdIn(expired);
            log.info("Pruned {} old versions of resume {} (kept {})", deleted, resumeId, keepCount);
            return deleted;
        });
    }

    // Callers must have already checked that the resume is live and owned by userId.
    private ResumeVersion findVersion(String resumeId, String versionId, String userId) {
        return resumeVersionRepository.findByIdAndResumeIdAndUserId(versionId, resumeId, userId)
                .orElseThrow(NotFoundException::version);
    }

    private ResumeVersion snapshot(Resume lockedResume, String userId, String versionName, String changesSummary) {
        int versionNumber = lockedResume.allocateVersionNumber();
        String name = versionName != null && !versionName.isBlank() ? versionName : "Version " + versionNumber;
        ResumeVersion version = new ResumeVersion(lockedResume, versionNumber, name, changesSummary, userId);
        version = resumeVersionRepository.saveAndFlush(version);
        log.info("Created version {} of resume {}", versionNumber, lockedResume.getId());
        return version;
    }
}
