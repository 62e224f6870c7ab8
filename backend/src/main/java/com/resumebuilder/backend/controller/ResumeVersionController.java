package com.resumebuilder.backend.controller;

import com.resumebuilder.backend.auth.AuthPrincipal;
import com.resumebuilder.backend.dto.CleanupVersionsRequest;
import com.resumebuilder.backend.dto.CleanupVersionsResponse;
import com.resumebuilder.backend.dto.CreateVersionRequest;
import com.resumebuilder.backend.dto.LatestVersionResponse;
import com.resumebuilder.backend.dto.RestoreVersionResponse;
import com.resumebuilder.backend.dto.ResumeVersionDto;
import com.resumebuilder.backend.dto.VersionComparisonDto;
import com.resumebuilder.backend.entity.ResumeVersion;
import com.resumebuilder.backend.service.ResumeVersionService;
import com.resumebuilder.backend.service.diff.VersionDiff;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/resumes/{resumeId}/versions")
@RequiredArgsConstructor
public class ResumeVersionController {

    private final ResumeVersionService resumeVersionService;

    @PostMapping
    public ResponseEntity<ResumeVersionDto> createVersion(@PathVariable String resumeId,
                                                          @Valid @RequestBody(required = false) CreateVersionRequest request,
                                                          @AuthenticationPrincipal AuthPrincipal principal) {
        String versionName = request != null ? request.versionName() : null;
        String changesSummary = request != null ? request.changesSummary() : null;
        ResumeVersion version = resumeVersionService.createVersion(resumeId, principal.id(), versionName, changesSummary);
        return new ResponseEntity<>(ResumeVersionDto.fromEntity(version), HttpStatus.CREATED);
    }

    @GetMapping
    public ResponseEntity<List<ResumeVersionDto>> listVersions(@PathVariable String resumeId,
                                                               @AuthenticationPrincipal AuthPrincipal principal) {
        List<ResumeVersionDto> versions = resumeVersionService.listVersions(resumeId, principal.id()).stream()
                .map(ResumeVersionDto::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(versions);
    }

    @GetMapping("/compare")
    public ResponseEntity<VersionComparisonDto> compareVersions(@PathVariable String resumeId,
                                                                @RequestParam("version1") String version1,
                                                                @RequestParam("version2") String version2,
                                                                @AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(VersionComparisonDto.from(
                resumeVersionService.compareVersions(resumeId, version1, version2, principal.id())));
    }

    @PostMapping("/cleanup")
    public ResponseEntity<CleanupVersionsResponse> deleteOldVersions(@PathVariable String resumeId,
                                                                     @RequestBody(required = false) CleanupVersionsRequest request,
                                                                     @AuthenticationPrincipal AuthPrincipal principal) {
        int deleted = request != null && request.keepCount() != null
                ? resumeVersionService.deleteOldVersions(resumeId, principal.id(), request.keepCount())
                : resumeVersionService.deleteOldVersions(resumeId, principal.id());
        return ResponseEntity.ok(new CleanupVersionsResponse("Deleted " + deleted + " old versions", deleted));
    }

    @GetMapping("/latest")
    public ResponseEntity<LatestVersionResponse> getLatestVersionNumber(@PathVariable String resumeId,
                                                                        @AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(new LatestVersionResponse(
                resumeVersionService.getLatestVersionNumber(resumeId, principal.id()).orElse(null)));
    }

    @GetMapping("/{versionId}")
    public ResponseEntity<ResumeVersionDto> getVersion(@PathVariable String resumeId,
                                                       @PathVariable String versionId,
                                                       @AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(ResumeVersionDto.fromEntity(
                resumeVersionService.getVersion(resumeId, versionId, principal.id())));
    }

    @GetMapping("/{versionId}/compare-current")
    public ResponseEntity<VersionDiff> compareWithCurrent(@PathVariable String resumeId,
                                                          @PathVariable String versionId,
                                                          @AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(resumeVersionService.compareWithCurrent(resumeId, versionId, principal.id()));
    }

    @PostMapping("/{versionId}/restore")
    public ResponseEntity<RestoreVersionResponse> restoreVersion(@PathVariable String resumeId,
                                                                 @PathVariable String versionId,
                                                                 @AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(RestoreVersionResponse.from(
                resumeVersionService.restoreVersion(resumeId, versionId, principal.id())));
    }

    @DeleteMapping("/{versionId}")
    public ResponseEntity<Void> deleteVersion(@PathVariable String resumeId,
                                              @PathVariable String versionId,
                                              @AuthenticationPrincipal AuthPrincipal principal) {
        resumeVersionService.deleteVersion(resumeId, versionId, principal.id());
        return ResponseEntity.noContent().build();
    }
}
