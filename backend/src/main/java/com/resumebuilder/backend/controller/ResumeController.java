package com.resumebuilder.backend.controller;

import com.resumebuilder.backend.auth.AuthPrincipal;
import com.resumebuilder.backend.dto.ResumeCreateRequest;
import com.resumebuilder.backend.dto.ResumeDto;
import com.resumebuilder.backend.dto.ResumeUpdateRequest;
import com.resumebuilder.backend.entity.Resume;
import com.resumebuilder.backend.service.ResumeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/resumes")
@RequiredArgsConstructor
public class ResumeController {

    private final ResumeService resumeService;

    @PostMapping
    public ResponseEntity<ResumeDto> createResume(@Valid @RequestBody ResumeCreateRequest request,
                                                  @AuthenticationPrincipal AuthPrincipal principal) {
        Resume resume = resumeService.create(principal.id(), request);
        return new ResponseEntity<>(ResumeDto.fromEntity(resume), HttpStatus.CREATED);
    }

    @GetMapping
    public ResponseEntity<List<ResumeDto>> getMyResumes(@AuthenticationPrincipal AuthPrincipal principal) {
        List<ResumeDto> resumes = resumeService.list(principal.id()).stream()
                .map(ResumeDto::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(resumes);
    }

    @GetMapping("/{resumeId}")
    public ResponseEntity<ResumeDto> getResume(@PathVariable String resumeId,
                                               @AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(ResumeDto.fromEntity(resumeService.get(resumeId, principal.id())));
    }

    @PutMapping("/{resumeId}")
    public ResponseEntity<ResumeDto> updateResume(@PathVariable String resumeId,
                                                  @Valid @RequestBody ResumeUpdateRequest request,
                                                  @AuthenticationPrincipal AuthPrincipal principal) {
        Resume resume = resumeService.update(resumeId, principal.id(), request);
        return ResponseEntity.ok(ResumeDto.fromEntity(resume));
    }

    @DeleteMapping("/{resumeId}")
    public ResponseEntity<Void> deleteResume(@PathVariable String resumeId,
                                             @AuthenticationPrincipal AuthPrincipal principal) {
        resumeService.delete(resumeId, principal.id());
        return ResponseEntity.noContent().build();
    }
}
