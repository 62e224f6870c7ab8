package com.resumebuilder.backend.dto;

import com.resumebuilder.backend.service.ResumeVersionService.RestoreResult;

public record RestoreVersionResponse(
        String message,
        ResumeDto resume,
        ResumeVersionDto safetySnapshot,
        int restoredVersionNumber
) {
    public static RestoreVersionResponse from(RestoreResult result) {
        return new RestoreVersionResponse(
                "Version restored successfully",
                ResumeDto.fromEntity(result.resume()),
                ResumeVersionDto.fromEntity(result.safetySnapshot()),
                result.restoredFrom().getVersionNumber()
        );
    }
}
