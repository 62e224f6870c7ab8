package com.resumebuilder.backend.dto;

import com.resumebuilder.backend.service.ResumeVersionService.VersionComparison;
import com.resumebuilder.backend.service.diff.VersionDiff;

public record VersionComparisonDto(ResumeVersionDto oldVersion, ResumeVersionDto newVersion, VersionDiff diff) {

    public static VersionComparisonDto from(VersionComparison comparison) {
        return new VersionComparisonDto(
                ResumeVersionDto.fromEntity(comparison.oldVersion()),
                ResumeVersionDto.fromEntity(comparison.newVersion()),
                comparison.diff()
        );
    }
}
