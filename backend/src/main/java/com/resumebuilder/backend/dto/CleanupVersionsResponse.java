package com.resumebuilder.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CleanupVersionsResponse {
    private String message;
    private int deletedCount;
}
