package com.resumebuilder.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resumebuilder.backend.auth.AuthPrincipal;
import com.resumebuilder.backend.config.JwtAuthenticationEntryPoint;
import com.resumebuilder.backend.config.SecurityConfig;
import com.resumebuilder.backend.entity.Resume;
import com.resumebuilder.backend.entity.ResumeVersion;
import com.resumebuilder.backend.exception.InvalidOperationException;
import com.resumebuilder.backend.exception.NotFoundException;
import com.resumebuilder.backend.exception.VersionConflictException;
import com.resumebuilder.backend.service.ResumeVersionService;
import com.resumebuilder.backend.service.ResumeVersionService.RestoreResult;
import com.resumebuilder.backend.service.ResumeVersionService.VersionComparison;
import com.resumebuilder.backend.service.diff.VersionDiff;
import com.resumebuilder.backend.util.JwtProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ResumeVersionController.class)
@Import({SecurityConfig.class, JwtAuthenticationEntryPoint.class})
class ResumeVersionControllerTest {

    private static final String USER_ID = "user-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ResumeVersionService resumeVersionService;

    @MockBean
    private JwtProvider jwtProvider;

    private Resume resume;

    @BeforeEach
    void setUp() throws Exception {
        resume = new Resume(USER_ID, "Backend Engineer", null, "modern",
                objectMapper.readTree("{\"summary\":\"hello\"}"));
        ReflectionTestUtils.setField(resume, "id", "r1");
    }

    private RequestPostProcessor asUser() {
        var principal = AuthPrincipal.of(USER_ID, "ada@example.com", null);
        return authentication(new UsernamePasswordAuthenticationToken(principal, null, principal.authorities()));
    }

    private ResumeVersion version(String id, int number) {
        ResumeVersion version = new ResumeVersion(resume, number, "Version " + number, null, USER_ID);
        ReflectionTestUtils.setField(version, "id", id);
        return version;
    }

    @Test
    void createVersionReturnsCreatedSnapshot() throws Exception {
        when(resumeVersionService.createVersion("r1", USER_ID, "Draft", null)).thenReturn(version("v1", 1));

        mockMvc.perform(post("/api/resumes/r1/versions")
                        .with(asUser())
                        .contentType("application/json")
                        .content("{\"version_name\":\"Draft\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("v1"))
                .andExpect(jsonPath("$.version_number").value(1))
                .andExpect(jsonPath("$.content.summary").value("hello"));
    }

    @Test
    void createVersionWithoutBodyUsesDefaults() throws Exception {
        when(resumeVersionService.createVersion("r1", USER_ID, null, null)).thenReturn(version("v1", 1));

        mockMvc.perform(post("/api/resumes/r1/versions").with(asUser()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.version_name").value("Version 1"));
    }

    @Test
    void createVersionRejectsOverlongName() throws Exception {
        String longName = "x".repeat(256);

        mockMvc.perform(post("/api/resumes/r1/versions")
                        .with(asUser())
                        .contentType("application/json")
                        .content("{\"version_name\":\"" + longName + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.versionName").exists());

        verify(resumeVersionService, never()).createVersion(anyString(), anyString(), any(), any());
    }

    @Test
    void requestsWithoutCredentialsAreRejected() throws Exception {
        mockMvc.perform(get("/api/resumes/r1/versions"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_REQUIRED"));
    }

    @Test
    void listVersionsReturnsNewestFirst() throws Exception {
        when(resumeVersionService.listVersions("r1", USER_ID)).thenReturn(List.of(version("v2", 2), version("v1", 1)));

        mockMvc.perform(get("/api/resumes/r1/versions").with(asUser()))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$[0].version_number").value(2))
                .andExpect(jsonPath("$[1].version_number").value(1));
    }

    @Test
    void missingVersionMapsToNotFound() throws Exception {
        when(resumeVersionService.getVersion("r1", "nope", USER_ID)).thenThrow(NotFoundException.version());

        mockMvc.perform(get("/api/resumes/r1/versions/nope").with(asUser()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("VERSION_NOT_FOUND"))
                .andExpect(jsonPath("$.request_id").exists());
    }

    @Test
    void compareReturnsOrderedVersionsAndDiff() throws Exception {
        VersionDiff diff = new VersionDiff(List.of("projects"), List.of(), List.of("summary"));
        when(resumeVersionService.compareVersions("r1", "v2", "v1", USER_ID))
                .thenReturn(new VersionComparison(version("v1", 1), version("v2", 2), diff));

        mockMvc.perform(get("/api/resumes/r1/versions/compare")
                        .param("version1", "v2")
                        .param("version2", "v1")
                        .with(asUser()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.old_version.version_number").value(1))
                .andExpect(jsonPath("$.new_version.version_number").value(2))
                .andExpect(jsonPath("$.diff.added[0]").value("projects"))
                .andExpect(jsonPath("$.diff.modified[0]").value("summary"))
                .andExpect(jsonPath("$.diff.empty").doesNotExist());
    }

    @Test
    void compareRequiresBothVersions() throws Exception {
        mockMvc.perform(get("/api/resumes/r1/versions/compare").param("version1", "v1").with(asUser()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void restoreReturnsSafetySnapshot() throws Exception {
        when(resumeVersionService.restoreVersion("r1", "v1", USER_ID))
                .thenReturn(new RestoreResult(resume, version("v3", 3), version("v1", 1)));

        mockMvc.perform(post("/api/resumes/r1/versions/v1/restore").with(asUser()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Version restored successfully"))
                .andExpect(jsonPath("$.safety_snapshot.version_number").value(3))
                .andExpect(jsonPath("$.restored_version_number").value(1))
                .andExpect(jsonPath("$.resume.id").value("r1"));
    }

    @Test
    void deletingLastVersionIsABadRequest() throws Exception {
        doThrow(new InvalidOperationException("LAST_VERSION", "Cannot delete the only version"))
                .when(resumeVersionService).deleteVersion("r1", "v1", USER_ID);

        mockMvc.perform(delete("/api/resumes/r1/versions/v1").with(asUser()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("LAST_VERSION"));
    }

    @Test
    void deleteVersionReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/resumes/r1/versions/v1").with(asUser()))
                .andExpect(status().isNoContent());

        verify(resumeVersionService).deleteVersion("r1", "v1", USER_ID);
    }

    @Test
    void cleanupUsesConfiguredDefaultWhenKeepCountMissing() throws Exception {
        when(resumeVersionService.deleteOldVersions("r1", USER_ID)).thenReturn(2);

        mockMvc.perform(post("/api/resumes/r1/versions/cleanup")
                        .with(asUser())
                        .contentType("application/json")
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted_count").value(2))
                .andExpect(jsonPath("$.message").value("Deleted 2 old versions"));

        verify(resumeVersionService, never()).deleteOldVersions(anyString(), anyString(), anyInt());
    }

    @Test
    void cleanupPassesExplicitKeepCount() throws Exception {
        when(resumeVersionService.deleteOldVersions("r1", USER_ID, 1)).thenReturn(4);

        mockMvc.perform(post("/api/resumes/r1/versions/cleanup")
                        .with(asUser())
                        .contentType("application/json")
                        .content("{\"keep_count\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted_count").value(4));
    }

    @Test
    void cleanupRejectsInvalidKeepCount() throws Exception {
        when(resumeVersionService.deleteOldVersions(eq("r1"), eq(USER_ID), eq(0)))
                .thenThrow(new InvalidOperationException("INVALID_KEEP_COUNT", "keepCount must be at least 1"));

        mockMvc.perform(post("/api/resumes/r1/versions/cleanup")
                        .with(asUser())
                        .contentType("application/json")
                        .content("{\"keep_count\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_KEEP_COUNT"));
    }

    @Test
    void exhaustedRetriesMapToConflict() throws Exception {
        when(resumeVersionService.createVersion(eq("r1"), eq(USER_ID), isNull(), isNull()))
                .thenThrow(new VersionConflictException("Concurrent modification", new CannotAcquireLockException("busy")));

        mockMvc.perform(post("/api/resumes/r1/versions").with(asUser()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("VERSION_CONFLICT"));
    }

    @Test
    void latestVersionNumberIsReported() throws Exception {
        when(resumeVersionService.getLatestVersionNumber("r1", USER_ID)).thenReturn(Optional.of(7));

        mockMvc.perform(get("/api/resumes/r1/versions/latest").with(asUser()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.latest_version_number").value(7));

        verify(resumeVersionService, never()).getVersion(anyString(), anyString(), anyString());
    }

    @Test
    void latestVersionNumberIsNullWithoutVersions() throws Exception {
        when(resumeVersionService.getLatestVersionNumber("r1", USER_ID)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/resumes/r1/versions/latest").with(asUser()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.latest_version_number").isEmpty());
    }
}
