package com.resumebuilder.backend;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    public record HealthResponse(String status, String service) {}

    private final String serviceName;

    public HealthController(@Value("${spring.application.name:resume-backend}") String serviceName) {
        this.serviceName = serviceName;
    }

    @GetMapping("/api/health")
    public HealthResponse health() {
        return new HealthResponse("ok", serviceName);
    }
}
