package com.resumebuilder.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.resumebuilder.backend.filter.RequestIdFilter;
import org.slf4j.MDC;

/**
 * Error body returned by every failed request. {@code requestId} matches the X-Request-Id header
 * and the id printed in the server log for that request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String code, String message, String requestId) {

    public static ApiError of(String code, String message) {
        return new ApiError(code, message, MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
    }
}
