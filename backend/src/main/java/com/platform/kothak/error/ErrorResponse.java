package com.platform.kothak.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by the resource API.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Error code (e.g., KT-300).
     */
    private String code;
    
    private String message;
    
    /**
     * Whether this error is fatal (requires intervention) or recoverable.
     */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    private String path;
    
    private Map<String, Object> metadata;
    
    public static ErrorResponse of(ErrorCode errorCode, String message, int status, String path) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status)
            .timestamp(Instant.now())
            .path(path)
            .build();
    }
}
