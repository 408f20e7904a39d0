package com.platform.kothak.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Converts Kothak exceptions raised by REST controllers into {@link ErrorResponse}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        log.warn("Resource not found: {} ({})", ex.getFamily().getDisplayName(), ex.getResourceName());
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ex.getErrorCode().getCode())
            .message(ex.getMessage())
            .fatal(false)
            .status(HttpStatus.NOT_FOUND.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .metadata(Map.of(
                "family", ex.getFamily().getMetricTag(),
                "name", ex.getResourceName()
            ))
            .build();
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(KothakException.class)
    public ResponseEntity<ErrorResponse> handleKothakException(
            KothakException ex, HttpServletRequest request) {
        
        HttpStatus status = mapErrorCodeToStatus(ex.getErrorCode());
        if (ex.isFatal()) {
            log.error("[{}] {}", ex.getErrorCode().getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {}", ex.getErrorCode().getCode(), ex.getMessage());
        }
        
        return ResponseEntity.status(status)
            .body(ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), status.value(), request.getRequestURI()));
    }
    
    private HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, PROVIDER_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFIGURATION_ERROR -> HttpStatus.BAD_REQUEST;
            case REDIS_ERROR, OBJECT_STORAGE_ERROR, CONNECT_FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
