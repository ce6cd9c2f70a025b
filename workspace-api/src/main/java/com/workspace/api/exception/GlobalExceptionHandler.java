package com.workspace.api.exception;

import com.workspace.api.dto.response.ErrorResponse;
import com.workspace.common.exception.BackendException;
import com.workspace.core.export.GuideExportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BackendException.class)
    public ResponseEntity<ErrorResponse> handleBackendException(BackendException ex, WebRequest request) {
        log.error("Backend call failed: backend={}, status={}, error={}",
            ex.getBackend(), ex.getStatusCode(), ex.getMessage());

        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("A backend service failed")
            .error(ex.getMessage())
            .status(HttpStatus.BAD_GATEWAY.value())
            .backend(ex.getBackend())
            .timestamp(Instant.now())
            .path(pathOf(request))
            .build();

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(errorResponse);
    }

    @ExceptionHandler(GuideExportException.class)
    public ResponseEntity<ErrorResponse> handleExportException(GuideExportException ex, WebRequest request) {
        log.error("Study guide export failed", ex);

        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("Failed to save study guide")
            .error(ex.getMessage())
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .timestamp(Instant.now())
            .path(pathOf(request))
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.append(fieldName).append(": ").append(error.getDefaultMessage()).append("; ");
        });

        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("Validation failed")
            .error(errors.toString())
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(pathOf(request))
            .build();

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("Malformed request body")
            .error(ex.getMostSpecificCause().getMessage())
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(pathOf(request))
            .build();

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("Invalid request parameter")
            .error(ex.getName() + ": cannot convert '" + ex.getValue() + "'")
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(pathOf(request))
            .build();

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        log.error("Unexpected error", ex);

        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("An unexpected error occurred")
            .error(ex.getMessage())
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .timestamp(Instant.now())
            .path(pathOf(request))
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private static String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
