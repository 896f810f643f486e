package com.storyforge.orchestrator.api;

import com.storyforge.orchestrator.api.dto.ErrorResponse;
import com.storyforge.orchestrator.error.ErrorCode;
import com.storyforge.orchestrator.error.NotFoundException;
import com.storyforge.orchestrator.error.OrchestratorException;
import com.storyforge.orchestrator.error.StateConflictException;
import com.storyforge.orchestrator.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps the orchestrator's exceptions to {error, code} bodies.
 *
 * 400 validation, 404 missing project, stage or template, 409 state
 * conflict, 500 everything else (code 5000 when the exception is not one
 * of ours).
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<ErrorResponse> handle(OrchestratorException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("Request failed [{}]: {}", e.getCode(), e.getMessage(), e);
        } else {
            log.info("Request rejected [{}]: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getMessage(), e.getCode().code()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("Malformed request: " + e.getMessage(), ErrorCode.DATA_VALIDATION_FAILED.code()));
    }

    /** Anything that escaped the service layer unclassified: a database outage, a bug. */
    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> unexpected(RuntimeException e) {
        log.error("Unhandled error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal error", ErrorCode.SYSTEM_ERROR.code()));
    }

    private static HttpStatus statusOf(OrchestratorException e) {
        if (e instanceof ValidationException)    return HttpStatus.BAD_REQUEST;
        if (e instanceof NotFoundException)      return HttpStatus.NOT_FOUND;
        if (e instanceof StateConflictException) return HttpStatus.CONFLICT;
        if (e.getCode() == ErrorCode.DATA_VALIDATION_FAILED) return HttpStatus.BAD_REQUEST;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
