package com.robobracket.web;

import com.robobracket.engine.AlreadyCompletedException;
import com.robobracket.engine.BracketEngineException;
import com.robobracket.engine.CycleDetectedException;
import com.robobracket.engine.GameNotFoundException;
import com.robobracket.engine.GameNotReadyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns rejected bracket and seeding requests into JSON error bodies: engine errors carry their stable code,
 * bean-validation failures list one message per offending field.
 */
@RestControllerAdvice
public class BracketEngineExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BracketEngineExceptionHandler.class);

    @ExceptionHandler(BracketEngineException.class)
    public ResponseEntity<BracketEngineErrorResponse> handle(BracketEngineException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("Bracket engine failure [{}]: {}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.debug("Rejected bracket operation [{}]: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity
                .status(status)
                .body(new BracketEngineErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleInvalidRequest(MethodArgumentNotValidException ex) {
        Map<String, String> messages = new LinkedHashMap<>();
        for (ObjectError error : ex.getBindingResult().getAllErrors()) {
            String key = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            messages.putIfAbsent(key, error.getDefaultMessage());
        }
        log.debug("Rejected invalid request: {}", messages);

        String detail = messages.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", messages.values());
        return ResponseEntity.badRequest().body(new ValidationErrorResponse(detail, messages));
    }

    static HttpStatus statusFor(BracketEngineException ex) {
        if (ex instanceof GameNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof AlreadyCompletedException || ex instanceof GameNotReadyException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof CycleDetectedException) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.BAD_REQUEST;
    }

    public record BracketEngineErrorResponse(
            String code,
            String message
    ) {
    }

    public record ValidationErrorResponse(
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
