package com.registry.api.rest;

import com.registry.api.security.CapabilityDeniedException;
import com.registry.api.security.UnauthenticatedException;
import com.registry.core.exception.DuplicateBusinessKeyException;
import com.registry.core.exception.DuplicateCodeException;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.OptimisticLockException;
import com.registry.core.exception.RegistryException;
import com.registry.core.exception.ValidationFailedException;
import com.registry.core.schema.SchemaViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps registry errors to HTTP responses with body {@code {error, message, violations?}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String BAD_REQUEST = "BAD_REQUEST";
    private static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<Map<String, Object>> handleRegistry(RegistryException e) {
        HttpStatus status = statusOf(e);
        log.debug("Request failed with {}: {}", e.getErrorCode(), e.getMessage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getErrorCode());
        body.put("message", e.getMessage());
        if (e instanceof ValidationFailedException validation) {
            body.put("violations", violations(validation.getViolations()));
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception e) {
        log.debug("Rejected malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
            "error", BAD_REQUEST,
            "message", rootMessage(e)
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse framework) {
            // Spring MVC's own rejections (unknown route, wrong method, missing parameter)
            HttpStatusCode status = framework.getStatusCode();
            HttpStatus known = HttpStatus.resolve(status.value());
            return ResponseEntity.status(status).body(Map.of(
                "error", known != null ? known.name() : String.valueOf(status.value()),
                "message", String.valueOf(framework.getBody().getDetail())
            ));
        }
        log.error("Unexpected error handling request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
            "error", INTERNAL_ERROR,
            "message", "An unexpected error occurred"
        ));
    }

    static HttpStatus statusOf(RegistryException e) {
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof DuplicateCodeException
                || e instanceof DuplicateBusinessKeyException
                || e instanceof OptimisticLockException
                || e instanceof DefinitionInUseException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof CapabilityDeniedException) {
            return HttpStatus.FORBIDDEN;
        }
        if (e instanceof UnauthenticatedException) {
            return HttpStatus.UNAUTHORIZED;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static List<Map<String, String>> violations(List<SchemaViolation> violations) {
        return violations.stream()
            .map(v -> Map.of("field", v.field(), "constraint", v.constraint(), "message", v.message()))
            .toList();
    }

    /**
     * Jackson wraps enum and creator failures; the innermost message names the bad value.
     */
    private static String rootMessage(Exception e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : e.getClass().getSimpleName();
    }
}
