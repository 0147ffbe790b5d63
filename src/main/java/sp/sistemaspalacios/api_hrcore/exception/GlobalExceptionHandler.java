package sp.sistemaspalacios.api_hrcore.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import sp.sistemaspalacios.api_hrcore.dto.common.ApiErrorResponse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ====== Not found ======
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(ResourceNotFoundException ex) {
        logger.warn("Resource not found ({}): {}", ex.getResourceType(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.of("not-found",
                "Resource Not Found", HttpStatus.NOT_FOUND.value(), ex.getMessage());
        return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
    }

    // ====== Conflict ======
    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiErrorResponse> handleConflict(ConflictException ex) {
        logger.warn("Conflict on {}: {}", ex.getField(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.of("conflict",
                "Conflict", HttpStatus.CONFLICT.value(), ex.getMessage());
        body.setErrors(Map.of(ex.getField(), List.of(ex.getMessage())));
        return new ResponseEntity<>(body, HttpStatus.CONFLICT);
    }

    // ====== Concurrent update of a versioned row ======
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiErrorResponse> handleOptimisticLock(OptimisticLockingFailureException ex) {
        logger.warn("Concurrent modification: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.of("conflict",
                "Conflict", HttpStatus.CONFLICT.value(),
                "The record was modified by another request. Please retry.");
        return new ResponseEntity<>(body, HttpStatus.CONFLICT);
    }

    // ====== Business validation ======
    @ExceptionHandler(BusinessValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(BusinessValidationException ex) {
        logger.warn("Validation error: {}", ex.getErrors());
        ApiErrorResponse body = ApiErrorResponse.of("validation-error",
                "Validation Error", HttpStatus.UNPROCESSABLE_ENTITY.value(), ex.getMessage());
        body.setErrors(ex.getErrors());
        return new ResponseEntity<>(body, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    // ====== Forbidden ======
    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ApiErrorResponse> handleForbidden(ForbiddenException ex) {
        logger.warn("Forbidden: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.of("forbidden",
                "Forbidden", HttpStatus.FORBIDDEN.value(), ex.getMessage());
        return new ResponseEntity<>(body, HttpStatus.FORBIDDEN);
    }

    // ====== Request body validation (@Valid) ======
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.computeIfAbsent(error.getField(), k -> new ArrayList<>())
                        .add(error.getDefaultMessage()));

        ApiErrorResponse body = ApiErrorResponse.of("bad-request",
                "Request validation failed", HttpStatus.BAD_REQUEST.value(),
                "One or more fields are invalid.");
        body.setErrors(errors);
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    // ====== Malformed JSON / missing actor header / bad query values ======
    @ExceptionHandler({HttpMessageNotReadableException.class, MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
        logger.warn("Bad request: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.of("bad-request",
                "Bad Request", HttpStatus.BAD_REQUEST.value(), ex.getMessage());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    // ====== Everything else ======
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneralException(Exception ex) {
        logger.error("Unhandled exception: ", ex);
        ApiErrorResponse body = ApiErrorResponse.of("internal-error",
                "Internal Server Error", HttpStatus.INTERNAL_SERVER_ERROR.value(),
                ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred");
        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
