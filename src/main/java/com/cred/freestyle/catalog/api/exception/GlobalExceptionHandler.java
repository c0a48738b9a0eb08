package com.cred.freestyle.catalog.api.exception;

import com.cred.freestyle.catalog.api.dto.ErrorResponse;
import com.cred.freestyle.catalog.exception.ConflictingRevisionException;
import com.cred.freestyle.catalog.exception.InvalidReferenceException;
import com.cred.freestyle.catalog.exception.NoDraftFoundException;
import com.cred.freestyle.catalog.exception.PropagationPartialFailureException;
import com.cred.freestyle.catalog.exception.ResourceNotFoundException;
import com.cred.freestyle.catalog.service.PropagationReport;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for the catalog API.
 * Converts catalog exceptions into the standard {@link ErrorResponse} envelope.
 *
 * @author Catalog Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND for unknown, deleted or never-published aggregates and revisions.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.NOT_FOUND,
                "Resource Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.withDetail("resourceType", ex.getResourceType());
        error.withDetail("resourceId", ex.getResourceId());

        return error.toResponseEntity();
    }

    /**
     * Handle NoDraftFoundException.
     * Returns 404 NOT FOUND when approving or reading a draft that does not exist.
     */
    @ExceptionHandler(NoDraftFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoDraftFoundException(
            NoDraftFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("No draft: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.NOT_FOUND,
                "No Draft Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.withDetail("family", ex.getFamily());
        error.withDetail("aggregateId", ex.getAggregateId());

        return error.toResponseEntity();
    }

    /**
     * Handle ConflictingRevisionException.
     * Returns 409 CONFLICT when a concurrent publish of the same aggregate won.
     */
    @ExceptionHandler(ConflictingRevisionException.class)
    public ResponseEntity<ErrorResponse> handleConflictingRevisionException(
            ConflictingRevisionException ex,
            HttpServletRequest request
    ) {
        logger.warn("Revision conflict: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT,
                "Conflicting Revision",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.withDetail("family", ex.getFamily());
        error.withDetail("aggregateId", ex.getAggregateId());

        return error.toResponseEntity();
    }

    /**
     * Handle InvalidReferenceException.
     * Returns 422 UNPROCESSABLE ENTITY when a child cannot be bound at publish time.
     */
    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReferenceException(
            InvalidReferenceException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid reference: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.UNPROCESSABLE_ENTITY,
                "Invalid Reference",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.withDetail("childFamily", ex.getChildFamily());
        error.withDetail("childId", ex.getChildId());

        return error.toResponseEntity();
    }

    /**
     * Handle PropagationPartialFailureException.
     * Returns 207 MULTI-STATUS: the write itself committed, some parents were not republished.
     */
    @ExceptionHandler(PropagationPartialFailureException.class)
    public ResponseEntity<ErrorResponse> handlePropagationPartialFailureException(
            PropagationPartialFailureException ex,
            HttpServletRequest request
    ) {
        logger.warn("Propagation partially failed: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.MULTI_STATUS,
                "Propagation Partially Failed",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.withDetail("family", ex.getFamily());
        error.withDetail("aggregateId", ex.getAggregateId());
        error.withDetail("committedRevision", ex.getCommittedRevision());

        PropagationReport report = ex.getReport();
        if (report != null) {
            List<Map<String, Object>> failures = new ArrayList<>();
            for (PropagationReport.Entry entry : report.getFailures()) {
                Map<String, Object> failure = new LinkedHashMap<>();
                failure.put("family", entry.getFamily());
                failure.put("aggregateId", entry.getAggregateId());
                failure.put("message", entry.getMessage());
                failures.add(failure);
            }
            error.withDetail("republished", report.getRepublished().size());
            error.withDetail("failures", failures);
        }

        return error.toResponseEntity();
    }

    /**
     * Handle AccessDeniedException.
     * Returns 403 FORBIDDEN for invisible aggregates and writes by non-owners.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.FORBIDDEN,
                "Access Denied",
                ex.getMessage(),
                request.getRequestURI()
        );

        return error.toResponseEntity();
    }

    /**
     * Handle IllegalStateException.
     * Returns 400 BAD REQUEST for general business rule violations.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalStateException(
            IllegalStateException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal state: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST,
                "Invalid Request",
                ex.getMessage(),
                request.getRequestURI()
        );

        return error.toResponseEntity();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                request.getRequestURI()
        );

        return error.toResponseEntity();
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed. Please check the field errors.",
                request.getRequestURI()
        );
        error.withDetail("fieldErrors", fieldErrors);

        return error.toResponseEntity();
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return error.toResponseEntity();
    }
}
