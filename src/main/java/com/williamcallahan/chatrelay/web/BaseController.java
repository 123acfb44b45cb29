package com.williamcallahan.chatrelay.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Base controller class providing common response patterns.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles service exceptions with standardized error responses.
     *
     * @param e The exception that occurred
     * @param operation Description of the operation that failed
     * @return Standardized error response
     */
    protected ResponseEntity<ApiResponse> handleServiceException(Exception e, String operation) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + operation, e);
    }

    protected ResponseEntity<ApiResponse> errorResponse(HttpStatus status, String message) {
        return exceptionBuilder.buildErrorResponse(status, message);
    }

    protected ResponseEntity<ApiResponse> createSuccessResponse(String message) {
        return exceptionBuilder.buildSuccessResponse(message);
    }
}
