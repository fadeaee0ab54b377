package com.bank.p2pfraud.controller;

import com.bank.p2pfraud.exception.AlreadyResolvedException;
import com.bank.p2pfraud.exception.CaseNotAssignableException;
import com.bank.p2pfraud.exception.DuplicateCaseException;
import com.bank.p2pfraud.exception.FraudWorkflowException;
import com.bank.p2pfraud.exception.InsufficientFundsException;
import com.bank.p2pfraud.exception.InvalidTransitionException;
import com.bank.p2pfraud.exception.LedgerConflictException;
import com.bank.p2pfraud.exception.NotFoundException;
import com.bank.p2pfraud.exception.UnauthorizedOperationException;
import com.bank.p2pfraud.exception.ValidationException;
import com.bank.p2pfraud.model.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps workflow exceptions to {@link ApiError} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleMalformed(Exception e, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, e.getMessage(), request);
    }

    @ExceptionHandler(UnauthorizedOperationException.class)
    public ResponseEntity<ApiError> handleUnauthorized(UnauthorizedOperationException e, HttpServletRequest request) {
        return build(HttpStatus.FORBIDDEN, e.getMessage(), request);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ApiError> handleInsufficientFunds(InsufficientFundsException e, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), request);
    }

    @ExceptionHandler({DuplicateCaseException.class, AlreadyResolvedException.class,
            CaseNotAssignableException.class, InvalidTransitionException.class, LedgerConflictException.class})
    public ResponseEntity<ApiError> handleConflict(FraudWorkflowException e, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, e.getMessage(), request);
    }

    @ExceptionHandler(FraudWorkflowException.class)
    public ResponseEntity<ApiError> handleUnexpected(FraudWorkflowException e, HttpServletRequest request) {
        log.error("Unhandled workflow failure on {}: {}", request.getRequestURI(), e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), request);
    }

    private static ResponseEntity<ApiError> build(HttpStatus status, String message, HttpServletRequest request) {
        ApiError body = new ApiError(status.value(), status.getReasonPhrase(), message,
                request.getRequestURI(), System.currentTimeMillis());
        return ResponseEntity.status(status).body(body);
    }
}
