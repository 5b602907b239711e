package com.ai.storeassistant.controller;

import com.ai.storeassistant.exception.ConversationValidationException;
import com.ai.storeassistant.exception.SessionPersistenceException;
import com.ai.storeassistant.exception.TurnAbortedException;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine failures to HTTP. Persistence problems never leak details to the visitor.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String GENERIC_ERROR = "Something went wrong, please try again.";

    @ExceptionHandler({ConversationValidationException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={} method={} errorType={} errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex.getMessage());
        String message = ex instanceof ConversationValidationException ? ex.getMessage() : "Malformed request body";
        return body(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(SessionPersistenceException.class)
    public ResponseEntity<Map<String, Object>> handlePersistence(SessionPersistenceException ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={} method={} session={} errorType={}",
                request.getRequestURI(), request.getMethod(), ex.getSessionId(), ex.getClass().getSimpleName(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_ERROR);
    }

    @ExceptionHandler(TurnAbortedException.class)
    public ResponseEntity<Map<String, Object>> handleAborted(TurnAbortedException ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={} method={} errorType={} errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, GENERIC_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse) {
            return handleFrameworkError((ErrorResponse) ex, ex, request);
        }
        log.error("HTTP_ERROR path={} method={} errorType={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_ERROR);
    }

    // unsupported media type, wrong method, unknown path and the like keep their own status
    private ResponseEntity<Map<String, Object>> handleFrameworkError(ErrorResponse error, Exception ex,
                                                                     HttpServletRequest request) {
        HttpStatusCode status = error.getStatusCode();
        log.warn("HTTP_ERROR path={} method={} status={} errorType={} errorMessage={}",
                request.getRequestURI(), request.getMethod(), status.value(),
                ex.getClass().getSimpleName(), ex.getMessage());
        String detail = error.getBody().getDetail();
        return body(status, error.getHeaders(), StringUtils.defaultIfBlank(detail, GENERIC_ERROR));
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatusCode status, String error) {
        return body(status, HttpHeaders.EMPTY, error);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatusCode status, HttpHeaders headers, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        return ResponseEntity.status(status).headers(headers).body(body);
    }
}
