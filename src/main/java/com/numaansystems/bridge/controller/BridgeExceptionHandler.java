package com.numaansystems.bridge.controller;

import com.numaansystems.bridge.service.InvalidCorrelationIdException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps request failures to the HTML error page. The user reading it is in a
 * browser, so no JSON and no internal detail is ever returned.
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestControllerAdvice
public class BridgeExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(BridgeExceptionHandler.class);

    private final BridgePages pages;

    public BridgeExceptionHandler(BridgePages pages) {
        this.pages = pages;
    }

    @ExceptionHandler(InvalidCorrelationIdException.class)
    public ResponseEntity<String> handleInvalidId(InvalidCorrelationIdException ex) {
        logger.warn("Bad request: {}", ex.getMessage());
        return page(HttpStatus.BAD_REQUEST, "Invalid sign-in link", ex.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<String> handleMissingParameter(MissingServletRequestParameterException ex) {
        logger.warn("Bad request: {}", ex.getMessage());
        return page(HttpStatus.BAD_REQUEST, "Invalid sign-in link",
                "Missing parameter " + ex.getParameterName() + ".");
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<String> handleFrameworkError(Exception ex) {
        HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
        logger.debug("Request rejected with {}: {}", status.value(), ex.getMessage());
        return page(status, "Not available", "This page does not exist.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleGeneric(Exception ex) {
        logger.error("Internal server error", ex);
        return page(HttpStatus.INTERNAL_SERVER_ERROR, "Something went wrong",
                "The sign-in could not be completed. Close this tab and try again from the launcher.");
    }

    private ResponseEntity<String> page(HttpStatusCode status, String title, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_HTML)
                .body(pages.error(title, message));
    }
}
