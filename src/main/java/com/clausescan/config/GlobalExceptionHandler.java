package com.clausescan.config;

import com.clausescan.api.UnsupportedDocumentException;
import com.clausescan.shared.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        // Framework exceptions (unknown route, wrong method, missing part) carry their own status
        if (ex instanceof org.springframework.web.ErrorResponse) {
            HttpStatusCode status = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
            return respond(status, ex.getClass().getSimpleName(), ex.getMessage());
        }
        logger.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.putIfAbsent(fieldName, error.getDefaultMessage());
        });

        ErrorResponse response = new ErrorResponse("ValidationError", "Validation failed", MDC.get("correlationId"));
        response.setErrors(errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "MalformedRequest", "Request body is missing or is not valid JSON");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSizeException(MaxUploadSizeExceededException ex) {
        return respond(HttpStatus.BAD_REQUEST, "FileSizeExceeded", "File size exceeds maximum allowed size");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "IllegalArgument", ex.getMessage());
    }

    @ExceptionHandler(UnsupportedDocumentException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedDocument(UnsupportedDocumentException ex) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UnsupportedDocument", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatusCode status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message, MDC.get("correlationId")));
    }
}
