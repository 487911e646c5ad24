package com.homework.api.exception;

import com.homework.api.dto.response.ErrorResponse;
import com.homework.core.exception.DocumentBusyException;
import com.homework.core.exception.UnsupportedFileTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(DocumentBusyException.class)
    public ResponseEntity<ErrorResponse> handleDocumentBusy(DocumentBusyException ex, WebRequest request) {
        log.warn("Rejected concurrent run for {}", ex.getDocumentId());
        return build(HttpStatus.CONFLICT, "Document is already being processed", ex.getMessage(), request);
    }

    @ExceptionHandler(UnsupportedFileTypeException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedFileType(UnsupportedFileTypeException ex, WebRequest request) {
        log.warn("Unsupported file type: {}", ex.getFileType());
        return build(HttpStatus.BAD_REQUEST, "Unsupported file type", ex.getMessage(), request);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex, WebRequest request) {
        log.warn("Missing request part: {}", ex.getRequestPartName());
        String helpfulMessage = String.format(
            "Required part '%s' is not present. Send the document as multipart/form-data under the key '%s'.",
            ex.getRequestPartName(), ex.getRequestPartName());
        return build(HttpStatus.BAD_REQUEST, "File upload error", helpfulMessage, request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex, WebRequest request) {
        log.warn("Upload too large: {}", ex.getMessage());
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "File too large", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String error, WebRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .message(message)
            .error(error)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
        return ResponseEntity.status(status).body(errorResponse);
    }
}
