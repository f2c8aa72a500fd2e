package com.secretnotes.config;

import com.secretnotes.exception.ErrorKind;
import com.secretnotes.exception.NoteException;
import com.secretnotes.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps note errors onto HTTP responses. The core itself knows nothing about status codes.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(NoteException.class)
    public ResponseEntity<Map<String, Object>> handleNoteException(NoteException ex) {
        log.debug("Rejected request: {} - {}", ex.getKind(), ex.getMessage());
        return error(statusFor(ex.getKind()), ex.getKind().name(), ex.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorageException(StorageException ex) {
        log.warn("Store unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", "Redis unreachable");
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.debug("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        // Spring's own MVC exceptions (unknown route, wrong method, ...) keep their status
        if (ex instanceof ErrorResponse) {
            HttpStatus status = HttpStatus.valueOf(((ErrorResponse) ex).getStatusCode().value());
            return error(status, status.name(), status.getReasonPhrase());
        }
        log.error("Unexpected exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "UNKNOWN_ERROR", "An unexpected error occurred");
    }

    static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case PAYLOAD_TOO_LARGE:
                return HttpStatus.PAYLOAD_TOO_LARGE;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case RATE_LIMITED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case INVALID_META:
            case INVALID_POLICY:
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String type, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", type);
        response.put("detail", message);
        return ResponseEntity.status(status).body(response);
    }
}
