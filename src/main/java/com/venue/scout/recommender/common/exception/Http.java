package com.venue.scout.recommender.common.exception;

import com.venue.scout.recommender.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");
        if (r.isSuccess()) return ResponseEntity.ok(r.getData());

        String errorCode = r.getErrorCode();
        if (errorCode == null) {
            return ResponseEntity.badRequest().body(new ErrorResponse(null, r.getError(), r.getTimestamp()));
        }
        return ResponseEntity.status(statusOf(errorCode))
                .body(new ErrorResponse(errorCode, r.getError(), r.getTimestamp()));
    }

    static HttpStatus statusOf(String errorCode) {
        return switch (errorCode) {
            case "NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "INVALID_STATE" -> HttpStatus.CONFLICT;
            case "THROTTLED" -> HttpStatus.TOO_MANY_REQUESTS;
            case "ERR-DB-002", "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
            case "ERR-SRC-001", "ERR-SRC-002" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "ERR-SYS-002" -> HttpStatus.GATEWAY_TIMEOUT;
            case "ERR-REQ-002" -> HttpStatus.METHOD_NOT_ALLOWED;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    /**
     * Error body returned to clients.
     */
    public record ErrorResponse(String code, String message, Instant timestamp) {
    }
}
