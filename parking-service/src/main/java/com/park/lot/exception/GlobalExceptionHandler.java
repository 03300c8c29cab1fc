package com.park.lot.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({LotFullException.class, AlreadyParkedException.class,
            DuplicatePlateException.class, InvalidTransitionException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(ParkingException ex) {
        return body(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler({NotParkedException.class, SpaceNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(ParkingException ex) {
        return body(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(LotBusyException.class)
    public ResponseEntity<Map<String, Object>> handleBusy(LotBusyException ex) {
        return body(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    @ExceptionHandler(SpaceStateException.class)
    public ResponseEntity<Map<String, Object>> handleBreach(SpaceStateException ex) {
        log.error("Space state invariant breached: {}", ex.getMessage());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", ex.getMessage(), null);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, ParkingException ex) {
        return body(status, ex.getErrorCode(), ex.getMessage(), ex.getPlateNumber());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message, String plate) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        if (plate != null) {
            body.put("plateNumber", plate);
        }
        return ResponseEntity.status(status).body(body);
    }
}
