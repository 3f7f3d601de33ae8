package com.example.armoriqadmin.http;

import com.example.armoriqadmin.service.AdminRequestException;
import com.example.armoriqadmin.service.UpstreamException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<JsonNode> upstreamError(UpstreamException ex) {
        // Status and transport failures are already logged by the gateway.
        if (ex.getCode() == UpstreamException.Code.INVALID_JSON) {
            log.warn(ex.getMessage(), ex.getCause());
        } else {
            log.debug("Relaying upstream failure {} as {}", ex.getCode(), ex.getStatus());
        }
        return ResponseEntity.status(ex.getStatus()).body(ex.getDetail());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return badRequest(message.isEmpty() ? "Request body is invalid" : message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, AdminRequestException.class})
    public ResponseEntity<Map<String, Object>> unreadable(Exception ex) {
        return badRequest(ex.getMessage() != null ? ex.getMessage() : "Request is invalid");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            return ResponseEntity.status(status)
                    .body(Map.of("code", String.valueOf(status.value()), "message", String.valueOf(ex.getMessage())));
        }
        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("code", "INTERNAL_ERROR", "message", String.valueOf(ex.getMessage())));
    }

    private ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("code", "BAD_REQUEST", "message", message));
    }
}
