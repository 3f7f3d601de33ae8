package com.example.armoriqadmin.http;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

final class ProxyResponses {

    private ProxyResponses() {
    }

    /** Body-less response when the proxy sent no content. */
    static ResponseEntity<JsonNode> withStatus(HttpStatus status, Optional<JsonNode> body) {
        return body.map(json -> ResponseEntity.status(status).body(json))
                .orElseGet(() -> ResponseEntity.status(status).build());
    }

    static ResponseEntity<JsonNode> ok(Optional<JsonNode> body) {
        return withStatus(HttpStatus.OK, body);
    }
}
