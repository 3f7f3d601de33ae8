package com.example.armoriqadmin.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Failure of a forwarded call. Carries the status the admin API answers with and the JSON detail
 * it returns as the response body.
 */
@Getter
public class UpstreamException extends RuntimeException {

    public enum Code {
        UNEXPECTED_STATUS,
        INVALID_JSON,
        UNREACHABLE,
        TIMEOUT
    }

    private final Code code;
    private final int status;
    private final JsonNode detail;

    private UpstreamException(Code code, int status, JsonNode detail, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
        this.detail = detail;
    }

    /**
     * The proxy answered with a status the route does not accept. The detail is republished to the
     * caller as-is, under the proxy's own status code.
     */
    public static UpstreamException unexpectedStatus(ProxyRoute route, int status, JsonNode detail) {
        return new UpstreamException(Code.UNEXPECTED_STATUS, status, detail,
                "Proxy answered " + route + " with status " + status, null);
    }

    public static UpstreamException invalidJson(ProxyRoute route, Throwable cause) {
        return invalidJson(route, cause.getMessage(), cause);
    }

    public static UpstreamException invalidJson(ProxyRoute route, String details, Throwable cause) {
        return new UpstreamException(Code.INVALID_JSON, HttpStatus.INTERNAL_SERVER_ERROR.value(),
                errorDetail("Invalid JSON from proxy", details),
                "Proxy returned malformed JSON for " + route, cause);
    }

    public static UpstreamException unreachable(ProxyRoute route, Throwable cause) {
        return new UpstreamException(Code.UNREACHABLE, HttpStatus.BAD_GATEWAY.value(),
                errorDetail("Proxy unreachable", cause.getMessage()),
                "Proxy could not be reached for " + route, cause);
    }

    public static UpstreamException timeout(ProxyRoute route, Throwable cause) {
        return new UpstreamException(Code.TIMEOUT, HttpStatus.GATEWAY_TIMEOUT.value(),
                errorDetail("Proxy request timed out", cause.getMessage()),
                "Proxy did not answer " + route + " in time", cause);
    }

    private static ObjectNode errorDetail(String error, String details) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("error", error);
        node.put("details", details);
        return node;
    }
}
