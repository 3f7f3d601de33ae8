package com.example.armoriqadmin.service;

import com.example.armoriqadmin.config.ProxyProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Forwards admin calls to the ArmorIQ proxy. Each call is one upstream round trip: the status is
 * checked against the route's expected codes, and the body is returned as parsed JSON, or empty
 * when the proxy sent no content.
 */
@Service
@Slf4j
public class ProxyGateway {

    private final RestTemplate restTemplate;
    private final ProxyProperties properties;
    private final ObjectReader jsonReader;

    public ProxyGateway(@Qualifier("proxyRestTemplate") RestTemplate restTemplate,
                        ProxyProperties properties,
                        ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Sends the request upstream.
     *
     * @return the decoded JSON body, or empty for a 204 or an empty body
     * @throws UpstreamException when the status is not expected, the body is not JSON, or the
     *         proxy cannot be reached in time
     */
    public Optional<JsonNode> forward(ProxyRequest request) {
        Objects.requireNonNull(request, "request");
        ProxyRoute route = request.route();
        URI uri = route.resolve(properties.normalizedUrl(), request.pathVariables());

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (request.body() != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }

        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.exchange(uri, route.method(),
                    new HttpEntity<>(request.body(), headers), byte[].class);
        } catch (ResourceAccessException ex) {
            log.warn("Proxy call {} {} failed: {}", route.method(), uri, ex.getMessage());
            throw isTimeout(ex) ? UpstreamException.timeout(route, ex) : UpstreamException.unreachable(route, ex);
        }

        int status = response.getStatusCode().value();
        byte[] content = response.getBody();

        if (!route.expects(status)) {
            log.warn("Proxy answered {} {} with {} (expected {})",
                    route.method(), uri, status, route.expectedStatuses());
            throw UpstreamException.unexpectedStatus(route, status, errorDetail(status, content));
        }

        if (status == HttpStatus.NO_CONTENT.value() || content == null || content.length == 0) {
            return Optional.empty();
        }

        JsonNode body;
        try {
            body = jsonReader.readTree(content);
        } catch (IOException ex) {
            throw UpstreamException.invalidJson(route, ex);
        }
        if (body == null || body.isMissingNode()) {
            throw UpstreamException.invalidJson(route, "No JSON value in " + content.length + "-byte body", null);
        }
        return Optional.of(body);
    }

    /**
     * The proxy's own error body when it is JSON; otherwise its raw text, or the reason phrase
     * when there is no text, wrapped as {@code {"error": ...}}.
     */
    private JsonNode errorDetail(int status, byte[] content) {
        if (content != null && content.length > 0) {
            try {
                JsonNode parsed = jsonReader.readTree(content);
                if (parsed != null && !parsed.isMissingNode()) {
                    return parsed;
                }
            } catch (IOException ex) {
                log.debug("Proxy error body for status {} is not JSON: {}", status, ex.getMessage());
            }
        }

        String text = content == null ? "" : new String(content, StandardCharsets.UTF_8);
        if (text.isEmpty()) {
            HttpStatus known = HttpStatus.resolve(status);
            text = known != null ? known.getReasonPhrase() : "HTTP " + status;
        }
        ObjectNode detail = JsonNodeFactory.instance.objectNode();
        detail.put("error", text);
        return detail;
    }

    private static boolean isTimeout(ResourceAccessException ex) {
        Throwable cause = ex.getCause();
        return cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException;
    }
}
