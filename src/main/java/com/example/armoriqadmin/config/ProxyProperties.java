package com.example.armoriqadmin.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for the upstream ArmorIQ proxy.
 * These values are bound from application.yml (armoriq.proxy.*), where the URL is taken from
 * the ARMORIQ_PROXY_URL environment variable when it is set.
 */
@Component
@ConfigurationProperties(prefix = "armoriq.proxy")
@Data
public class ProxyProperties {

    private String url = "http://localhost:5001";
    private Duration timeout = Duration.ofSeconds(10);

    /**
     * Base URL without a trailing slash, ready to have an upstream path appended.
     */
    public String normalizedUrl() {
        String value = url == null || url.isBlank() ? "http://localhost:5001" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
