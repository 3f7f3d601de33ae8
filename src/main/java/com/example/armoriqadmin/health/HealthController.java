package com.example.armoriqadmin.health;

import com.example.armoriqadmin.config.ProxyProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness of the admin API itself. Answers without contacting the proxy; /status reports the
 * proxy's health.
 */
@RestController
public class HealthController {

    private final BuildProperties buildProperties;
    private final ProxyProperties proxyProperties;
    private final String env;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            ProxyProperties proxyProperties) {
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
        this.proxyProperties = proxyProperties;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "ts", Instant.now().toString(),
                "env", env,
                "app", buildProperties != null ? buildProperties.getName() : "armoriq-admin",
                "version", buildProperties != null ? buildProperties.getVersion() : "dev",
                "proxyUrl", proxyProperties.normalizedUrl()
        ));
    }
}
