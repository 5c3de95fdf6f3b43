package com.clausescan.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final CatalogHealthIndicator catalogHealthIndicator;

    public HealthController(CatalogHealthIndicator catalogHealthIndicator) {
        this.catalogHealthIndicator = catalogHealthIndicator;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Health catalogHealth = catalogHealthIndicator.health();

        Map<String, Object> response = new HashMap<>();
        response.put("status", catalogHealth.getStatus().getCode());
        response.put("timestamp", Instant.now().toString());

        Map<String, Object> checks = new HashMap<>();
        checks.put("catalog", catalogHealth.getDetails().getOrDefault("catalog", "UNKNOWN"));
        checks.put("catalogVersion", catalogHealth.getDetails().get("version"));
        response.put("checks", checks);

        HttpStatus status = Status.UP.equals(catalogHealth.getStatus()) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }
}
