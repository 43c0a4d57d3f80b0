package com.safepocket.anomaly.health;

import com.safepocket.anomaly.detector.DetectorRegistry;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness endpoint; also reports how many detectors are registered.
 */
@RestController
public class HealthzController {

    private final DetectorRegistry detectorRegistry;

    public HealthzController(DetectorRegistry detectorRegistry) {
        this.detectorRegistry = detectorRegistry;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        return Map.of("status", "UP", "detectors", detectorRegistry.size());
    }
}
