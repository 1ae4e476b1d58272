package com.quackhouse.server.web;

import com.quackhouse.runtime.EngineSession;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    public static final String SERVICE_NAME = "quackhouse-catalog";

    private final EngineSession session;

    public HealthController(EngineSession session) {
        this.session = session;
    }

    /** Reports liveness without constructing the engine. */
    @GetMapping("/health")
    public Map<String, String> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE_NAME);
        body.put("engine", session.isInitialized() ? "active" : "unknown");
        return body;
    }
}
