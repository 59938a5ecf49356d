package com.alertengine.api.controller;

import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Shallow health check, also the default target of the health probe.
 * Always returns 200 if the application is running; subsystems are not checked.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
