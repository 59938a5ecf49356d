package com.alertengine.api.controller;

import com.alertengine.api.dto.request.ManualAlertRequest;
import com.alertengine.api.dto.request.ResolveAlertRequest;
import com.alertengine.api.dto.request.SuppressAlertRequest;
import com.alertengine.api.dto.response.AlertResponse;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.AlertStatistics;
import com.alertengine.engine.AlertService;
import com.alertengine.mapper.AlertDtoMapper;
import jakarta.validation.Valid;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for alerts.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/alerts} -- all stored alerts</li>
 *   <li>{@code GET /api/alerts/active} -- unresolved, unsuppressed alerts</li>
 *   <li>{@code GET /api/alerts/history?from=&to=} -- alerts raised in a time range, newest first</li>
 *   <li>{@code GET /api/alerts/statistics} -- counts by state, category and severity</li>
 *   <li>{@code GET /api/alerts/{id}} -- one alert</li>
 *   <li>{@code POST /api/alerts/{id}/resolve} -- resolve; {@code resolved=false} if missing or already resolved</li>
 *   <li>{@code POST /api/alerts/{id}/suppress} -- hide from the active view for a while</li>
 *   <li>{@code POST /api/alerts/{id}/escalate} -- escalate now; {@code escalated=false} if not eligible</li>
 *   <li>{@code POST /api/alerts/manual} -- raise an alert by hand</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private final AlertService alertService;
    private final AlertDtoMapper alertDtoMapper = Mappers.getMapper(AlertDtoMapper.class);

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @GetMapping
    public List<AlertResponse> getAllAlerts() {
        return alertDtoMapper.toAlertResponseList(alertService.getAllAlerts());
    }

    @GetMapping("/active")
    public List<AlertResponse> getActiveAlerts() {
        return alertDtoMapper.toAlertResponseList(alertService.getActiveAlerts());
    }

    @GetMapping("/history")
    public List<AlertResponse> getAlertHistory(
            @RequestParam(required = false) Instant from, @RequestParam(required = false) Instant to) {
        return alertDtoMapper.toAlertResponseList(alertService.getAlertHistory(from, to));
    }

    @GetMapping("/statistics")
    public AlertStatistics getStatistics() {
        return alertService.getStatistics();
    }

    @GetMapping("/{id}")
    public AlertResponse getAlert(@PathVariable String id) {
        return alertDtoMapper.toResponse(alertService.getAlert(id));
    }

    @PostMapping("/{id}/resolve")
    public Map<String, Object> resolveAlert(
            @PathVariable String id, @RequestBody(required = false) ResolveAlertRequest request) {
        String resolvedBy = request != null ? request.getResolvedBy() : null;
        return Map.of("alertId", id, "resolved", alertService.resolveAlert(id, resolvedBy));
    }

    @PostMapping("/{id}/suppress")
    public Map<String, Object> suppressAlert(@PathVariable String id, @Valid @RequestBody SuppressAlertRequest request) {
        boolean suppressed = alertService.suppressAlert(
                id, Duration.ofMinutes(request.getDurationMinutes()), request.getReason());
        return Map.of("alertId", id, "suppressed", suppressed);
    }

    @PostMapping("/{id}/escalate")
    public Map<String, Object> escalateAlert(@PathVariable String id) {
        return Map.of("alertId", id, "escalated", alertService.escalateAlert(id));
    }

    @PostMapping("/manual")
    @ResponseStatus(HttpStatus.CREATED)
    public AlertResponse sendManualAlert(@Valid @RequestBody ManualAlertRequest request) {
        Alert alert = alertService.sendManualAlert(
                request.getType(), request.getMessage(), request.getSeverity(), request.getMetadata());
        return alertDtoMapper.toResponse(alert);
    }
}
