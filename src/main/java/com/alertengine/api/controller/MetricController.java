package com.alertengine.api.controller;

import com.alertengine.api.dto.request.RecordMetricRequest;
import com.alertengine.api.dto.response.MetricSampleResponse;
import com.alertengine.engine.MetricRecorder;
import com.alertengine.mapper.AlertDtoMapper;
import com.alertengine.metric.MetricStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for metric ingestion and inspection.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/metrics} -- record one sample (202, evaluation runs inline)</li>
 *   <li>{@code GET /api/metrics} -- names of all metrics with history</li>
 *   <li>{@code GET /api/metrics/{name}?windowSeconds=} -- samples of one metric, optionally windowed</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/metrics")
@Validated
public class MetricController {

    private final MetricRecorder metricRecorder;
    private final MetricStore metricStore;
    private final Clock clock;
    private final AlertDtoMapper alertDtoMapper = Mappers.getMapper(AlertDtoMapper.class);

    public MetricController(MetricRecorder metricRecorder, MetricStore metricStore, Clock clock) {
        this.metricRecorder = metricRecorder;
        this.metricStore = metricStore;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> recordMetric(@Valid @RequestBody RecordMetricRequest request) {
        metricRecorder.recordMetric(request.getName(), request.getValue());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("metric", request.getName(), "accepted", true));
    }

    @GetMapping
    public Set<String> getMetricNames() {
        return metricStore.metricNames();
    }

    @GetMapping("/{name}")
    public List<MetricSampleResponse> getSamples(
            @PathVariable String name, @RequestParam(required = false) @Min(1) Long windowSeconds) {
        Instant since = windowSeconds != null ? clock.instant().minusSeconds(windowSeconds) : Instant.MIN;
        return alertDtoMapper.toSampleResponseList(metricStore.samplesInWindow(name, since));
    }
}
