package com.alertengine.health;

import com.alertengine.engine.AlertEngineConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Reads health from an HTTP endpoint.
 *
 * <p>The database is considered healthy when the JSON body reports {@code "database"} as
 * {@code healthy} or {@code UP}; when the body has no such field, a 2xx answer counts as
 * healthy. An {@code ai_success_rate} number in the body is passed through.
 */
@Component
public class HttpHealthSignal implements HealthSignal {

    private static final ParameterizedTypeReference<Map<String, Object>> BODY_TYPE = new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final AlertEngineConfig alertEngineConfig;
    private final Clock clock;

    public HttpHealthSignal(
            @Qualifier("healthProbeRestTemplate") RestTemplate restTemplate,
            AlertEngineConfig alertEngineConfig,
            Clock clock) {
        this.restTemplate = restTemplate;
        this.alertEngineConfig = alertEngineConfig;
        this.clock = clock;
    }

    @Override
    public HealthCheckResult check() {
        String url = alertEngineConfig.getHealthProbe().getUrl();
        Instant start = clock.instant();
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(url, HttpMethod.GET, null, BODY_TYPE);
        Duration latency = Duration.between(start, clock.instant());

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new RestClientException("Health endpoint " + url + " answered " + response.getStatusCode());
        }

        Map<String, Object> body = response.getBody() != null ? response.getBody() : Map.of();
        return HealthCheckResult.builder()
                .latency(latency)
                .databaseHealthy(isDatabaseHealthy(body))
                .aiSuccessRate(body.get("ai_success_rate") instanceof Number rate ? rate.doubleValue() : null)
                .build();
    }

    private static boolean isDatabaseHealthy(Map<String, Object> body) {
        Object database = body.get("database");
        if (database == null) {
            return true;
        }
        String status = database.toString();
        return "healthy".equalsIgnoreCase(status) || "UP".equalsIgnoreCase(status);
    }
}
