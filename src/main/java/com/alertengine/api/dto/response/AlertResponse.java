package com.alertengine.api.dto.response;

import com.alertengine.domain.enums.AlertSeverity;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for an alert.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertResponse {

    private String id;
    private String ruleId;
    private String title;
    private String description;
    private AlertSeverity severity;
    private String category;
    private String source;
    private Instant timestamp;
    private Map<String, Object> metadata;
    private boolean resolved;
    private Instant resolvedAt;
    private String resolvedBy;
    private boolean escalated;
    private Instant escalatedAt;
    private Instant suppressedUntil;
    private String suppressionReason;
}
