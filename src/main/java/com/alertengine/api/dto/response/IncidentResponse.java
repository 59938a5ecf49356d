package com.alertengine.api.dto.response;

import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.enums.IncidentStatus;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for an incident, including its alerts and timeline.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IncidentResponse {

    private String id;
    private String title;
    private String description;
    private String category;
    private AlertSeverity severity;
    private IncidentStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant resolvedAt;
    private String assignee;
    private int alertCount;
    private List<AlertResponse> alerts;
    private List<TimelineEntryResponse> timeline;
}
