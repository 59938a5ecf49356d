package com.alertengine.domain.model;

import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.enums.IncidentStatus;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.Getter;
import lombok.Setter;

/**
 * A correlated group of alerts sharing a category.
 *
 * <p>Alerts and timeline entries are append-only. Mutation is owned by the
 * IncidentCorrelator, which serializes all writes; the copy-on-write lists let the
 * query surface read a consistent snapshot without taking that lock.
 */
@Getter
@Setter
public class Incident {

    private final String id;
    private final String title;
    private final String description;
    private final String category;
    private final Instant createdAt;

    private volatile AlertSeverity severity;
    private volatile IncidentStatus status;
    private volatile Instant updatedAt;
    private volatile Instant resolvedAt;
    private volatile String assignee;

    private final List<Alert> alerts = new CopyOnWriteArrayList<>();
    private final List<TimelineEntry> timeline = new CopyOnWriteArrayList<>();

    public Incident(String id, String title, String description, String category, AlertSeverity severity, Instant createdAt) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.category = category;
        this.severity = severity;
        this.status = IncidentStatus.OPEN;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public List<Alert> getAlerts() {
        return List.copyOf(alerts);
    }

    public List<TimelineEntry> getTimeline() {
        return List.copyOf(timeline);
    }

    public void addAlert(Alert alert) {
        alerts.add(alert);
    }

    public void addTimelineEntry(TimelineEntry entry) {
        timeline.add(entry);
    }

    public boolean containsCategory(String alertCategory) {
        return alerts.stream().anyMatch(a -> a.getCategory().equals(alertCategory));
    }

    public int getAlertCount() {
        return alerts.size();
    }
}
