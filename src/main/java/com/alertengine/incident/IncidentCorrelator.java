package com.alertengine.incident;

import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.enums.IncidentStatus;
import com.alertengine.domain.enums.TimelineAction;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.Incident;
import com.alertengine.domain.model.TimelineEntry;
import com.alertengine.exception.BusinessException;
import com.alertengine.exception.ErrorCode;
import com.alertengine.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Groups error and critical alerts into incidents by category.
 *
 * <p>An alert joins the OPEN incident that already holds an alert of the same category;
 * otherwise a new incident is opened. At most one OPEN incident exists per category. An
 * incident's severity only rises, and every change is written to its timeline.
 *
 * <p>All mutations are serialized on this correlator. Reads go through the incident's
 * copy-on-write lists and need no lock.
 */
@Component
public class IncidentCorrelator {

    private static final Logger log = LoggerFactory.getLogger(IncidentCorrelator.class);

    static final String SYSTEM_USER = "system";

    private final Clock clock;
    private final Map<String, Incident> incidents = new ConcurrentHashMap<>();

    public IncidentCorrelator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Adds the alert to the matching open incident or opens a new one.
     *
     * @return the incident now holding the alert
     */
    public synchronized Incident correlate(Alert alert) {
        Instant now = clock.instant();
        Optional<Incident> existing = incidents.values().stream()
                .filter(incident -> incident.getStatus() == IncidentStatus.OPEN)
                .filter(incident -> incident.containsCategory(alert.getCategory()))
                .findFirst();

        if (existing.isPresent()) {
            Incident incident = existing.get();
            appendAlert(incident, alert, now);
            return incident;
        }
        return openIncident(alert, now);
    }

    /**
     * Moves an incident to a new status. RESOLVED and CLOSED stamp {@code resolvedAt}; moving
     * back out of them clears it.
     *
     * @throws ResourceNotFoundException if the incident does not exist
     * @throws BusinessException if reopening would leave two OPEN incidents for one category
     */
    public synchronized Incident updateStatus(String incidentId, IncidentStatus status, String user, String notes) {
        Incident incident = require(incidentId);
        Instant now = clock.instant();
        IncidentStatus previous = incident.getStatus();

        if (status == IncidentStatus.OPEN && previous != IncidentStatus.OPEN) {
            requireNoOpenSibling(incident);
        }

        incident.setStatus(status);
        incident.setUpdatedAt(now);
        if (status.isTerminal() && incident.getResolvedAt() == null) {
            incident.setResolvedAt(now);
        } else if (!status.isTerminal()) {
            incident.setResolvedAt(null);
        }

        String description = "Status changed from " + previous.name().toLowerCase() + " to "
                + status.name().toLowerCase() + (notes != null && !notes.isBlank() ? ": " + notes : "");
        incident.addTimelineEntry(entry(now, TimelineAction.STATUS_CHANGED, description, user,
                Map.of("previousStatus", previous, "newStatus", status)));

        log.info("Incident {} status {} -> {} by {}", incidentId, previous, status, user);
        return incident;
    }

    /**
     * Assigns an incident to a person.
     *
     * @throws ResourceNotFoundException if the incident does not exist
     */
    public synchronized Incident assign(String incidentId, String assignee, String user) {
        Incident incident = require(incidentId);
        Instant now = clock.instant();
        String previous = incident.getAssignee();

        incident.setAssignee(assignee);
        incident.setUpdatedAt(now);

        String description = "Incident assigned to " + assignee + (previous != null ? " (previously: " + previous + ")" : "");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("assignee", assignee);
        if (previous != null) {
            metadata.put("previousAssignee", previous);
        }
        incident.addTimelineEntry(entry(now, TimelineAction.ASSIGNED, description, user, metadata));

        log.info("Incident {} assigned to {} by {}", incidentId, assignee, user);
        return incident;
    }

    /**
     * Appends a free-text note to an incident timeline.
     *
     * @throws ResourceNotFoundException if the incident does not exist
     */
    public synchronized Incident addNote(String incidentId, String note, String user) {
        Incident incident = require(incidentId);
        Instant now = clock.instant();
        incident.setUpdatedAt(now);
        incident.addTimelineEntry(entry(now, TimelineAction.NOTE_ADDED, note, user, Map.of()));
        return incident;
    }

    /** Incidents still being worked on: OPEN and INVESTIGATING, newest first. */
    public List<Incident> getOpenIncidents() {
        return incidents.values().stream()
                .filter(incident -> incident.getStatus().isActive())
                .sorted(Comparator.comparing(Incident::getCreatedAt).reversed())
                .toList();
    }

    public Optional<Incident> getIncident(String incidentId) {
        return Optional.ofNullable(incidents.get(incidentId));
    }

    public List<Incident> getAllIncidents() {
        return incidents.values().stream()
                .sorted(Comparator.comparing(Incident::getCreatedAt).reversed())
                .toList();
    }

    /** Incidents holding at least one alert of the given category. */
    public List<Incident> getIncidentsByCategory(String category) {
        return incidents.values().stream()
                .filter(incident -> incident.containsCategory(category))
                .sorted(Comparator.comparing(Incident::getCreatedAt).reversed())
                .toList();
    }

    public List<Incident> getIncidentsBySeverity(AlertSeverity severity) {
        return incidents.values().stream()
                .filter(incident -> incident.getSeverity() == severity)
                .sorted(Comparator.comparing(Incident::getCreatedAt).reversed())
                .toList();
    }

    public List<Incident> getIncidentsByAssignee(String assignee) {
        return incidents.values().stream()
                .filter(incident -> assignee.equals(incident.getAssignee()))
                .sorted(Comparator.comparing(Incident::getCreatedAt).reversed())
                .toList();
    }

    public IncidentStatistics getIncidentStatistics() {
        Map<IncidentStatus, Integer> byStatus = new EnumMap<>(IncidentStatus.class);
        Map<AlertSeverity, Integer> bySeverity = new EnumMap<>(AlertSeverity.class);
        Map<String, Integer> byCategory = new TreeMap<>();
        Duration totalResolution = Duration.ZERO;
        int resolvedCount = 0;

        for (Incident incident : incidents.values()) {
            byStatus.merge(incident.getStatus(), 1, Integer::sum);
            bySeverity.merge(incident.getSeverity(), 1, Integer::sum);
            incident.getAlerts().forEach(alert -> byCategory.merge(alert.getCategory(), 1, Integer::sum));
            if (incident.getResolvedAt() != null) {
                totalResolution = totalResolution.plus(Duration.between(incident.getCreatedAt(), incident.getResolvedAt()));
                resolvedCount++;
            }
        }

        Duration averageResolution = resolvedCount > 0 ? totalResolution.dividedBy(resolvedCount) : Duration.ZERO;
        return new IncidentStatistics(incidents.size(), byStatus, bySeverity, byCategory, averageResolution);
    }

    /**
     * Resolves OPEN incidents created more than {@code maxAge} ago.
     *
     * @return number of incidents resolved
     */
    public synchronized int autoResolveStaleIncidents(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<Incident> stale = incidents.values().stream()
                .filter(incident -> incident.getStatus() == IncidentStatus.OPEN)
                .filter(incident -> incident.getCreatedAt().isBefore(cutoff))
                .toList();

        stale.forEach(incident -> updateStatus(incident.getId(), IncidentStatus.RESOLVED, SYSTEM_USER, "Auto-resolved due to age"));
        if (!stale.isEmpty()) {
            log.info("Auto-resolved {} stale incidents", stale.size());
        }
        return stale.size();
    }

    /**
     * Drops resolved and closed incidents not updated within {@code retention}, then trims
     * the store to the {@code maxInMemory} most recently updated incidents.
     *
     * @return number of incidents removed
     */
    public synchronized int cleanupOldIncidents(Duration retention, int maxInMemory) {
        Instant cutoff = clock.instant().minus(retention);
        int before = incidents.size();

        incidents.values().removeIf(incident -> incident.getStatus().isTerminal()
                && incident.getUpdatedAt().isBefore(cutoff));

        if (incidents.size() > maxInMemory) {
            incidents.values().stream()
                    .sorted(Comparator.comparing(Incident::getUpdatedAt))
                    .limit(incidents.size() - maxInMemory)
                    .toList()
                    .forEach(incident -> incidents.remove(incident.getId()));
        }

        int removed = before - incidents.size();
        if (removed > 0) {
            log.info("Cleaned up {} old incidents", removed);
        }
        return removed;
    }

    private Incident openIncident(Alert alert, Instant now) {
        String incidentId = "incident_" + now.toEpochMilli() + "_"
                + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        Incident incident = new Incident(
                incidentId,
                alert.getCategory() + " - " + alert.getTitle(),
                alert.getDescription(),
                alert.getCategory(),
                alert.getSeverity(),
                now);
        incident.addAlert(alert);
        incident.addTimelineEntry(entry(now, TimelineAction.INCIDENT_CREATED,
                "Incident created from alert: " + alert.getTitle(), SYSTEM_USER, Map.of("alertId", alert.getId())));
        incidents.put(incidentId, incident);

        log.info("Incident {} created for category {} from alert {} (severity {})",
                incidentId, alert.getCategory(), alert.getId(), alert.getSeverity());
        return incident;
    }

    private void appendAlert(Incident incident, Alert alert, Instant now) {
        incident.addAlert(alert);
        incident.setUpdatedAt(now);
        incident.addTimelineEntry(entry(now, TimelineAction.ALERT_ADDED,
                "Added alert: " + alert.getTitle(), SYSTEM_USER, Map.of("alertId", alert.getId())));

        AlertSeverity previous = incident.getSeverity();
        if (alert.getSeverity().isHigherThan(previous)) {
            incident.setSeverity(alert.getSeverity());
            incident.addTimelineEntry(entry(now, TimelineAction.SEVERITY_ESCALATED,
                    "Incident severity escalated from " + previous.name().toLowerCase() + " to "
                            + alert.getSeverity().name().toLowerCase(),
                    SYSTEM_USER,
                    Map.of("previousSeverity", previous, "newSeverity", alert.getSeverity())));
            log.warn("Incident {} severity escalated {} -> {} by alert {}",
                    incident.getId(), previous, alert.getSeverity(), alert.getId());
        }
        log.debug("Alert {} added to incident {}", alert.getId(), incident.getId());
    }

    private void requireNoOpenSibling(Incident incident) {
        Optional<Incident> sibling = incidents.values().stream()
                .filter(other -> other != incident && other.getStatus() == IncidentStatus.OPEN)
                .filter(other -> incident.getAlerts().stream().anyMatch(alert -> other.containsCategory(alert.getCategory())))
                .findFirst();
        if (sibling.isPresent()) {
            throw new BusinessException(
                    ErrorCode.INCIDENT_CONFLICT,
                    String.format("Incident %s cannot be reopened: incident %s is already open for its category",
                            incident.getId(), sibling.get().getId()),
                    Map.of("incidentId", incident.getId(), "openIncidentId", sibling.get().getId()));
        }
    }

    private Incident require(String incidentId) {
        Incident incident = incidents.get(incidentId);
        if (incident == null) {
            throw new ResourceNotFoundException("Incident", incidentId);
        }
        return incident;
    }

    private static TimelineEntry entry(Instant at, TimelineAction action, String description, String user, Map<String, Object> metadata) {
        return TimelineEntry.builder()
                .timestamp(at)
                .action(action)
                .description(description)
                .user(user)
                .metadata(metadata)
                .build();
    }

    /**
     * Summary counts across all stored incidents.
     */
    public record IncidentStatistics(
            int totalIncidents,
            Map<IncidentStatus, Integer> incidentsByStatus,
            Map<AlertSeverity, Integer> incidentsBySeverity,
            Map<String, Integer> alertsByCategory,
            Duration averageResolutionTime) {}
}
