package com.alertengine.unit.incident;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.enums.IncidentStatus;
import com.alertengine.domain.enums.TimelineAction;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.Incident;
import com.alertengine.domain.model.TimelineEntry;
import com.alertengine.exception.BusinessException;
import com.alertengine.exception.ErrorCode;
import com.alertengine.exception.ResourceNotFoundException;
import com.alertengine.incident.IncidentCorrelator;
import com.alertengine.incident.IncidentCorrelator.IncidentStatistics;
import com.alertengine.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for IncidentCorrelator: grouping by category, severity escalation and the
 * incident lifecycle operations.
 */
class IncidentCorrelatorTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private MutableClock clock;
    private IncidentCorrelator incidentCorrelator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        incidentCorrelator = new IncidentCorrelator(clock);
    }

    private Alert alert(String id, String category, AlertSeverity severity) {
        return Alert.builder()
                .id(id)
                .title("Alert " + id)
                .description("desc " + id)
                .severity(severity)
                .category(category)
                .source("test")
                .timestamp(clock.instant())
                .build();
    }

    @Nested
    @DisplayName("Correlation")
    class Correlation {

        @Test
        @DisplayName("First alert of a category opens an incident")
        void opensIncident() {
            Incident incident = incidentCorrelator.correlate(alert("a1", "api_performance", AlertSeverity.ERROR));

            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.OPEN);
            assertThat(incident.getSeverity()).isEqualTo(AlertSeverity.ERROR);
            assertThat(incident.getAlerts()).extracting(Alert::getId).containsExactly("a1");
            assertThat(incident.getTimeline())
                    .extracting(TimelineEntry::getAction)
                    .containsExactly(TimelineAction.INCIDENT_CREATED);
            assertThat(incident.getId()).startsWith("incident_" + T0.toEpochMilli() + "_");
        }

        @Test
        @DisplayName("A warning followed by a critical of the same category yields one critical incident")
        void escalatesSeverity() {
            Incident first = incidentCorrelator.correlate(alert("a1", "api_performance", AlertSeverity.WARNING));
            clock.advance(Duration.ofMinutes(1));
            Incident second = incidentCorrelator.correlate(alert("a2", "api_performance", AlertSeverity.CRITICAL));

            assertThat(second.getId()).isEqualTo(first.getId());
            assertThat(second.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(second.getAlertCount()).isEqualTo(2);
            assertThat(second.getUpdatedAt()).isEqualTo(T0.plus(Duration.ofMinutes(1)));
            assertThat(second.getTimeline())
                    .extracting(TimelineEntry::getAction)
                    .containsExactly(
                            TimelineAction.INCIDENT_CREATED,
                            TimelineAction.ALERT_ADDED,
                            TimelineAction.SEVERITY_ESCALATED);
            assertThat(second.getTimeline().get(2).getMetadata())
                    .containsEntry("previousSeverity", AlertSeverity.WARNING)
                    .containsEntry("newSeverity", AlertSeverity.CRITICAL);
        }

        @Test
        @DisplayName("A lower-severity alert does not lower the incident severity")
        void severityNeverDrops() {
            incidentCorrelator.correlate(alert("a1", "database", AlertSeverity.CRITICAL));
            Incident incident = incidentCorrelator.correlate(alert("a2", "database", AlertSeverity.ERROR));

            assertThat(incident.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(incident.getTimeline())
                    .extracting(TimelineEntry::getAction)
                    .doesNotContain(TimelineAction.SEVERITY_ESCALATED);
        }

        @Test
        @DisplayName("A different category opens a separate incident")
        void separateCategory() {
            Incident api = incidentCorrelator.correlate(alert("a1", "api_performance", AlertSeverity.ERROR));
            Incident db = incidentCorrelator.correlate(alert("a2", "database", AlertSeverity.ERROR));

            assertThat(db.getId()).isNotEqualTo(api.getId());
            assertThat(incidentCorrelator.getOpenIncidents()).hasSize(2);
        }

        @Test
        @DisplayName("An incident that is no longer open does not absorb new alerts")
        void investigatingIncidentNotReused() {
            Incident first = incidentCorrelator.correlate(alert("a1", "database", AlertSeverity.ERROR));
            incidentCorrelator.updateStatus(first.getId(), IncidentStatus.INVESTIGATING, "alice", null);

            Incident second = incidentCorrelator.correlate(alert("a2", "database", AlertSeverity.ERROR));

            assertThat(second.getId()).isNotEqualTo(first.getId());
            assertThat(incidentCorrelator.getOpenIncidents()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        private Incident incident;

        @BeforeEach
        void open() {
            incident = incidentCorrelator.correlate(alert("a1", "security", AlertSeverity.CRITICAL));
        }

        @Test
        @DisplayName("Resolving stamps resolvedAt and records a status_changed entry")
        void resolve() {
            clock.advance(Duration.ofMinutes(30));

            incidentCorrelator.updateStatus(incident.getId(), IncidentStatus.RESOLVED, "alice", "fixed");

            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
            assertThat(incident.getResolvedAt()).isEqualTo(T0.plus(Duration.ofMinutes(30)));
            TimelineEntry last = incident.getTimeline().get(incident.getTimeline().size() - 1);
            assertThat(last.getAction()).isEqualTo(TimelineAction.STATUS_CHANGED);
            assertThat(last.getUser()).isEqualTo("alice");
            assertThat(last.getDescription()).isEqualTo("Status changed from open to resolved: fixed");
            assertThat(incidentCorrelator.getOpenIncidents()).isEmpty();
        }

        @Test
        @DisplayName("Reopening a resolved incident clears resolvedAt when no other incident is open")
        void reopenClearsResolvedAt() {
            incidentCorrelator.updateStatus(incident.getId(), IncidentStatus.RESOLVED, "alice", null);
            clock.advance(Duration.ofMinutes(5));

            incidentCorrelator.updateStatus(incident.getId(), IncidentStatus.OPEN, "alice", "regressed");

            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.OPEN);
            assertThat(incident.getResolvedAt()).isNull();
            assertThat(incidentCorrelator.correlate(alert("a2", "security", AlertSeverity.ERROR))).isSameAs(incident);
        }

        @Test
        @DisplayName("Reopening is rejected while another incident is open for the same category")
        void reopenRejectedWhenSiblingOpen() {
            incidentCorrelator.updateStatus(incident.getId(), IncidentStatus.RESOLVED, "alice", null);
            Incident successor = incidentCorrelator.correlate(alert("a2", "security", AlertSeverity.CRITICAL));

            assertThatThrownBy(() -> incidentCorrelator.updateStatus(incident.getId(), IncidentStatus.OPEN, "alice", null))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INCIDENT_CONFLICT));

            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
            assertThat(incident.getResolvedAt()).isEqualTo(T0);
            assertThat(incidentCorrelator.getAllIncidents())
                    .filteredOn(i -> i.getStatus() == IncidentStatus.OPEN)
                    .containsExactly(successor);
        }

        @Test
        @DisplayName("An investigating incident cannot return to open once a successor has opened")
        void investigatingToOpenRejected() {
            incidentCorrelator.updateStatus(incident.getId(), IncidentStatus.INVESTIGATING, "alice", null);
            incidentCorrelator.correlate(alert("a2", "security", AlertSeverity.ERROR));

            assertThatThrownBy(() -> incidentCorrelator.updateStatus(incident.getId(), IncidentStatus.OPEN, "alice", null))
                    .isInstanceOf(BusinessException.class);
            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.INVESTIGATING);
        }

        @Test
        @DisplayName("assign and addNote append timeline entries")
        void assignAndNote() {
            incidentCorrelator.assign(incident.getId(), "bob", "alice");
            incidentCorrelator.addNote(incident.getId(), "rotating credentials", "bob");

            assertThat(incident.getAssignee()).isEqualTo("bob");
            assertThat(incident.getTimeline())
                    .extracting(TimelineEntry::getAction)
                    .endsWith(TimelineAction.ASSIGNED, TimelineAction.NOTE_ADDED);
        }

        @Test
        @DisplayName("Incidents can be listed by severity and by assignee")
        void queriesBySeverityAndAssignee() {
            Incident database = incidentCorrelator.correlate(alert("a2", "database", AlertSeverity.ERROR));
            incidentCorrelator.assign(database.getId(), "bob", "alice");

            assertThat(incidentCorrelator.getIncidentsBySeverity(AlertSeverity.CRITICAL)).containsExactly(incident);
            assertThat(incidentCorrelator.getIncidentsBySeverity(AlertSeverity.ERROR)).containsExactly(database);
            assertThat(incidentCorrelator.getIncidentsByAssignee("bob")).containsExactly(database);
            assertThat(incidentCorrelator.getIncidentsByAssignee("carol")).isEmpty();
        }

        @Test
        @DisplayName("Unknown incident id raises ResourceNotFoundException")
        void unknownIncident() {
            assertThatThrownBy(() -> incidentCorrelator.assign("nope", "bob", "alice"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Statistics report counts and the average resolution time")
        void statistics() {
            clock.advance(Duration.ofMinutes(20));
            incidentCorrelator.updateStatus(incident.getId(), IncidentStatus.RESOLVED, "alice", null);
            incidentCorrelator.correlate(alert("a2", "database", AlertSeverity.ERROR));

            IncidentStatistics statistics = incidentCorrelator.getIncidentStatistics();

            assertThat(statistics.totalIncidents()).isEqualTo(2);
            assertThat(statistics.incidentsByStatus())
                    .containsEntry(IncidentStatus.RESOLVED, 1)
                    .containsEntry(IncidentStatus.OPEN, 1);
            assertThat(statistics.averageResolutionTime()).isEqualTo(Duration.ofMinutes(20));
        }
    }

    @Nested
    @DisplayName("Housekeeping")
    class Housekeeping {

        @Test
        @DisplayName("Open incidents past the max age are auto-resolved by system")
        void autoResolveStale() {
            Incident old = incidentCorrelator.correlate(alert("a1", "database", AlertSeverity.ERROR));
            clock.advance(Duration.ofHours(25));
            Incident fresh = incidentCorrelator.correlate(alert("a2", "security", AlertSeverity.ERROR));

            int resolved = incidentCorrelator.autoResolveStaleIncidents(Duration.ofHours(24));

            assertThat(resolved).isEqualTo(1);
            assertThat(old.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
            assertThat(fresh.getStatus()).isEqualTo(IncidentStatus.OPEN);
        }

        @Test
        @DisplayName("Cleanup drops old terminal incidents and trims to the memory bound")
        void cleanup() {
            Incident closed = incidentCorrelator.correlate(alert("a1", "database", AlertSeverity.ERROR));
            incidentCorrelator.updateStatus(closed.getId(), IncidentStatus.CLOSED, "alice", null);
            clock.advance(Duration.ofDays(31));
            incidentCorrelator.correlate(alert("a2", "security", AlertSeverity.ERROR));
            clock.advance(Duration.ofMinutes(1));
            Incident newest = incidentCorrelator.correlate(alert("a3", "api_performance", AlertSeverity.ERROR));

            int removed = incidentCorrelator.cleanupOldIncidents(Duration.ofDays(30), 1);

            assertThat(removed).isEqualTo(2);
            assertThat(incidentCorrelator.getAllIncidents()).extracting(Incident::getId).containsExactly(newest.getId());
        }
    }
}
