package com.alertengine.unit.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.alertengine.api.controller.IncidentController;
import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.enums.IncidentStatus;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.Incident;
import com.alertengine.exception.GlobalExceptionHandler;
import com.alertengine.incident.IncidentCorrelator;
import com.alertengine.support.MutableClock;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for IncidentController against a real IncidentCorrelator.
 */
class IncidentControllerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private MockMvc mockMvc;
    private IncidentCorrelator incidentCorrelator;
    private Incident incident;

    @BeforeEach
    void setUp() {
        incidentCorrelator = new IncidentCorrelator(new MutableClock(T0));
        mockMvc = MockMvcBuilders.standaloneSetup(new IncidentController(incidentCorrelator))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        incident = incidentCorrelator.correlate(databaseAlert("db_1"));
    }

    private static Alert databaseAlert(String id) {
        return Alert.builder()
                .id(id)
                .title("Database Connection Failure")
                .description("desc")
                .severity(AlertSeverity.CRITICAL)
                .category("database")
                .source("AlertRuleEngine")
                .timestamp(T0)
                .build();
    }

    @Test
    void getIncident_returnsAlertsAndTimeline() throws Exception {
        mockMvc.perform(get("/api/incidents/" + incident.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.category").value("database"))
                .andExpect(jsonPath("$.status").value("OPEN"))
                .andExpect(jsonPath("$.alertCount").value(1))
                .andExpect(jsonPath("$.alerts[0].id").value("db_1"))
                .andExpect(jsonPath("$.timeline[0].action").value("INCIDENT_CREATED"));
    }

    @Test
    void getIncident_unknown_returns404() throws Exception {
        mockMvc.perform(get("/api/incidents/incident_missing")).andExpect(status().isNotFound());
    }

    @Test
    void getIncidents_filtersByCategory() throws Exception {
        mockMvc.perform(get("/api/incidents").param("category", "database"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
        mockMvc.perform(get("/api/incidents").param("category", "api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void updateStatus_resolvesIncident() throws Exception {
        mockMvc.perform(put("/api/incidents/" + incident.getId() + "/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"status":"RESOLVED","user":"alice","notes":"Failover completed"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.resolvedAt").exists())
                .andExpect(jsonPath("$.timeline[1].description")
                        .value("Status changed from open to resolved: Failover completed"));

        mockMvc.perform(get("/api/incidents/open"))
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void updateStatus_missingStatus_returns400() throws Exception {
        mockMvc.perform(put("/api/incidents/" + incident.getId() + "/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void assign_defaultsUserToApi() throws Exception {
        mockMvc.perform(put("/api/incidents/" + incident.getId() + "/assignee")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"assignee":"bob"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assignee").value("bob"))
                .andExpect(jsonPath("$.timeline[1].user").value("api"));
    }

    @Test
    void addNote_appendsTimelineEntry() throws Exception {
        mockMvc.perform(post("/api/incidents/" + incident.getId() + "/notes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"note":"Replica lag spiking","user":"carol"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timeline[1].action").value("NOTE_ADDED"))
                .andExpect(jsonPath("$.timeline[1].description").value("Replica lag spiking"));
    }

    @Test
    void enumsSerializeByName() throws Exception {
        mockMvc.perform(put("/api/incidents/" + incident.getId() + "/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"status":"INVESTIGATING","user":"alice"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.severity").value("CRITICAL"))
                .andExpect(jsonPath("$.status").value("INVESTIGATING"))
                .andExpect(jsonPath("$.timeline[0].action").value("INCIDENT_CREATED"))
                .andExpect(jsonPath("$.timeline[1].action").value("STATUS_CHANGED"))
                .andExpect(jsonPath("$.timeline[1].metadata.previousStatus").value("OPEN"))
                .andExpect(jsonPath("$.timeline[1].metadata.newStatus").value("INVESTIGATING"));
    }

    @Test
    void reopen_whileSuccessorOpen_returns409() throws Exception {
        incidentCorrelator.updateStatus(incident.getId(), IncidentStatus.RESOLVED, "alice", null);
        Incident successor = incidentCorrelator.correlate(databaseAlert("db_2"));

        mockMvc.perform(put("/api/incidents/" + incident.getId() + "/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"status":"OPEN","user":"alice"}
                        """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("INCIDENT_CONFLICT"))
                .andExpect(jsonPath("$.error.details.openIncidentId").value(successor.getId()));

        mockMvc.perform(get("/api/incidents/open"))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(successor.getId()));
    }

    @Test
    void getIncidents_filtersBySeverityAndAssignee() throws Exception {
        incidentCorrelator.assign(incident.getId(), "bob", "alice");

        mockMvc.perform(get("/api/incidents").param("severity", "CRITICAL"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
        mockMvc.perform(get("/api/incidents").param("severity", "ERROR"))
                .andExpect(jsonPath("$.length()").value(0));
        mockMvc.perform(get("/api/incidents").param("assignee", "bob"))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].assignee").value("bob"));
        mockMvc.perform(get("/api/incidents").param("assignee", "carol"))
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void getIncidents_twoFilters_returns400() throws Exception {
        mockMvc.perform(get("/api/incidents").param("category", "database").param("assignee", "bob"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    void getStatistics_countsByStatus() throws Exception {
        mockMvc.perform(get("/api/incidents/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalIncidents").value(1))
                .andExpect(jsonPath("$.incidentsByStatus.OPEN").value(1));
    }
}
