package com.alertengine.api.controller;

import com.alertengine.api.dto.request.AssignIncidentRequest;
import com.alertengine.api.dto.request.IncidentNoteRequest;
import com.alertengine.api.dto.request.IncidentStatusRequest;
import com.alertengine.api.dto.response.IncidentResponse;
import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.model.Incident;
import com.alertengine.exception.BusinessException;
import com.alertengine.exception.ResourceNotFoundException;
import com.alertengine.incident.IncidentCorrelator;
import com.alertengine.incident.IncidentCorrelator.IncidentStatistics;
import com.alertengine.mapper.AlertDtoMapper;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for incidents.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/incidents} -- all incidents, optionally filtered by one of {@code category},
 *       {@code severity} or {@code assignee}</li>
 *   <li>{@code GET /api/incidents/open} -- open and investigating incidents</li>
 *   <li>{@code GET /api/incidents/statistics} -- counts and average resolution time</li>
 *   <li>{@code GET /api/incidents/{id}} -- one incident with alerts and timeline</li>
 *   <li>{@code PUT /api/incidents/{id}/status} -- change status; reopening is refused (409) while
 *       another incident is open for the same category</li>
 *   <li>{@code PUT /api/incidents/{id}/assignee} -- assign</li>
 *   <li>{@code POST /api/incidents/{id}/notes} -- add a timeline note</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/incidents")
public class IncidentController {

    private static final String ANONYMOUS_USER = "api";

    private final IncidentCorrelator incidentCorrelator;
    private final AlertDtoMapper alertDtoMapper = Mappers.getMapper(AlertDtoMapper.class);

    public IncidentController(IncidentCorrelator incidentCorrelator) {
        this.incidentCorrelator = incidentCorrelator;
    }

    @GetMapping
    public List<IncidentResponse> getIncidents(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) AlertSeverity severity,
            @RequestParam(required = false) String assignee) {
        long filters = Stream.of(category, severity, assignee).filter(Objects::nonNull).count();
        if (filters > 1) {
            throw new BusinessException("Filter by at most one of category, severity or assignee");
        }

        List<Incident> incidents;
        if (category != null) {
            incidents = incidentCorrelator.getIncidentsByCategory(category);
        } else if (severity != null) {
            incidents = incidentCorrelator.getIncidentsBySeverity(severity);
        } else if (assignee != null) {
            incidents = incidentCorrelator.getIncidentsByAssignee(assignee);
        } else {
            incidents = incidentCorrelator.getAllIncidents();
        }
        return alertDtoMapper.toIncidentResponseList(incidents);
    }

    @GetMapping("/open")
    public List<IncidentResponse> getOpenIncidents() {
        return alertDtoMapper.toIncidentResponseList(incidentCorrelator.getOpenIncidents());
    }

    @GetMapping("/statistics")
    public IncidentStatistics getStatistics() {
        return incidentCorrelator.getIncidentStatistics();
    }

    @GetMapping("/{id}")
    public IncidentResponse getIncident(@PathVariable String id) {
        return alertDtoMapper.toResponse(incidentCorrelator
                .getIncident(id)
                .orElseThrow(() -> new ResourceNotFoundException("Incident", id)));
    }

    @PutMapping("/{id}/status")
    public IncidentResponse updateStatus(@PathVariable String id, @Valid @RequestBody IncidentStatusRequest request) {
        return alertDtoMapper.toResponse(
                incidentCorrelator.updateStatus(id, request.getStatus(), userOf(request.getUser()), request.getNotes()));
    }

    @PutMapping("/{id}/assignee")
    public IncidentResponse assign(@PathVariable String id, @Valid @RequestBody AssignIncidentRequest request) {
        return alertDtoMapper.toResponse(
                incidentCorrelator.assign(id, request.getAssignee(), userOf(request.getUser())));
    }

    @PostMapping("/{id}/notes")
    public IncidentResponse addNote(@PathVariable String id, @Valid @RequestBody IncidentNoteRequest request) {
        return alertDtoMapper.toResponse(incidentCorrelator.addNote(id, request.getNote(), userOf(request.getUser())));
    }

    private static String userOf(String user) {
        return user == null || user.isBlank() ? ANONYMOUS_USER : user;
    }
}
