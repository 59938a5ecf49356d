package com.alertengine.mapper;

import com.alertengine.api.dto.request.RegisterRuleRequest;
import com.alertengine.api.dto.request.TestChannelRequest;
import com.alertengine.api.dto.response.AlertResponse;
import com.alertengine.api.dto.response.IncidentResponse;
import com.alertengine.api.dto.response.MetricSampleResponse;
import com.alertengine.api.dto.response.RuleResponse;
import com.alertengine.api.dto.response.TimelineEntryResponse;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.AlertCondition;
import com.alertengine.domain.model.AlertRule;
import com.alertengine.domain.model.Incident;
import com.alertengine.domain.model.MetricSample;
import com.alertengine.domain.model.NotificationChannel;
import com.alertengine.domain.model.TimelineEntry;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for the alert engine's REST DTOs.
 *
 * <p>Used by the controllers at the API boundary: domain -> response DTO for reads, and
 * request -> domain for rule registration and the channel test.
 */
@Mapper
public interface AlertDtoMapper {

    AlertResponse toResponse(Alert alert);

    List<AlertResponse> toAlertResponseList(List<Alert> alerts);

    IncidentResponse toResponse(Incident incident);

    List<IncidentResponse> toIncidentResponseList(List<Incident> incidents);

    TimelineEntryResponse toResponse(TimelineEntry entry);

    @Mapping(target = "metric", source = "condition.metric")
    @Mapping(target = "operator", source = "condition.operator")
    @Mapping(target = "threshold", source = "condition.threshold")
    @Mapping(target = "timeWindow", source = "condition.timeWindow")
    @Mapping(target = "consecutiveFailures", source = "condition.consecutiveFailures")
    @Mapping(target = "channelCount", expression = "java(rule.getChannels() != null ? rule.getChannels().size() : 0)")
    @Mapping(target = "lastFiredAt", ignore = true)
    RuleResponse toResponse(AlertRule rule);

    MetricSampleResponse toResponse(MetricSample sample);

    List<MetricSampleResponse> toSampleResponseList(List<MetricSample> samples);

    // RegisterRuleRequest -> Domain
    @Mapping(target = "condition", source = "request")
    @Mapping(target = "enabled", defaultValue = "true")
    @Mapping(target = "cooldownPeriod", defaultExpression = "java(java.time.Duration.ZERO)")
    @Mapping(target = "escalationDelay", defaultExpression = "java(java.time.Duration.ZERO)")
    @Mapping(target = "channels", defaultExpression = "java(new java.util.ArrayList<>())")
    AlertRule toDomain(RegisterRuleRequest request);

    AlertCondition toCondition(RegisterRuleRequest request);

    // TestChannelRequest -> Domain
    @Mapping(target = "enabled", constant = "true")
    NotificationChannel toDomain(TestChannelRequest request);
}
