package com.alertengine.api.controller;

import com.alertengine.api.dto.request.RegisterRuleRequest;
import com.alertengine.api.dto.response.RuleResponse;
import com.alertengine.domain.model.AlertRule;
import com.alertengine.exception.ResourceNotFoundException;
import com.alertengine.mapper.AlertDtoMapper;
import com.alertengine.rule.CooldownTracker;
import com.alertengine.rule.RuleRegistry;
import com.alertengine.rule.RuleRegistry.RuleStatistics;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the rule registry.
 *
 * <p>Rules are loaded from configuration at startup. At runtime a rule can be registered
 * (replacing one with the same id), removed, enabled, disabled, or have its cooldown cleared.
 */
@RestController
@RequestMapping("/api/rules")
public class RuleController {

    private final RuleRegistry ruleRegistry;
    private final CooldownTracker cooldownTracker;
    private final AlertDtoMapper alertDtoMapper = Mappers.getMapper(AlertDtoMapper.class);

    public RuleController(RuleRegistry ruleRegistry, CooldownTracker cooldownTracker) {
        this.ruleRegistry = ruleRegistry;
        this.cooldownTracker = cooldownTracker;
    }

    @GetMapping
    public List<RuleResponse> getRules() {
        return ruleRegistry.getAllRules().stream().map(this::toResponse).toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RuleResponse registerRule(@RequestBody RegisterRuleRequest request) {
        AlertRule rule = alertDtoMapper.toDomain(request);
        ruleRegistry.register(rule);
        return toResponse(rule);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> removeRule(@PathVariable String id) {
        if (!ruleRegistry.removeRule(id)) {
            throw new ResourceNotFoundException("Rule", id);
        }
        cooldownTracker.clear(id);
        return Map.of("ruleId", id, "removed", true);
    }

    @GetMapping("/statistics")
    public RuleStatistics getStatistics() {
        return ruleRegistry.getRuleStatistics();
    }

    @GetMapping("/{id}")
    public RuleResponse getRule(@PathVariable String id) {
        return toResponse(requireRule(id));
    }

    @PostMapping("/{id}/enable")
    public RuleResponse enable(@PathVariable String id) {
        if (!ruleRegistry.setEnabled(id, true)) {
            throw new ResourceNotFoundException("Rule", id);
        }
        return toResponse(requireRule(id));
    }

    @PostMapping("/{id}/disable")
    public RuleResponse disable(@PathVariable String id) {
        if (!ruleRegistry.setEnabled(id, false)) {
            throw new ResourceNotFoundException("Rule", id);
        }
        return toResponse(requireRule(id));
    }

    @DeleteMapping("/{id}/cooldown")
    public Map<String, Object> clearCooldown(@PathVariable String id) {
        requireRule(id);
        cooldownTracker.clear(id);
        return Map.of("ruleId", id, "cooldownCleared", true);
    }

    private AlertRule requireRule(String id) {
        return ruleRegistry.getRule(id).orElseThrow(() -> new ResourceNotFoundException("Rule", id));
    }

    private RuleResponse toResponse(AlertRule rule) {
        RuleResponse response = alertDtoMapper.toResponse(rule);
        cooldownTracker.lastFiredAt(rule.getId()).ifPresent(response::setLastFiredAt);
        return response;
    }
}
