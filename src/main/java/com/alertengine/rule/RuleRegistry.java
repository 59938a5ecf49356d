package com.alertengine.rule;

import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.model.AlertRule;
import com.alertengine.engine.AlertEngineConfig;
import com.alertengine.exception.InvalidRuleException;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the rule definitions, keyed by id and indexed by metric name.
 *
 * <p>The configured rule list is loaded at startup; a single invalid rule aborts the load
 * with {@link InvalidRuleException}, which fails application startup. After loading, the
 * only runtime change is toggling a rule's {@code enabled} flag.
 */
@Component
public class RuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private final RuleValidator ruleValidator;
    private final AlertEngineConfig alertEngineConfig;

    private final Map<String, AlertRule> rulesById = new ConcurrentHashMap<>();

    /** Rules grouped by the metric their condition watches, for O(1) lookup per sample. */
    private final Map<String, List<AlertRule>> rulesByMetric = new ConcurrentHashMap<>();

    public RuleRegistry(RuleValidator ruleValidator, AlertEngineConfig alertEngineConfig) {
        this.ruleValidator = ruleValidator;
        this.alertEngineConfig = alertEngineConfig;
    }

    /**
     * Registers the rules supplied through configuration.
     */
    @PostConstruct
    public void loadConfiguredRules() {
        loadRules(alertEngineConfig.getRules());
    }

    /**
     * Validates every rule first, then replaces the registry contents. Nothing is registered
     * if any rule is invalid or two rules share an id.
     */
    public synchronized void loadRules(List<AlertRule> rules) {
        Map<String, AlertRule> validated = new LinkedHashMap<>();
        for (AlertRule rule : rules) {
            ruleValidator.validate(rule);
            if (validated.putIfAbsent(rule.getId(), rule) != null) {
                throw new InvalidRuleException(rule.getId(), "duplicate rule id");
            }
        }

        rulesById.clear();
        rulesByMetric.clear();
        validated.values().forEach(this::index);

        log.info("Loaded {} alert rules for {} metrics", rulesById.size(), rulesByMetric.size());
    }

    /**
     * Adds a rule, or replaces the rule with the same id.
     */
    public synchronized void register(AlertRule rule) {
        ruleValidator.validate(rule);
        removeRule(rule.getId());
        index(rule);
        log.info("Alert rule registered: {}", rule.getId());
    }

    public synchronized boolean removeRule(String ruleId) {
        AlertRule removed = rulesById.remove(ruleId);
        if (removed == null) {
            return false;
        }
        List<AlertRule> forMetric = rulesByMetric.get(removed.getCondition().getMetric());
        if (forMetric != null) {
            forMetric.remove(removed);
        }
        log.info("Alert rule removed: {}", ruleId);
        return true;
    }

    public boolean setEnabled(String ruleId, boolean enabled) {
        AlertRule rule = rulesById.get(ruleId);
        if (rule == null) {
            return false;
        }
        rule.setEnabled(enabled);
        log.info("Alert rule {}: {}", enabled ? "enabled" : "disabled", ruleId);
        return true;
    }

    /**
     * Enabled rules watching the given metric.
     */
    public List<AlertRule> getRulesForMetric(String metric) {
        List<AlertRule> forMetric = rulesByMetric.get(metric);
        if (forMetric == null || forMetric.isEmpty()) {
            return List.of();
        }
        return forMetric.stream().filter(AlertRule::isEnabled).toList();
    }

    public Optional<AlertRule> getRule(String ruleId) {
        return Optional.ofNullable(rulesById.get(ruleId));
    }

    public List<AlertRule> getAllRules() {
        return new ArrayList<>(rulesById.values());
    }

    public List<AlertRule> getEnabledRules() {
        return rulesById.values().stream().filter(AlertRule::isEnabled).toList();
    }

    public RuleStatistics getRuleStatistics() {
        Map<String, Integer> byCategory = new TreeMap<>();
        Map<AlertSeverity, Integer> bySeverity = new EnumMap<>(AlertSeverity.class);
        int enabled = 0;
        for (AlertRule rule : rulesById.values()) {
            if (rule.isEnabled()) {
                enabled++;
            }
            byCategory.merge(rule.getCategory(), 1, Integer::sum);
            bySeverity.merge(rule.getSeverity(), 1, Integer::sum);
        }
        return new RuleStatistics(rulesById.size(), enabled, rulesById.size() - enabled, byCategory, bySeverity);
    }

    private void index(AlertRule rule) {
        rulesById.put(rule.getId(), rule);
        rulesByMetric
                .computeIfAbsent(rule.getCondition().getMetric(), k -> new CopyOnWriteArrayList<>())
                .add(rule);
    }

    public record RuleStatistics(
            int totalRules,
            int enabledRules,
            int disabledRules,
            Map<String, Integer> rulesByCategory,
            Map<AlertSeverity, Integer> rulesBySeverity) {}
}
