package com.alertengine.rule;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Remembers when each rule last fired and gates re-firing within its cooldown period.
 * The window is always measured from the most recent fire.
 */
@Component
public class CooldownTracker {

    private static final Logger log = LoggerFactory.getLogger(CooldownTracker.class);

    private final Map<String, Instant> lastFiredAt = new ConcurrentHashMap<>();

    /**
     * True when the rule fired less than {@code cooldown} before {@code now}.
     * A rule that never fired is never cooling down.
     */
    public boolean isCoolingDown(String ruleId, Duration cooldown, Instant now) {
        Instant last = lastFiredAt.get(ruleId);
        if (last == null || cooldown == null || cooldown.isZero()) {
            return false;
        }
        return Duration.between(last, now).compareTo(cooldown) < 0;
    }

    public void recordFire(String ruleId, Instant firedAt) {
        lastFiredAt.put(ruleId, firedAt);
    }

    public Optional<Instant> lastFiredAt(String ruleId) {
        return Optional.ofNullable(lastFiredAt.get(ruleId));
    }

    public void clear(String ruleId) {
        if (lastFiredAt.remove(ruleId) != null) {
            log.info("Cooldown cleared for rule: {}", ruleId);
        }
    }

    public void clearAll() {
        lastFiredAt.clear();
        log.info("All rule cooldowns cleared");
    }
}
