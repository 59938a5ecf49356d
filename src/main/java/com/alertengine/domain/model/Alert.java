package com.alertengine.domain.model;

import com.alertengine.domain.enums.AlertSeverity;
import java.time.Instant;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * A fired alert.
 *
 * <p>Identity and content are fixed at creation. The two state flags move one way only:
 * {@link #resolve} and {@link #markEscalated} each succeed at most once, and an alert that
 * is already resolved can no longer be escalated. Both transitions synchronize on the
 * alert so a resolve racing an escalation timer yields exactly one winner.
 *
 * <p>An unresolved alert can be suppressed until a point in time; while suppressed it is
 * left out of the active view but is otherwise unchanged.
 */
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Alert {

    private final String id;
    private final String title;
    private final String description;
    private final AlertSeverity severity;
    private final String category;
    private final String source;
    private final Instant timestamp;

    @Builder.Default
    private final Map<String, Object> metadata = Map.of();

    private volatile boolean resolved;
    private volatile Instant resolvedAt;
    private volatile String resolvedBy;
    private volatile boolean escalated;
    private volatile Instant escalatedAt;
    private volatile Instant suppressedUntil;
    private volatile String suppressionReason;

    /**
     * Marks the alert resolved. Returns false if it was already resolved.
     */
    public synchronized boolean resolve(String by, Instant at) {
        if (resolved) {
            return false;
        }
        this.resolved = true;
        this.resolvedAt = at;
        this.resolvedBy = by;
        return true;
    }

    /**
     * Marks the alert escalated. Returns false if it is resolved or already escalated.
     */
    public synchronized boolean markEscalated(Instant at) {
        if (resolved || escalated) {
            return false;
        }
        this.escalated = true;
        this.escalatedAt = at;
        return true;
    }

    /**
     * Hides the alert from the active view until {@code until}. A later call replaces the
     * window. Returns false if the alert is resolved.
     */
    public synchronized boolean suppress(Instant until, String reason) {
        if (resolved) {
            return false;
        }
        this.suppressedUntil = until;
        this.suppressionReason = reason;
        return true;
    }

    public boolean isSuppressedAt(Instant now) {
        Instant until = suppressedUntil;
        return until != null && until.isAfter(now);
    }

    public String getRuleId() {
        Object ruleId = metadata.get("ruleId");
        return ruleId != null ? ruleId.toString() : null;
    }
}
