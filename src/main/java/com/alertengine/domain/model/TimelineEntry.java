package com.alertengine.domain.model;

import com.alertengine.domain.enums.TimelineAction;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * One append-only audit record on an incident timeline.
 */
@Getter
@Builder
@AllArgsConstructor
public class TimelineEntry {

    private final Instant timestamp;
    private final TimelineAction action;
    private final String description;
    private final String user;

    @Builder.Default
    private final Map<String, Object> metadata = Map.of();
}
