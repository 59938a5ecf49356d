package com.alertengine.api.dto.response;

import com.alertengine.domain.enums.TimelineAction;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimelineEntryResponse {

    private Instant timestamp;
    private TimelineAction action;
    private String description;
    private String user;
    private Map<String, Object> metadata;
}
