package com.alertengine.domain.model;

import com.alertengine.domain.enums.NotificationChannelType;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Configuration for one notification target. Carries no runtime state.
 *
 * <p>Recognised config keys per type:
 * <ul>
 *   <li>SLACK: {@code webhookUrl}, {@code channel}</li>
 *   <li>EMAIL: {@code endpoint}, {@code recipients} (comma separated)</li>
 *   <li>WEBHOOK: {@code url}, {@code header.<Name>} for extra request headers</li>
 *   <li>PAGERDUTY: {@code routingKey}</li>
 * </ul>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationChannel {

    private NotificationChannelType type;

    @Builder.Default
    private Map<String, String> config = new LinkedHashMap<>();

    @Builder.Default
    private boolean enabled = true;

    public String configValue(String key) {
        if (config == null) {
            return null;
        }
        String value = config.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
