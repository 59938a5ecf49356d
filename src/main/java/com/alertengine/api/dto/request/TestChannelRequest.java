package com.alertengine.api.dto.request;

import com.alertengine.domain.enums.NotificationChannelType;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for sending a test notification through an ad-hoc channel definition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestChannelRequest {

    @NotNull(message = "Channel type is required")
    private NotificationChannelType type;

    private Map<String, String> config;
}
