package com.alertengine.api.dto.request;

import com.alertengine.domain.enums.AlertSeverity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for raising an alert by hand.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualAlertRequest {

    /** Short snake_case type, rendered as the alert title (e.g. "payment_gateway_down"). */
    @NotBlank(message = "Alert type is required")
    private String type;

    @NotBlank(message = "Message is required")
    @Size(max = 2000, message = "Message must be 2000 characters or less")
    private String message;

    @NotNull(message = "Severity is required")
    private AlertSeverity severity;

    private Map<String, Object> metadata;
}
