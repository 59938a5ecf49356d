package com.alertengine.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for suppressing an alert for a number of minutes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SuppressAlertRequest {

    @NotNull(message = "Duration is required")
    @Min(value = 1, message = "Duration must be at least 1 minute")
    @Max(value = 10080, message = "Duration must be at most 7 days")
    private Long durationMinutes;

    private String reason;
}
