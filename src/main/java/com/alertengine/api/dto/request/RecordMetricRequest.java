package com.alertengine.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for pushing one metric sample. The sample is stamped with the server time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordMetricRequest {

    @NotBlank(message = "Metric name is required")
    private String name;

    @NotNull(message = "Metric value is required")
    private Double value;
}
