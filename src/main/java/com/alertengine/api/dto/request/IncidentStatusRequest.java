package com.alertengine.api.dto.request;

import com.alertengine.domain.enums.IncidentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentStatusRequest {

    @NotNull(message = "Status is required")
    private IncidentStatus status;

    private String user;

    private String notes;
}
