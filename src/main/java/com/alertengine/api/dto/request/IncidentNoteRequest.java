package com.alertengine.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentNoteRequest {

    @NotBlank(message = "Note text is required")
    @Size(max = 2000, message = "Note must be 2000 characters or less")
    private String note;

    private String user;
}
