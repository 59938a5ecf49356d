package com.alertengine.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body for resolving an alert. A missing resolver is recorded as "system".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveAlertRequest {

    private String resolvedBy;
}
