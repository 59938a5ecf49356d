package com.alertengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INCIDENT_CONFLICT("INCIDENT_CONFLICT", 409),
    INVALID_RULE("INVALID_RULE", 422),
    EVALUATION_ERROR("EVALUATION_ERROR", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    DELIVERY_ERROR("DELIVERY_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
