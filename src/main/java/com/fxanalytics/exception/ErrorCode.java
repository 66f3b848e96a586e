package com.fxanalytics.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    DATA_ERROR("DATA_ERROR", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    PROVIDER_UNAVAILABLE("PROVIDER_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
