package com.fxanalytics.api.dto.response;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope, {@code {"success": true, "data": ..., "timestamp": ...}}. Controllers
 * return surfaces, quality summaries and priced options bare; the response advice wraps
 * them. Failures use {@link ApiErrorResponse}.
 */
@Getter
@JsonPropertyOrder({"success", "data", "timestamp"})
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data, Instant timestamp) {
        this.data = data;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, Instant.now());
    }
}
