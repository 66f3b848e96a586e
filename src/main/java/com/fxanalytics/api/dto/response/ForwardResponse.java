package com.fxanalytics.api.dto.response;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ForwardResponse {

    private final double spot;
    private final double timeToExpiryYears;
    private final double domesticRate;
    private final double foreignRate;
    private final double forward;

    /** Forward minus spot, in price units. */
    private final double forwardPoints;
}
