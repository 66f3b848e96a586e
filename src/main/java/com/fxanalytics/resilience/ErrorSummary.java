package com.fxanalytics.resilience;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Human-readable roll-up of the errors from one acquisition run. */
@Value
@Builder
public class ErrorSummary {

    String summary;
    List<String> details;
    boolean recoverable;
}
