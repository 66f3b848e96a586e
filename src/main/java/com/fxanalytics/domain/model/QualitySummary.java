package com.fxanalytics.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Surface-level roll-up of per-tenor quality, shown on the data-quality dashboard. */
@Value
@Builder
public class QualitySummary {

    int overallScore;
    int completeRecords;
    int totalRecords;
    double averageCompleteness;
    int staleRecords;
    List<String> criticalWarnings;

    public static QualitySummary empty() {
        return QualitySummary.builder().criticalWarnings(List.of()).build();
    }
}
