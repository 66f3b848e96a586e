package com.fxanalytics.domain.model;

import com.fxanalytics.domain.enums.QualityLevel;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Completeness and consistency scoring for one {@link VolatilityQuote} snapshot.
 * {@code completenessScore = round(100 * validFields / totalFields)}.
 */
@Value
@Builder(toBuilder = true)
public class QualityMetrics {

    int totalFields;
    int validFields;
    int nullFields;
    int completenessScore;

    @Singular
    List<String> warnings;

    boolean stale;

    /** When validation ran. */
    Instant timestamp;

    /** Provider-side update time the staleness check was measured from. */
    Instant lastUpdate;

    public QualityLevel getLevel() {
        return QualityLevel.of(completenessScore);
    }

    /** Short display form, e.g. "86% complete • STALE • 2 warnings". */
    public String describe() {
        List<String> parts = new ArrayList<>();
        parts.add(completenessScore + "% complete");
        if (stale) {
            parts.add("STALE");
        }
        if (!warnings.isEmpty()) {
            parts.add(warnings.size() + " warnings");
        }
        return String.join(" • ", parts);
    }
}
