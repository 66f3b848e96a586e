package com.fxanalytics.domain.enums;

/**
 * Coarse band for a 0-100 completeness or overall quality score, used by dashboards to
 * colour quality indicators.
 */
public enum QualityLevel {

    /** 90 and above. */
    EXCELLENT,

    /** 70-89: usable, matches the completeness gate. */
    ACCEPTABLE,

    /** 50-69. */
    DEGRADED,

    /** Below 50. */
    POOR;

    public static QualityLevel of(int score) {
        if (score >= 90) {
            return EXCELLENT;
        }
        if (score >= 70) {
            return ACCEPTABLE;
        }
        if (score >= 50) {
            return DEGRADED;
        }
        return POOR;
    }
}
