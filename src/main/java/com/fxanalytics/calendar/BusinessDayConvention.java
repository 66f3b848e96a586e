package com.fxanalytics.calendar;

/**
 * How a date that falls on a weekend or holiday is moved onto a business day.
 */
public enum BusinessDayConvention {

    /** Roll forward to the next business day. */
    FOLLOWING,

    /** Roll forward unless that crosses into the next month, in which case roll back. FX default for expiries. */
    MODIFIED_FOLLOWING,

    /** Roll back to the previous business day. */
    PRECEDING
}
