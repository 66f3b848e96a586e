package com.fxanalytics.domain.vo;

import com.fxanalytics.exception.DomainException;
import java.time.Period;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;

/**
 * A standardized FX time-to-expiry label ("ON", "1W", "3M", "1Y").
 *
 * <p>The nominal day count (W = 7n, M = 30n, Y = 365n) orders tenors and stands in for
 * time-to-expiry when no trade date is available. The {@link Period} is what
 * {@link com.fxanalytics.calendar.TenorCalendarService} rolls from the spot date to get
 * a concrete expiry.
 */
@Value
public class Tenor implements Comparable<Tenor> {

    private static final Pattern PATTERN = Pattern.compile("^(\\d+)([DWMY])$");

    /** Standard FX option ladder, shortest first. */
    public static final List<String> STANDARD_LABELS =
            List.of("ON", "1W", "2W", "3W", "1M", "2M", "3M", "4M", "6M", "9M", "1Y", "18M", "2Y");

    String label;
    Period period;
    int nominalDays;

    public static Tenor parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new DomainException("Tenor label is required");
        }
        String label = raw.trim().toUpperCase(Locale.ROOT);
        switch (label) {
            case "ON":
                return new Tenor(label, Period.ofDays(1), 1);
            case "TN":
                return new Tenor(label, Period.ofDays(2), 2);
            case "SN":
                return new Tenor(label, Period.ofDays(3), 3);
            default:
                break;
        }

        Matcher m = PATTERN.matcher(label);
        if (!m.matches()) {
            throw new DomainException("Unrecognized tenor label: " + raw);
        }
        int n = Integer.parseInt(m.group(1));
        if (n <= 0) {
            throw new DomainException("Tenor must be positive: " + raw);
        }
        return switch (m.group(2)) {
            case "D" -> new Tenor(label, Period.ofDays(n), n);
            case "W" -> new Tenor(label, Period.ofWeeks(n), 7 * n);
            case "M" -> new Tenor(label, Period.ofMonths(n), 30 * n);
            default -> new Tenor(label, Period.ofYears(n), 365 * n);
        };
    }

    public static List<Tenor> standardLadder() {
        return STANDARD_LABELS.stream().map(Tenor::parse).toList();
    }

    /** Overnight is the only tenor quoted without the BGN pricing-source suffix. */
    public boolean isOvernight() {
        return "ON".equals(label);
    }

    @Override
    public int compareTo(Tenor other) {
        return Integer.compare(nominalDays, other.nominalDays);
    }
}
