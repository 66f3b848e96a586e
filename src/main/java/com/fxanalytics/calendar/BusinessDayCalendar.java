package com.fxanalytics.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Business-day arithmetic over weekends plus the configured fixed holiday list.
 *
 * <p>Holiday data comes from {@link HolidayCalendarConfig}. The set is read once at
 * construction; a calendar change needs a restart, which matches the yearly update cycle.
 */
@Service
public class BusinessDayCalendar {

    private static final Logger log = LoggerFactory.getLogger(BusinessDayCalendar.class);

    private final Set<LocalDate> holidays;

    public BusinessDayCalendar(HolidayCalendarConfig holidayCalendarConfig) {
        this.holidays = holidayCalendarConfig.getHolidays().stream()
                .map(HolidayCalendarConfig.Holiday::getDate)
                .filter(d -> d != null)
                .collect(Collectors.toUnmodifiableSet());
        log.info("Settlement calendar '{}' loaded with {} holidays", holidayCalendarConfig.getName(), holidays.size());
    }

    /** Saturday and Sunday are never business days. */
    public boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    /** True for weekends and configured holidays. */
    public boolean isHoliday(LocalDate date) {
        return isWeekend(date) || holidays.contains(date);
    }

    public boolean isBusinessDay(LocalDate date) {
        return !isHoliday(date);
    }

    /** Returns the first business day strictly after the given date. */
    public LocalDate getNextBusinessDay(LocalDate from) {
        LocalDate next = from.plusDays(1);
        while (!isBusinessDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /** Returns the last business day strictly before the given date. */
    public LocalDate getPreviousBusinessDay(LocalDate from) {
        LocalDate prev = from.minusDays(1);
        while (!isBusinessDay(prev)) {
            prev = prev.minusDays(1);
        }
        return prev;
    }

    /** Following convention: the date itself if it is a business day, else the next one. */
    public LocalDate adjustToBusinessDay(LocalDate date) {
        return adjust(date, BusinessDayConvention.FOLLOWING);
    }

    public LocalDate adjust(LocalDate date, BusinessDayConvention convention) {
        if (isBusinessDay(date)) {
            return date;
        }
        return switch (convention) {
            case FOLLOWING -> getNextBusinessDay(date);
            case PRECEDING -> getPreviousBusinessDay(date);
            case MODIFIED_FOLLOWING -> {
                LocalDate following = getNextBusinessDay(date);
                yield following.getMonth() == date.getMonth() ? following : getPreviousBusinessDay(date);
            }
        };
    }

    /**
     * Moves {@code n} business days from the given date. Negative {@code n} moves backwards;
     * zero returns the date unchanged even if it is a holiday.
     */
    public LocalDate addBusinessDays(LocalDate from, int n) {
        LocalDate date = from;
        int remaining = Math.abs(n);
        while (remaining > 0) {
            date = n > 0 ? getNextBusinessDay(date) : getPreviousBusinessDay(date);
            remaining--;
        }
        return date;
    }

    /** The business day {@code n} business days before {@code from}. */
    public LocalDate getBusinessDaysAgo(int n, LocalDate from) {
        return addBusinessDays(from, -n);
    }

    /**
     * Counts business days in (from, to]. Negative when {@code to} is before {@code from}.
     */
    public int businessDaysBetween(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            return -businessDaysBetween(to, from);
        }
        int count = 0;
        LocalDate date = from.plusDays(1);
        while (!date.isAfter(to)) {
            if (isBusinessDay(date)) {
                count++;
            }
            date = date.plusDays(1);
        }
        return count;
    }
}
