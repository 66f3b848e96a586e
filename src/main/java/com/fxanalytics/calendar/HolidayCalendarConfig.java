package com.fxanalytics.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the settlement calendar, loaded from application.yml via
 * the {@code fx-calendar} prefix.
 *
 * <p>The holiday list is a fixed set of non-settlement dates for the pair's two currency
 * centres. It is maintained by hand once a year; weekends are handled separately by
 * {@link BusinessDayCalendar} and must not be listed here.
 */
@Component
@ConfigurationProperties(prefix = "fx-calendar")
public class HolidayCalendarConfig {

    private String name = "EURUSD";
    private int spotLagDays = 2;
    private List<Holiday> holidays = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getSpotLagDays() {
        return spotLagDays;
    }

    public void setSpotLagDays(int spotLagDays) {
        this.spotLagDays = spotLagDays;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    /**
     * A single holiday entry on the settlement calendar.
     */
    public static class Holiday {

        private LocalDate date;
        private String name;

        public Holiday() {}

        public Holiday(LocalDate date, String name) {
            this.date = date;
            this.name = name;
        }

        public LocalDate getDate() {
            return date;
        }

        public void setDate(LocalDate date) {
            this.date = date;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
