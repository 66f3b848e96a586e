package com.fxanalytics.unit.calendar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fxanalytics.calendar.BusinessDayCalendar;
import com.fxanalytics.calendar.HolidayCalendarConfig;
import com.fxanalytics.calendar.TenorCalendarService;
import com.fxanalytics.domain.vo.Tenor;
import com.fxanalytics.exception.DomainException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TenorCalendarServiceTest {

    private TenorCalendarService service;

    @BeforeEach
    void setUp() {
        HolidayCalendarConfig config = new HolidayCalendarConfig();
        config.setSpotLagDays(2);
        config.setHolidays(List.of(new HolidayCalendarConfig.Holiday(LocalDate.of(2026, 12, 25), "Christmas Day")));
        service = new TenorCalendarService(new BusinessDayCalendar(config), config);
    }

    @Nested
    @DisplayName("Spot date")
    class Spot {

        @Test
        @DisplayName("Spot is two business days after a midweek trade date")
        void midweek() {
            assertThat(service.spotDate(LocalDate.of(2026, 5, 18))).isEqualTo(LocalDate.of(2026, 5, 20));
        }

        @Test
        @DisplayName("Spot skips the weekend after a Friday trade")
        void friday() {
            assertThat(service.spotDate(LocalDate.of(2026, 5, 29))).isEqualTo(LocalDate.of(2026, 6, 2));
        }

        @Test
        @DisplayName("Spot skips holidays")
        void holiday() {
            assertThat(service.spotDate(LocalDate.of(2026, 12, 23))).isEqualTo(LocalDate.of(2026, 12, 28));
        }
    }

    @Nested
    @DisplayName("Tenor expiry")
    class Expiry {

        @Test
        @DisplayName("Overnight expires the next business day after the trade date")
        void overnight() {
            assertThat(service.expiryDate(LocalDate.of(2026, 12, 24), "ON")).isEqualTo(LocalDate.of(2026, 12, 28));
        }

        @Test
        @DisplayName("One week rolls seven days from spot")
        void oneWeek() {
            LocalDate trade = LocalDate.of(2026, 5, 18);

            assertThat(service.expiryDate(trade, "1W")).isEqualTo(LocalDate.of(2026, 5, 27));
            assertThat(service.daysToExpiry(trade, "1W")).isEqualTo(9);
        }

        @Test
        @DisplayName("Month-end expiry on a weekend rolls back under modified following")
        void oneMonthModifiedFollowing() {
            LocalDate trade = LocalDate.of(2026, 4, 28);

            assertThat(service.expiryDate(trade, Tenor.parse("1M"))).isEqualTo(LocalDate.of(2026, 5, 29));
            assertThat(service.daysToExpiry(trade, "1m")).isEqualTo(31);
        }

        @Test
        @DisplayName("Unknown tenor labels are rejected")
        void unknownTenor() {
            assertThatThrownBy(() -> service.expiryDate(LocalDate.of(2026, 5, 18), "1Q"))
                    .isInstanceOf(DomainException.class);
        }
    }

    @Nested
    @DisplayName("Year fraction")
    class YearFraction {

        @Test
        @DisplayName("ACT/365 day count")
        void act365() {
            assertThat(service.yearFraction(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 4, 1)))
                    .isCloseTo(90 / 365.0, within(1e-12));
        }

        @Test
        @DisplayName("Expiry on or before the trade date is rejected")
        void notAfterTradeDate() {
            LocalDate trade = LocalDate.of(2026, 5, 18);

            assertThatThrownBy(() -> service.yearFraction(trade, trade))
                    .isInstanceOf(DomainException.class)
                    .hasMessageContaining("is not after trade date");
            assertThatThrownBy(() -> service.yearFraction(trade, trade.minusDays(3)))
                    .isInstanceOf(DomainException.class);
        }
    }
}
