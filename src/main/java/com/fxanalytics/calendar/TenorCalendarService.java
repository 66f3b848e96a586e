package com.fxanalytics.calendar;

import com.fxanalytics.domain.vo.Tenor;
import com.fxanalytics.exception.DomainException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Service;

/**
 * Turns nominal tenors into concrete FX dates.
 *
 * <p>Spot is trade date plus the spot lag in business days (T+2 for most pairs).
 * Tenor expiries roll the tenor period from spot and adjust with modified following,
 * except overnight, which is simply the next business day after the trade date.
 * Year fractions are ACT/365, the same basis the surface interpolator uses.
 */
@Service
public class TenorCalendarService {

    static final double DAYS_PER_YEAR = 365.0;

    private final BusinessDayCalendar businessDayCalendar;
    private final int spotLagDays;

    public TenorCalendarService(BusinessDayCalendar businessDayCalendar, HolidayCalendarConfig holidayCalendarConfig) {
        this.businessDayCalendar = businessDayCalendar;
        this.spotLagDays = holidayCalendarConfig.getSpotLagDays();
    }

    public LocalDate spotDate(LocalDate tradeDate) {
        return businessDayCalendar.addBusinessDays(businessDayCalendar.adjustToBusinessDay(tradeDate), spotLagDays);
    }

    public LocalDate expiryDate(LocalDate tradeDate, String tenorLabel) {
        return expiryDate(tradeDate, Tenor.parse(tenorLabel));
    }

    public LocalDate expiryDate(LocalDate tradeDate, Tenor tenor) {
        if (tenor.isOvernight()) {
            return businessDayCalendar.getNextBusinessDay(tradeDate);
        }
        LocalDate unadjusted = spotDate(tradeDate).plus(tenor.getPeriod());
        return businessDayCalendar.adjust(unadjusted, BusinessDayConvention.MODIFIED_FOLLOWING);
    }

    /** Calendar days from trade date to the tenor's adjusted expiry. */
    public int daysToExpiry(LocalDate tradeDate, String tenorLabel) {
        return (int) ChronoUnit.DAYS.between(tradeDate, expiryDate(tradeDate, tenorLabel));
    }

    /** ACT/365 year fraction. Rejects expiries on or before the trade date. */
    public double yearFraction(LocalDate tradeDate, LocalDate expiry) {
        long days = ChronoUnit.DAYS.between(tradeDate, expiry);
        if (days <= 0) {
            throw new DomainException("Expiry " + expiry + " is not after trade date " + tradeDate);
        }
        return days / DAYS_PER_YEAR;
    }
}
