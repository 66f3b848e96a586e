package com.fxanalytics.domain.model;

import com.fxanalytics.domain.enums.DeltaBucket;
import com.fxanalytics.domain.vo.BidAsk;
import java.util.Optional;
import lombok.Value;

/**
 * Mid-priced reduction of a tenor used for interpolation. Vols are in percent.
 * A missing 25-delta risk reversal or butterfly reduces to 0 (flat smile at that tenor).
 */
@Value
public class SurfacePoint {

    int tenorDays;
    double atm;
    double rr25d;
    double bf25d;

    public static SurfacePoint of(int tenorDays, double atm, double rr25d, double bf25d) {
        return new SurfacePoint(tenorDays, atm, rr25d, bf25d);
    }

    /** Empty when the quote has no ATM mid; such tenors take no part in interpolation. */
    public static Optional<SurfacePoint> from(ValidatedQuote validated) {
        VolatilityQuote quote = validated.getQuote();
        Double atmMid = quote.getAtm().mid();
        if (atmMid == null) {
            return Optional.empty();
        }
        return Optional.of(new SurfacePoint(
                quote.getTenorDays(),
                atmMid,
                midOrZero(quote.getRiskReversal(DeltaBucket.D25)),
                midOrZero(quote.getButterfly(DeltaBucket.D25))));
    }

    private static double midOrZero(BidAsk quote) {
        Double mid = quote.mid();
        return mid != null ? mid : 0.0;
    }
}
