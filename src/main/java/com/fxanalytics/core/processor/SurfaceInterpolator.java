package com.fxanalytics.core.processor;

import com.fxanalytics.domain.model.SurfacePoint;
import com.fxanalytics.exception.DomainException;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Volatility at an arbitrary strike and expiry from a tenor-indexed surface.
 *
 * <p>Two stages:
 * <ol>
 *   <li><b>Term structure</b>: ATM vol between the bracketing tenors is interpolated
 *       linearly in total variance (sigma^2 * T / 365), then converted back to an
 *       annualized vol. Outside the quoted range the nearest endpoint is returned as is.
 *   <li><b>Smile</b>: the 25-delta wing vols implied by the nearest tenor's risk reversal
 *       and butterfly (atm + bf +/- rr/2) are blended with ATM according to how far an
 *       approximate delta sits from 0.5. The weight reaches 1 at the 25-delta distance and
 *       is clipped there.
 * </ol>
 *
 * <p>The smile stage is a coarse market-convention approximation, not a fitted smile: the
 * delta estimate comes from log-moneyness and ATM vol only and is not solved
 * self-consistently. Treat strike-dependent output as indicative.
 *
 * <p>Inputs and outputs are vol percentages; time is in calendar days.
 */
@Slf4j
@Component
public class SurfaceInterpolator {

    private static final double DAYS_PER_YEAR = 365.0;

    // |delta - 0.5| at the 25-delta pillar
    private static final double WING_DELTA_DISTANCE = 0.25;

    /**
     * Smile-adjusted volatility for the given strike and expiry.
     *
     * @throws DomainException on an empty surface or non-positive strike, spot or time
     */
    public double volatilityAt(double strike, double spot, double timeToExpiryDays, List<SurfacePoint> surface) {
        if (!(strike > 0) || !(spot > 0)) {
            throw new DomainException("Strike and spot must be positive");
        }
        List<SurfacePoint> sorted = sortedSurface(surface, timeToExpiryDays);

        double atm = interpolateAtm(sorted, timeToExpiryDays);
        if (sorted.size() == 1) {
            return atm;
        }

        SurfacePoint nearest = nearestTenor(sorted, timeToExpiryDays);
        return applySmile(atm, nearest, strike, spot, timeToExpiryDays);
    }

    /**
     * ATM volatility at the given expiry, interpolated in variance space between the
     * bracketing tenors and flat-extrapolated beyond the ends.
     */
    public double atmVolatilityAt(double timeToExpiryDays, List<SurfacePoint> surface) {
        return interpolateAtm(sortedSurface(surface, timeToExpiryDays), timeToExpiryDays);
    }

    private double interpolateAtm(List<SurfacePoint> sorted, double t) {
        SurfacePoint first = sorted.get(0);
        SurfacePoint last = sorted.get(sorted.size() - 1);
        if (t <= first.getTenorDays()) {
            return first.getAtm();
        }
        if (t >= last.getTenorDays()) {
            return last.getAtm();
        }

        SurfacePoint lower = first;
        SurfacePoint upper = last;
        for (int i = 0; i < sorted.size() - 1; i++) {
            SurfacePoint a = sorted.get(i);
            SurfacePoint b = sorted.get(i + 1);
            if (a.getTenorDays() == t) {
                return a.getAtm();
            }
            if (a.getTenorDays() < t && t <= b.getTenorDays()) {
                lower = a;
                upper = b;
                break;
            }
        }
        if (upper.getTenorDays() == t) {
            return upper.getAtm();
        }

        double lowerVariance = totalVariance(lower.getAtm(), lower.getTenorDays());
        double upperVariance = totalVariance(upper.getAtm(), upper.getTenorDays());
        double weight = (t - lower.getTenorDays()) / (double) (upper.getTenorDays() - lower.getTenorDays());
        double variance = lowerVariance + weight * (upperVariance - lowerVariance);

        log.debug(
                "ATM interpolation t={}d between {}d ({}%) and {}d ({}%), weight={}",
                t,
                lower.getTenorDays(),
                lower.getAtm(),
                upper.getTenorDays(),
                upper.getAtm(),
                weight);

        return Math.sqrt(variance * DAYS_PER_YEAR / t);
    }

    private double applySmile(double atm, SurfacePoint nearest, double strike, double spot, double t) {
        double moneyness = Math.log(strike / spot);
        double stdDev = atm / 100.0 * Math.sqrt(t / DAYS_PER_YEAR);
        if (moneyness == 0.0 || !(stdDev > 0)) {
            return atm;
        }

        double rr = nearest.getRr25d();
        double bf = nearest.getBf25d();
        double vol25Call = atm + bf + rr / 2.0;
        double vol25Put = atm + bf - rr / 2.0;

        double approxDelta = 1.0 - StandardNormal.cdf(-moneyness / stdDev);
        double weight = Math.min(1.0, Math.max(0.0, Math.abs(approxDelta - 0.5) / WING_DELTA_DISTANCE));
        double wing = moneyness > 0 ? vol25Call : vol25Put;

        return atm + weight * (wing - atm);
    }

    private static SurfacePoint nearestTenor(List<SurfacePoint> sorted, double t) {
        return sorted.stream()
                .min(Comparator.comparingDouble(p -> Math.abs(p.getTenorDays() - t)))
                .orElseThrow();
    }

    private static double totalVariance(double volPct, int tenorDays) {
        return volPct * volPct * tenorDays / DAYS_PER_YEAR;
    }

    private static List<SurfacePoint> sortedSurface(List<SurfacePoint> surface, double t) {
        if (surface == null || surface.isEmpty()) {
            throw new DomainException("Cannot interpolate an empty volatility surface");
        }
        if (!(t > 0)) {
            throw new DomainException("Time to expiry must be positive, got " + t + " days");
        }
        return surface.stream()
                .sorted(Comparator.comparingInt(SurfacePoint::getTenorDays))
                .toList();
    }
}
