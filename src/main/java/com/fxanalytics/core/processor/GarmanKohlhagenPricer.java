package com.fxanalytics.core.processor;

import com.fxanalytics.domain.enums.OptionType;
import com.fxanalytics.domain.model.OptionRequest;
import com.fxanalytics.domain.model.OptionResult;
import com.fxanalytics.exception.DomainException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.springframework.stereotype.Component;

/**
 * Garman-Kohlhagen valuation of European vanilla FX options: Black-Scholes with the
 * foreign deposit rate playing the role of a continuous dividend yield.
 *
 * <p>Key formulas (rd, rf, sigma as decimals, T in years):
 * <ul>
 *   <li>d1 = [ln(S/K) + (rd - rf + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * e^(-rf T) * N(d1) - K * e^(-rd T) * N(d2)
 *   <li>Put: K * e^(-rd T) * N(-d2) - S * e^(-rf T) * N(-d1)
 *   <li>Delta: e^(-rf T) * N(d1) for calls, e^(-rf T) * (N(d1) - 1) for puts
 *   <li>Gamma: e^(-rf T) * n(d1) / (S * sigma * sqrt(T))
 *   <li>Vega: S * e^(-rf T) * n(d1) * sqrt(T) / 100 (per vol point)
 *   <li>Theta: calendar-day decay, annual formula / 365
 *   <li>Rho: K * T * e^(-rd T) * N(d2) / 100 for calls, -K * T * e^(-rd T) * N(-d2) / 100 for puts
 * </ul>
 *
 * <p>There is no expiry-day special case: T, sigma, S and K must all be strictly positive
 * or a {@link DomainException} is thrown.
 *
 * <p>This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class GarmanKohlhagenPricer {

    private static final double DAYS_PER_YEAR = 365.0;

    private static final double STRIKE_SOLVER_ACCURACY = 1e-10;
    private static final int STRIKE_SOLVER_MAX_EVALUATIONS = 200;

    // Strike bracket half-width for the delta solver, in standard deviations
    private static final double STRIKE_BRACKET_STDEVS = 10.0;

    public OptionResult price(OptionRequest request) {
        validate(request);

        double S = request.getSpot();
        double K = request.getStrike();
        double T = request.getTimeToExpiryYears();
        double rd = request.getDomesticRatePct() / 100.0;
        double rf = request.getForeignRatePct() / 100.0;
        double sigma = request.getVolatilityPct() / 100.0;
        double notional = request.getNotional();
        boolean isCall = request.getOptionType().isCall();

        double sqrtT = Math.sqrt(T);
        double d1 = (Math.log(S / K) + (rd - rf + sigma * sigma / 2.0) * T) / (sigma * sqrtT);
        double d2 = d1 - sigma * sqrtT;

        double foreignDf = Math.exp(-rf * T);
        double domesticDf = Math.exp(-rd * T);
        double nd1 = StandardNormal.pdf(d1);

        double premium;
        double delta;
        double theta;
        double rho;

        if (isCall) {
            double Nd1 = StandardNormal.cdf(d1);
            double Nd2 = StandardNormal.cdf(d2);
            premium = S * foreignDf * Nd1 - K * domesticDf * Nd2;
            delta = foreignDf * Nd1;
            theta = (-S * foreignDf * nd1 * sigma / (2.0 * sqrtT) + rf * S * foreignDf * Nd1 - rd * K * domesticDf * Nd2)
                    / DAYS_PER_YEAR;
            rho = K * T * domesticDf * Nd2 / 100.0;
        } else {
            double NminusD1 = StandardNormal.cdf(-d1);
            double NminusD2 = StandardNormal.cdf(-d2);
            premium = K * domesticDf * NminusD2 - S * foreignDf * NminusD1;
            delta = foreignDf * (StandardNormal.cdf(d1) - 1.0);
            theta = (-S * foreignDf * nd1 * sigma / (2.0 * sqrtT)
                            - rf * S * foreignDf * NminusD1
                            + rd * K * domesticDf * NminusD2)
                    / DAYS_PER_YEAR;
            rho = -K * T * domesticDf * NminusD2 / 100.0;
        }

        // Gamma and vega are the same for calls and puts
        double gamma = foreignDf * nd1 / (S * sigma * sqrtT);
        double vega = S * foreignDf * nd1 * sqrtT / 100.0;

        double intrinsic = Math.max(0.0, isCall ? S - K : K - S);
        double forward = forward(S, T, rd, rf);

        log.debug(
                "GK {} S={} K={} T={} vol={}% -> premium={} delta={}",
                request.getOptionType(),
                S,
                K,
                T,
                request.getVolatilityPct(),
                premium,
                delta);

        return OptionResult.builder()
                .premium(premium * notional)
                .premiumPercentOfSpot(premium / S * 100.0)
                .deltaPercent(delta * 100.0)
                .deltaNotional(delta * notional)
                .gammaPer1PctSpot(gamma * 100.0)
                .gammaNotional(gamma * notional)
                .vegaPer1PctVol(vega)
                .vegaNotional(vega * notional)
                .thetaPerDay(theta)
                .thetaNotional(theta * notional)
                .rhoPer1PctRate(rho)
                .rhoNotional(rho * notional)
                .forward(forward)
                .intrinsicValue(intrinsic * notional)
                .timeValue((premium - intrinsic) * notional)
                .d1(d1)
                .d2(d2)
                .build();
    }

    /**
     * Outright forward by covered interest parity: S * e^((rd - rf) * T). Rates in percent.
     */
    public double forwardRate(double spot, double timeToExpiryYears, double domesticRatePct, double foreignRatePct) {
        if (spot <= 0 || timeToExpiryYears < 0) {
            throw new DomainException("Forward requires spot > 0 and T >= 0");
        }
        return forward(spot, timeToExpiryYears, domesticRatePct / 100.0, foreignRatePct / 100.0);
    }

    /**
     * Finds the strike whose spot delta equals {@code targetDelta} (decimal, negative for
     * puts, e.g. -0.25). Delta is monotone in strike, so a bracketing Brent search over
     * +/- 10 standard deviations around the forward always converges when the target is
     * attainable.
     *
     * @throws DomainException if the target delta is unreachable for the option type
     */
    public double strikeFromDelta(
            double targetDelta,
            double spot,
            double timeToExpiryYears,
            double domesticRatePct,
            double foreignRatePct,
            double volatilityPct,
            OptionType optionType) {

        double T = timeToExpiryYears;
        double rf = foreignRatePct / 100.0;
        double sigma = volatilityPct / 100.0;
        double maxAbsDelta = Math.exp(-rf * T);

        boolean reachable = optionType.isCall()
                ? targetDelta > 0 && targetDelta < maxAbsDelta
                : targetDelta < 0 && targetDelta > -maxAbsDelta;
        if (!reachable) {
            throw new DomainException(
                    "Delta " + targetDelta + " is not attainable for a " + optionType + " (|delta| < " + maxAbsDelta + ")");
        }

        UnivariateFunction deltaGap = strike -> spotDelta(
                        spot, strike, T, domesticRatePct, foreignRatePct, volatilityPct, optionType)
                - targetDelta;

        double fwd = forwardRate(spot, T, domesticRatePct, foreignRatePct);
        double width = STRIKE_BRACKET_STDEVS * sigma * Math.sqrt(T);
        double lower = fwd * Math.exp(-width);
        double upper = fwd * Math.exp(width);

        try {
            return new BrentSolver(STRIKE_SOLVER_ACCURACY).solve(STRIKE_SOLVER_MAX_EVALUATIONS, deltaGap, lower, upper);
        } catch (MathIllegalArgumentException | TooManyEvaluationsException e) {
            throw new DomainException("Strike solve failed for delta " + targetDelta + ": " + e.getMessage());
        }
    }

    private double spotDelta(
            double spot,
            double strike,
            double T,
            double domesticRatePct,
            double foreignRatePct,
            double volatilityPct,
            OptionType optionType) {
        OptionResult result = price(OptionRequest.builder()
                .spot(spot)
                .strike(strike)
                .timeToExpiryYears(T)
                .domesticRatePct(domesticRatePct)
                .foreignRatePct(foreignRatePct)
                .volatilityPct(volatilityPct)
                .optionType(optionType)
                .build());
        return result.getDeltaPercent() / 100.0;
    }

    private static double forward(double spot, double T, double rd, double rf) {
        return spot * Math.exp((rd - rf) * T);
    }

    private static void validate(OptionRequest request) {
        Map<String, Object> violations = new LinkedHashMap<>();
        if (!(request.getSpot() > 0)) {
            violations.put("spot", request.getSpot());
        }
        if (!(request.getStrike() > 0)) {
            violations.put("strike", request.getStrike());
        }
        if (!(request.getTimeToExpiryYears() > 0)) {
            violations.put("timeToExpiryYears", request.getTimeToExpiryYears());
        }
        if (!(request.getVolatilityPct() > 0)) {
            violations.put("volatilityPct", request.getVolatilityPct());
        }
        if (request.getOptionType() == null) {
            violations.put("optionType", "missing");
        }
        if (!violations.isEmpty()) {
            throw new DomainException("Invalid pricing inputs: " + violations.keySet(), violations);
        }
    }
}
