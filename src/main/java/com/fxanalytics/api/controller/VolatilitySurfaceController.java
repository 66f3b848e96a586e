package com.fxanalytics.api.controller;

import com.fxanalytics.core.processor.SurfaceInterpolator;
import com.fxanalytics.domain.model.QualitySummary;
import com.fxanalytics.domain.model.SurfacePoint;
import com.fxanalytics.domain.model.ValidatedQuote;
import com.fxanalytics.exception.TransientProviderException;
import com.fxanalytics.resilience.CircuitBreakerState;
import com.fxanalytics.service.MarketDataGateway;
import com.fxanalytics.service.VolatilitySurfaceService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for volatility surfaces and provider status.
 *
 * <ul>
 *   <li>GET /api/vol-surface/{pair}?tenors=1M,3M -- validated quotes per tenor
 *   <li>GET /api/vol-surface/{pair}/quality -- quality summary for the dashboard
 *   <li>GET /api/vol-surface/{pair}/volatility?strike&spot&days -- interpolated vol
 *   <li>GET /api/vol-surface/provider/circuit-breaker -- breaker snapshot
 *   <li>GET /api/vol-surface/provider/health -- provider health check, with recovery
 * </ul>
 */
@RestController
@RequestMapping("/api/vol-surface")
public class VolatilitySurfaceController {

    private final VolatilitySurfaceService volatilitySurfaceService;
    private final SurfaceInterpolator surfaceInterpolator;
    private final MarketDataGateway marketDataGateway;

    public VolatilitySurfaceController(
            VolatilitySurfaceService volatilitySurfaceService,
            SurfaceInterpolator surfaceInterpolator,
            MarketDataGateway marketDataGateway) {
        this.volatilitySurfaceService = volatilitySurfaceService;
        this.surfaceInterpolator = surfaceInterpolator;
        this.marketDataGateway = marketDataGateway;
    }

    @GetMapping("/provider/circuit-breaker")
    public CircuitBreakerState getCircuitBreaker() {
        return marketDataGateway.getCircuitBreakerState();
    }

    @GetMapping("/provider/health")
    public Map<String, Object> getProviderHealth() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("healthy", marketDataGateway.checkHealth());
        health.put("circuitBreaker", marketDataGateway.getCircuitBreakerState());
        return health;
    }

    @GetMapping("/{pair}")
    public List<ValidatedQuote> getSurface(
            @PathVariable String pair, @RequestParam(required = false) List<String> tenors) {
        return volatilitySurfaceService.getVolatilitySurface(pair, tenors);
    }

    @GetMapping("/{pair}/quality")
    public QualitySummary getQuality(@PathVariable String pair, @RequestParam(required = false) List<String> tenors) {
        return volatilitySurfaceService.getQualitySummary(pair, tenors);
    }

    @GetMapping("/{pair}/volatility")
    public Map<String, Object> getVolatility(
            @PathVariable String pair,
            @RequestParam double strike,
            @RequestParam double spot,
            @RequestParam double days) {
        List<SurfacePoint> points = volatilitySurfaceService.getSurfacePoints(pair, null);
        if (points.isEmpty()) {
            throw new TransientProviderException("No ATM volatility available for " + pair);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pair", pair.toUpperCase(Locale.ROOT));
        body.put("strike", strike);
        body.put("spot", spot);
        body.put("days", days);
        body.put("volatility", surfaceInterpolator.volatilityAt(strike, spot, days, points));
        body.put("atmVolatility", surfaceInterpolator.atmVolatilityAt(days, points));
        return body;
    }
}
