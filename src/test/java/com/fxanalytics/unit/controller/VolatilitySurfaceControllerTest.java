package com.fxanalytics.unit.controller;

import static org.hamcrest.Matchers.closeTo;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fxanalytics.api.controller.VolatilitySurfaceController;
import com.fxanalytics.config.ApiResponseAdvice;
import com.fxanalytics.core.processor.QuoteValidator;
import com.fxanalytics.core.processor.SurfaceInterpolator;
import com.fxanalytics.domain.enums.CircuitState;
import com.fxanalytics.domain.enums.DeltaBucket;
import com.fxanalytics.domain.model.QualitySummary;
import com.fxanalytics.domain.model.SurfacePoint;
import com.fxanalytics.domain.model.VolatilityQuote;
import com.fxanalytics.domain.vo.BidAsk;
import com.fxanalytics.exception.CircuitOpenException;
import com.fxanalytics.exception.DomainException;
import com.fxanalytics.exception.GlobalExceptionHandler;
import com.fxanalytics.resilience.CircuitBreakerState;
import com.fxanalytics.service.MarketDataGateway;
import com.fxanalytics.service.VolatilitySurfaceService;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class VolatilitySurfaceControllerTest {

    private MockMvc mockMvc;

    @Mock
    private VolatilitySurfaceService volatilitySurfaceService;

    @Mock
    private MarketDataGateway marketDataGateway;

    @BeforeEach
    void setUp() {
        VolatilitySurfaceController controller =
                new VolatilitySurfaceController(volatilitySurfaceService, new SurfaceInterpolator(), marketDataGateway);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/vol-surface/{pair} passes the tenor list through")
    void getSurface() throws Exception {
        VolatilityQuote quote = VolatilityQuote.builder()
                .tenorLabel("1M")
                .tenorDays(35)
                .atm(BidAsk.of(7.2, 7.4))
                .riskReversal(DeltaBucket.D25, BidAsk.of(-0.5, -0.3))
                .build();
        QuoteValidator validator = new QuoteValidator(Clock.systemUTC(), 300_000, 70);
        when(volatilitySurfaceService.getVolatilitySurface("EURUSD", List.of("1M", "3M")))
                .thenReturn(List.of(validator.validate(quote)));

        mockMvc.perform(get("/api/vol-surface/EURUSD").param("tenors", "1M,3M"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].quote.tenorLabel").value("1M"))
                .andExpect(jsonPath("$.data[0].quote.atm.bid").value(7.2))
                .andExpect(jsonPath("$.data[0].quality.completenessScore").value(18))
                .andExpect(jsonPath("$.data[0].complete").value(false));
    }

    @Test
    @DisplayName("GET /api/vol-surface/{pair}/quality returns the summary")
    void getQuality() throws Exception {
        when(volatilitySurfaceService.getQualitySummary("GBPUSD", null))
                .thenReturn(QualitySummary.builder()
                        .overallScore(68)
                        .completeRecords(1)
                        .totalRecords(2)
                        .averageCompleteness(50.0)
                        .criticalWarnings(List.of("Critical field 'atm_bid' is missing"))
                        .build());

        mockMvc.perform(get("/api/vol-surface/GBPUSD/quality"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.overallScore").value(68))
                .andExpect(jsonPath("$.data.criticalWarnings[0]").value("Critical field 'atm_bid' is missing"));
    }

    @Test
    @DisplayName("GET /api/vol-surface/{pair}/volatility interpolates between tenors")
    void getVolatility() throws Exception {
        when(volatilitySurfaceService.getSurfacePoints("eurusd", null))
                .thenReturn(List.of(SurfacePoint.of(30, 7.0, 0.0, 0.0), SurfacePoint.of(90, 9.0, 0.0, 0.0)));

        mockMvc.perform(get("/api/vol-surface/eurusd/volatility")
                        .param("strike", "1.085")
                        .param("spot", "1.085")
                        .param("days", "60"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pair").value("EURUSD"))
                .andExpect(jsonPath("$.data.volatility").value(closeTo(Math.sqrt(73.0), 1e-9)))
                .andExpect(jsonPath("$.data.atmVolatility").value(closeTo(Math.sqrt(73.0), 1e-9)));
    }

    @Test
    @DisplayName("An empty surface is a 503")
    void emptySurface() throws Exception {
        when(volatilitySurfaceService.getSurfacePoints("EURUSD", null)).thenReturn(List.of());

        mockMvc.perform(get("/api/vol-surface/EURUSD/volatility")
                        .param("strike", "1.085")
                        .param("spot", "1.085")
                        .param("days", "60"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.message").value("No ATM volatility available for EURUSD"));
    }

    @Test
    @DisplayName("An open provider breaker is a 503 with Retry-After")
    void circuitOpen() throws Exception {
        when(volatilitySurfaceService.getSurfacePoints("EURUSD", null))
                .thenThrow(new CircuitOpenException("marketDataProvider", 1500));

        mockMvc.perform(get("/api/vol-surface/EURUSD/volatility")
                        .param("strike", "1.085")
                        .param("spot", "1.085")
                        .param("days", "60"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "2"))
                .andExpect(jsonPath("$.error.code").value("PROVIDER_UNAVAILABLE"))
                .andExpect(jsonPath("$.error.details.retryAfterMs").value(1500))
                .andExpect(jsonPath("$.error.details.breaker").value("marketDataProvider"));
    }

    @Test
    @DisplayName("A malformed pair is a 400")
    void badPair() throws Exception {
        when(volatilitySurfaceService.getVolatilitySurface("EUR", null))
                .thenThrow(new DomainException("Currency pair must be six letters, e.g. EURUSD: EUR"));

        mockMvc.perform(get("/api/vol-surface/EUR"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("GET /api/vol-surface/provider/circuit-breaker returns the breaker snapshot")
    void getCircuitBreaker() throws Exception {
        when(marketDataGateway.getCircuitBreakerState())
                .thenReturn(CircuitBreakerState.builder()
                        .name("marketDataProvider")
                        .state(CircuitState.OPEN)
                        .failureCount(5)
                        .threshold(5)
                        .cooldownMs(60_000)
                        .build());

        mockMvc.perform(get("/api/vol-surface/provider/circuit-breaker"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("marketDataProvider"))
                .andExpect(jsonPath("$.data.state").value("OPEN"))
                .andExpect(jsonPath("$.data.failureCount").value(5));
    }

    @Test
    @DisplayName("GET /api/vol-surface/provider/health reports health with the breaker state")
    void getProviderHealth() throws Exception {
        when(marketDataGateway.checkHealth()).thenReturn(true);
        when(marketDataGateway.getCircuitBreakerState())
                .thenReturn(CircuitBreakerState.builder()
                        .name("marketDataProvider")
                        .state(CircuitState.CLOSED)
                        .threshold(5)
                        .cooldownMs(60_000)
                        .build());

        mockMvc.perform(get("/api/vol-surface/provider/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.healthy").value(true))
                .andExpect(jsonPath("$.data.circuitBreaker.state").value("CLOSED"));

        verify(marketDataGateway).checkHealth();
    }
}
