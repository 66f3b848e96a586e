package com.fxanalytics.unit.core.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fxanalytics.core.processor.SurfaceInterpolator;
import com.fxanalytics.domain.model.SurfacePoint;
import com.fxanalytics.exception.DomainException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SurfaceInterpolatorTest {

    private static final double SPOT = 1.1742;

    private SurfaceInterpolator interpolator;

    @BeforeEach
    void setUp() {
        interpolator = new SurfaceInterpolator();
    }

    @Nested
    @DisplayName("Term structure")
    class TermStructure {

        private final List<SurfacePoint> surface = List.of(
                SurfacePoint.of(90, 9.0, -0.8, 0.25),
                SurfacePoint.of(30, 7.0, -0.5, 0.20),
                SurfacePoint.of(365, 9.5, -1.0, 0.30));

        @Test
        @DisplayName("At an existing tenor the ATM vol is returned unchanged")
        void identityAtTenor() {
            assertThat(interpolator.atmVolatilityAt(90, surface)).isEqualTo(9.0);
            assertThat(interpolator.volatilityAt(SPOT, SPOT, 30, surface)).isEqualTo(7.0);
        }

        @Test
        @DisplayName("Interpolation is linear in total variance")
        void varianceSpace() {
            // (7^2*30 + 9^2*90) / 2 / 365 total variance at 60 days -> sqrt(73)
            assertThat(interpolator.atmVolatilityAt(60, surface)).isCloseTo(Math.sqrt(73.0), within(1e-12));
        }

        @Test
        @DisplayName("A flat term structure stays flat between tenors")
        void flat() {
            List<SurfacePoint> flat = List.of(SurfacePoint.of(30, 8.2, 0, 0), SurfacePoint.of(180, 8.2, 0, 0));

            assertThat(interpolator.atmVolatilityAt(47.5, flat)).isCloseTo(8.2, within(1e-12));
            assertThat(interpolator.atmVolatilityAt(121, flat)).isCloseTo(8.2, within(1e-12));
        }

        @Test
        @DisplayName("Outside the quoted range the nearest endpoint is used")
        void clampsToEndpoints() {
            assertThat(interpolator.atmVolatilityAt(3, surface)).isEqualTo(7.0);
            assertThat(interpolator.atmVolatilityAt(720, surface)).isEqualTo(9.5);
        }

        @Test
        @DisplayName("Input order does not matter")
        void orderIndependent() {
            List<SurfacePoint> sorted = List.of(surface.get(1), surface.get(0), surface.get(2));

            assertThat(interpolator.volatilityAt(1.20, SPOT, 200, surface))
                    .isEqualTo(interpolator.volatilityAt(1.20, SPOT, 200, sorted));
        }
    }

    @Nested
    @DisplayName("Smile")
    class Smile {

        // puts over calls: rr < 0
        private final List<SurfacePoint> surface =
                List.of(SurfacePoint.of(30, 7.5, -1.0, 0.3), SurfacePoint.of(90, 8.0, -1.2, 0.35));

        @Test
        @DisplayName("ATM strike gets the ATM vol")
        void atmStrike() {
            assertThat(interpolator.volatilityAt(SPOT, SPOT, 30, surface)).isEqualTo(7.5);
        }

        @Test
        @DisplayName("Far OTM call strike reaches the 25-delta call wing")
        void farCallWing() {
            double vol = interpolator.volatilityAt(SPOT * 1.2, SPOT, 30, surface);

            // atm + bf + rr/2
            assertThat(vol).isCloseTo(7.5 + 0.3 - 0.5, within(1e-12));
        }

        @Test
        @DisplayName("Far OTM put strike reaches the 25-delta put wing")
        void farPutWing() {
            double vol = interpolator.volatilityAt(SPOT / 1.2, SPOT, 30, surface);

            // atm + bf - rr/2
            assertThat(vol).isCloseTo(7.5 + 0.3 + 0.5, within(1e-12));
        }

        @Test
        @DisplayName("Near-the-money strikes blend part of the way to the wing")
        void partialBlend() {
            double vol = interpolator.volatilityAt(SPOT * 0.995, SPOT, 30, surface);

            assertThat(vol).isGreaterThan(7.5).isLessThan(7.5 + 0.3 + 0.5);
        }

        @Test
        @DisplayName("A single-point surface returns its ATM vol with no smile")
        void singlePoint() {
            List<SurfacePoint> single = List.of(SurfacePoint.of(30, 7.5, -1.0, 0.3));

            assertThat(interpolator.volatilityAt(SPOT * 1.2, SPOT, 45, single)).isEqualTo(7.5);
        }
    }

    @Nested
    @DisplayName("Invalid input")
    class InvalidInput {

        @Test
        @DisplayName("An empty surface cannot be interpolated")
        void emptySurface() {
            assertThatThrownBy(() -> interpolator.volatilityAt(SPOT, SPOT, 30, List.of()))
                    .isInstanceOf(DomainException.class)
                    .hasMessageContaining("empty");
            assertThatThrownBy(() -> interpolator.atmVolatilityAt(30, null)).isInstanceOf(DomainException.class);
        }

        @Test
        @DisplayName("Non-positive time, strike or spot is rejected")
        void nonPositiveInputs() {
            List<SurfacePoint> surface = List.of(SurfacePoint.of(30, 7.5, 0, 0));

            assertThatThrownBy(() -> interpolator.volatilityAt(SPOT, SPOT, 0, surface))
                    .isInstanceOf(DomainException.class);
            assertThatThrownBy(() -> interpolator.volatilityAt(0, SPOT, 30, surface))
                    .isInstanceOf(DomainException.class);
            assertThatThrownBy(() -> interpolator.volatilityAt(SPOT, -1, 30, surface))
                    .isInstanceOf(DomainException.class);
        }
    }
}
