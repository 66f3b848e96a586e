package com.fxanalytics.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fxanalytics.domain.vo.Tenor;
import com.fxanalytics.exception.DomainException;
import java.time.Period;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TenorTest {

    @ParameterizedTest(name = "{0} -> {1} days")
    @CsvSource({"ON, 1", "TN, 2", "SN, 3", "5D, 5", "1W, 7", "3W, 21", "1M, 30", "6M, 180", "18M, 540", "1Y, 365", "2Y, 730"})
    @DisplayName("Nominal day counts follow W=7n, M=30n, Y=365n")
    void nominalDays(String label, int days) {
        assertThat(Tenor.parse(label).getNominalDays()).isEqualTo(days);
    }

    @Test
    @DisplayName("Labels are trimmed and upper-cased")
    void normalizesLabel() {
        Tenor tenor = Tenor.parse(" 3m ");

        assertThat(tenor.getLabel()).isEqualTo("3M");
        assertThat(tenor.getPeriod()).isEqualTo(Period.ofMonths(3));
    }

    @Test
    @DisplayName("Only ON is overnight")
    void overnight() {
        assertThat(Tenor.parse("ON").isOvernight()).isTrue();
        assertThat(Tenor.parse("TN").isOvernight()).isFalse();
        assertThat(Tenor.parse("1W").isOvernight()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "1Q", "M1", "0M", "-1M", "ONE"})
    @DisplayName("Malformed or non-positive labels are rejected")
    void rejectsInvalid(String label) {
        assertThatThrownBy(() -> Tenor.parse(label)).isInstanceOf(DomainException.class);
    }

    @Test
    @DisplayName("Null label is rejected")
    void rejectsNull() {
        assertThatThrownBy(() -> Tenor.parse(null))
                .isInstanceOf(DomainException.class)
                .hasMessage("Tenor label is required");
    }

    @Test
    @DisplayName("Tenors order by nominal days")
    void ordering() {
        List<Tenor> tenors = new ArrayList<>(List.of(Tenor.parse("1Y"), Tenor.parse("1W"), Tenor.parse("18M")));
        Collections.sort(tenors);

        assertThat(tenors).extracting(Tenor::getLabel).containsExactly("1W", "1Y", "18M");
    }

    @Test
    @DisplayName("Standard ladder runs from ON to 2Y in ascending order")
    void standardLadder() {
        List<Tenor> ladder = Tenor.standardLadder();

        assertThat(ladder).hasSize(13);
        assertThat(ladder.get(0).getLabel()).isEqualTo("ON");
        assertThat(ladder.get(ladder.size() - 1).getLabel()).isEqualTo("2Y");
        assertThat(ladder).isSorted();
    }
}
