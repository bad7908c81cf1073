package com.tradeguard.risk.util;

import com.tradeguard.risk.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ReturnSeriesTest {

    @Test
    void derivesSimpleReturnsFromPrices() {
        List<Double> returns = ReturnSeries.fromPrices(List.of(100.0, 110.0, 99.0));

        assertThat(returns).hasSize(2);
        assertThat(returns.get(0)).isCloseTo(0.10, within(1e-12));
        assertThat(returns.get(1)).isCloseTo(-0.10, within(1e-12));
    }

    @Test
    void rejectsNonPositivePrices() {
        assertThatThrownBy(() -> ReturnSeries.fromPrices(List.of(100.0, 0.0, 50.0)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("prices[1]");
    }

    @Test
    void tailKeepsMostRecentValues() {
        List<Double> series = List.of(1.0, 2.0, 3.0, 4.0);

        assertThat(ReturnSeries.tail(series, 2)).containsExactly(3.0, 4.0);
        assertThat(ReturnSeries.tail(series, 5)).isNull();
        assertThat(ReturnSeries.tail(null, 1)).isNull();
    }

    @Test
    void meanOfEmptySeriesIsZero() {
        assertThat(ReturnSeries.mean(List.of())).isZero();
        assertThat(ReturnSeries.mean(List.of(1.0, 2.0, 6.0))).isEqualTo(3.0);
    }
}
