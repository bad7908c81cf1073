package com.tradeguard.risk.model;

import com.tradeguard.risk.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortfolioSnapshotTest {

    private static final PositionState AAPL = PositionState.builder()
            .symbol("AAPL")
            .side(PositionSide.LONG)
            .entryPrice(180.0)
            .quantity(10)
            .entryTime(Instant.parse("2024-03-01T14:30:00Z"))
            .build();

    @Test
    void benchmarkWithNullReturnIsInvalidInput() {
        List<Double> benchmark = Arrays.asList(0.01, null, -0.02);

        assertThatThrownBy(() -> new PortfolioSnapshot(List.of(AAPL), Map.of(), Map.of(), benchmark))
                .isInstanceOf(InvalidInputException.class)
                .extracting("field").isEqualTo("benchmarkReturns[1]");
    }

    @Test
    void returnSeriesWithNonFiniteValueIsInvalidInput() {
        Map<String, List<Double>> returns = Map.of("AAPL", List.of(0.01, Double.NaN));

        assertThatThrownBy(() -> new PortfolioSnapshot(List.of(AAPL), Map.of(), returns, List.of()))
                .isInstanceOf(InvalidInputException.class)
                .extracting("field").isEqualTo("returnSeries[AAPL][1]");
    }

    @Test
    void nullPositionIsInvalidInput() {
        List<PositionState> positions = Arrays.asList(AAPL, null);

        assertThatThrownBy(() -> new PortfolioSnapshot(positions, Map.of(), Map.of(), List.of()))
                .isInstanceOf(InvalidInputException.class)
                .extracting("field").isEqualTo("positions[1]");
    }

    @Test
    void nullMarkPriceIsInvalidInput() {
        Map<String, Double> prices = new HashMap<>();
        prices.put("AAPL", null);

        assertThatThrownBy(() -> new PortfolioSnapshot(List.of(AAPL), prices, Map.of(), List.of()))
                .isInstanceOf(InvalidInputException.class)
                .extracting("field").isEqualTo("currentPrices[AAPL]");
    }

    @Test
    void nullCollectionsBecomeEmpty() {
        PortfolioSnapshot snapshot = new PortfolioSnapshot(null, null, null, null);

        assertThat(snapshot.positions()).isEmpty();
        assertThat(snapshot.benchmarkReturns()).isEmpty();
        assertThat(snapshot.returnsFor("AAPL")).isNull();
        assertThat(snapshot.markPrice(AAPL)).isEqualTo(180.0);
    }
}
