package com.tradeguard.risk.config;

import com.tradeguard.risk.model.AccountSnapshot;
import com.tradeguard.risk.model.PortfolioSnapshot;
import com.tradeguard.risk.model.PositionSide;
import com.tradeguard.risk.model.RiskLimits;
import com.tradeguard.risk.model.SizingMode;
import com.tradeguard.risk.service.RiskManagementEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "risk.max-position-size=0.03",
        "risk.sizing.mode=KELLY"
})
@ActiveProfiles("test")
class RiskPropertiesTest {

    @Autowired
    private RiskProperties properties;

    @Autowired
    private RiskLimits riskLimits;

    @Autowired
    private RiskManagementEngine riskManagementEngine;

    @Test
    void bindsSnakeCaseKeysFromApplicationYaml() {
        assertThat(properties.getMaxPortfolioExposure()).isEqualTo(0.5);
        assertThat(properties.getStopLossPercentage()).isEqualTo(0.02);
        assertThat(properties.getTakeProfitPercentage()).isEqualTo(0.05);
        assertThat(properties.getTrailingStopPercentage()).isEqualTo(0.03);
        assertThat(properties.getDailyLossLimit()).isEqualTo(0.05);
        assertThat(properties.getMaxDrawdownLimit()).isEqualTo(0.15);
        assertThat(properties.getMaxCorrelation()).isEqualTo(0.7);
        assertThat(properties.getVarConfidence()).isEqualTo(0.95);
        assertThat(properties.getMaxHoldingDuration()).isEqualTo(Duration.ofHours(24));
        assertThat(properties.getLookback().getValueAtRisk()).isEqualTo(30);
    }

    @Test
    void overridesApplyToLimitsBean() {
        assertThat(riskLimits.maxPositionSize()).isEqualTo(0.03);
        assertThat(riskLimits.defaultSizingMode()).isEqualTo(SizingMode.KELLY);
        assertThat(riskLimits.kellyMultiplier()).isEqualTo(0.5);
        assertThat(riskLimits.kellyCap()).isEqualTo(0.20);
    }

    @Test
    void engineIsWiredWithConfiguredLimits() {
        assertThat(riskManagementEngine.limits()).isSameAs(riskLimits);

        AccountSnapshot account = AccountSnapshot.of(100_000, 100_000, Instant.parse("2024-03-04T15:00:00Z"));
        assertThat(riskManagementEngine.canOpenPosition("AAPL", PositionSide.LONG, 10, 175.0, account,
                PortfolioSnapshot.empty()).allowed()).isTrue();
    }
}
