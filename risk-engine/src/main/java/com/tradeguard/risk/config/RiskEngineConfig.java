package com.tradeguard.risk.config;

import com.tradeguard.risk.model.RiskLimits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RiskProperties.class)
@Slf4j
public class RiskEngineConfig {

    /**
     * Built once at startup. A reload means a new context, never mutating this instance.
     */
    @Bean
    public RiskLimits riskLimits(RiskProperties properties) {
        RiskLimits limits = properties.toLimits();
        log.info("Risk limits loaded: maxPosition={} maxExposure={} dailyLoss={} maxDrawdown={} stop={} target={} trail={} maxCorr={} varConf={}",
                limits.maxPositionSize(), limits.maxPortfolioExposure(), limits.dailyLossLimit(),
                limits.maxDrawdownLimit(), limits.stopLossPct(), limits.takeProfitPct(),
                limits.trailingStopPct(), limits.maxCorrelation(), limits.varConfidence());
        return limits;
    }
}
