package com.forensicalpha.alpha.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forensicalpha.common.blend.AlphaBlendingConfig;
import com.forensicalpha.common.model.ForensicMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

@Configuration
public class AlphaServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(AlphaServiceConfig.class);

    @Value("${forensic.alpha.weights.manipulation-risk:0.35}")
    private double manipulationRiskWeight;

    @Value("${forensic.alpha.weights.accrual-quality:0.25}")
    private double accrualQualityWeight;

    @Value("${forensic.alpha.weights.fundamental-strength:0.25}")
    private double fundamentalStrengthWeight;

    @Value("${forensic.alpha.weights.bankruptcy-risk:0.15}")
    private double bankruptcyRiskWeight;

    /** Fails startup if the configured weights are negative or do not sum to 1.0. */
    @Bean
    public AlphaBlendingConfig alphaBlendingConfig() {
        Map<ForensicMetric, Double> weights = new EnumMap<>(ForensicMetric.class);
        weights.put(ForensicMetric.MANIPULATION_RISK,    manipulationRiskWeight);
        weights.put(ForensicMetric.ACCRUAL_QUALITY,      accrualQualityWeight);
        weights.put(ForensicMetric.FUNDAMENTAL_STRENGTH, fundamentalStrengthWeight);
        weights.put(ForensicMetric.BANKRUPTCY_RISK,      bankruptcyRiskWeight);
        AlphaBlendingConfig config = new AlphaBlendingConfig(weights);
        log.info("[AlphaConfig] blending weights={}", config.weights());
        return config;
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
