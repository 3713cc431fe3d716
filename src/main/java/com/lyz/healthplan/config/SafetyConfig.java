package com.lyz.healthplan.config;

import com.lyz.healthplan.service.safety.matcher.ContentMatcher;
import com.lyz.healthplan.service.safety.matcher.KeywordContentMatcher;
import com.lyz.healthplan.service.safety.matcher.WordBoundaryContentMatcher;
import com.lyz.healthplan.service.safety.policy.CheckGateScoringPolicy;
import com.lyz.healthplan.service.safety.policy.RiskGateScoringPolicy;
import com.lyz.healthplan.service.safety.policy.ScoringPolicy;
import com.lyz.healthplan.service.safety.policy.WeightedScoringPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 按配置装配唯一生效的评分策略与内容匹配器
 */
@Slf4j
@Configuration
public class SafetyConfig {

    @Bean
    public ScoringPolicy scoringPolicy(SafetyProperties safetyProperties) {
        ScoringPolicy policy = switch (safetyProperties.resolveScoringPolicy()) {
            case WEIGHTED -> new WeightedScoringPolicy();
            case RISK_GATE -> new RiskGateScoringPolicy();
            case CHECK_GATE -> new CheckGateScoringPolicy();
        };
        log.info("安全评分策略: {}", policy.type().getCode());
        return policy;
    }

    @Bean
    public ContentMatcher contentMatcher(SafetyProperties safetyProperties) {
        ContentMatcher matcher = switch (safetyProperties.resolveContentMatcher()) {
            case KEYWORD -> new KeywordContentMatcher();
            case WORD_BOUNDARY -> new WordBoundaryContentMatcher();
        };
        log.info("病症禁忌内容匹配器: {}", matcher.type().getCode());
        return matcher;
    }
}
