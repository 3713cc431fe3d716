package com.lyz.healthplan.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * 环境上下文（天气、季节、地点）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnvironmentContext {

    private static final double DEFAULT_TEMPERATURE = 20.0;
    private static final String DEFAULT_CONDITION = "clear";

    private Weather weather;

    private String season;

    /**
     * indoor / outdoor / gym 等
     */
    private String location;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Weather {
        private String condition;

        @JsonAlias({"temperature"})
        private Double temperatureC;
    }

    public double resolveTemperature() {
        if (weather == null || weather.getTemperatureC() == null) {
            return DEFAULT_TEMPERATURE;
        }
        return weather.getTemperatureC();
    }

    public String resolveCondition() {
        if (weather == null || StringUtils.isBlank(weather.getCondition())) {
            return DEFAULT_CONDITION;
        }
        return weather.getCondition().trim().toLowerCase();
    }

    public boolean isIndoor() {
        return StringUtils.equalsIgnoreCase(StringUtils.trim(location), "indoor");
    }
}
