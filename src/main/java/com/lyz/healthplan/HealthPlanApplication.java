package com.lyz.healthplan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Redis 仅作可选缓存，由 {@link com.lyz.healthplan.config.RedisConfig} 按开关装配
 */
@SpringBootApplication(exclude = {RedisAutoConfiguration.class, RedisRepositoriesAutoConfiguration.class})
@ConfigurationPropertiesScan
public class HealthPlanApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthPlanApplication.class, args);
    }
}
