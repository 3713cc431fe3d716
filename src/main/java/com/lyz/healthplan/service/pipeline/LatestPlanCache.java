package com.lyz.healthplan.service.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.vo.PlanPipelineResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 各方案类型最近一次运行结果的 Redis 缓存（plan.cache.enabled 开启时生效）
 */
@Slf4j
@Component
public class LatestPlanCache {

    private static final String CACHE_KEY_PREFIX = "healthplan:latest:";

    private final ObjectProvider<StringRedisTemplate> redisTemplateProvider;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final long ttlHours;

    public LatestPlanCache(ObjectProvider<StringRedisTemplate> redisTemplateProvider,
                           ObjectMapper objectMapper,
                           @Value("${plan.cache.enabled:false}") boolean enabled,
                           @Value("${plan.cache.ttl-hours:24}") long ttlHours) {
        this.redisTemplateProvider = redisTemplateProvider;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.ttlHours = ttlHours;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void put(PlanPipelineResult result) {
        StringRedisTemplate redisTemplate = template();
        if (redisTemplate == null) {
            return;
        }
        String key = cacheKey(result.getPlanType(), result.getMealType());
        try {
            String json = objectMapper.writeValueAsString(result.toArtifact());
            redisTemplate.opsForValue().set(key, json, ttlHours, TimeUnit.HOURS);
            log.info("最新方案已写入缓存: {}", key);
        } catch (Exception e) {
            log.warn("写入方案缓存失败: {}, reason={}", key, e.getMessage());
        }
    }

    public JsonNode get(PlanType planType, MealType mealType) {
        StringRedisTemplate redisTemplate = template();
        if (redisTemplate == null) {
            return null;
        }
        String key = cacheKey(planType, mealType);
        try {
            String cached = redisTemplate.opsForValue().get(key);
            return StringUtils.isNotBlank(cached) ? objectMapper.readTree(cached) : null;
        } catch (Exception e) {
            log.warn("读取方案缓存失败: {}, reason={}", key, e.getMessage());
            return null;
        }
    }

    static String cacheKey(PlanType planType, MealType mealType) {
        return CACHE_KEY_PREFIX + planType.getCode() + (mealType != null ? ":" + mealType.getCode() : "");
    }

    private StringRedisTemplate template() {
        return enabled ? redisTemplateProvider.getIfAvailable() : null;
    }
}
