package com.lyz.healthplan.service.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.config.PipelineProperties;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.vo.PlanPipelineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 运行结果落盘：{output-dir}/{plan-type}[_{meal-type}]_plan.json
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanArtifactStore {

    private final PipelineProperties pipelineProperties;
    private final ObjectMapper objectMapper;

    /**
     * 写入失败只记录日志，返回 null
     */
    public String write(PlanPipelineResult result) {
        Path path = resolvePath(result.getPlanType(), result.getMealType());
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), result.toArtifact());
            log.info("方案结果已保存: {}（共 {} 个候选，top {}）", path,
                    result.getAllPlans().size(), result.getTopPlans().size());
            return path.toString();
        } catch (IOException e) {
            log.warn("方案结果保存失败: {}, reason={}", path, e.getMessage());
            return null;
        }
    }

    /**
     * 读取最近一次落盘结果，文件不存在或损坏时返回 null
     */
    public JsonNode read(PlanType planType, MealType mealType) {
        Path path = resolvePath(planType, mealType);
        if (!Files.exists(path)) {
            return null;
        }
        try {
            return objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            log.warn("读取方案结果失败: {}, reason={}", path, e.getMessage());
            return null;
        }
    }

    public Path resolvePath(PlanType planType, MealType mealType) {
        return Paths.get(pipelineProperties.getOutputDir(), fileName(planType, mealType));
    }

    public static String fileName(PlanType planType, MealType mealType) {
        StringBuilder sb = new StringBuilder(planType.getCode());
        if (mealType != null) {
            sb.append('_').append(mealType.getCode());
        }
        return sb.append("_plan.json").toString();
    }
}
