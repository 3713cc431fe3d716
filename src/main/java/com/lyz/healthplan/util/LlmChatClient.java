package com.lyz.healthplan.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI 兼容的 Chat Completions 客户端（默认 DeepSeek）
 * 未配置 API Key 时服务仍可启动，调用时抛出 IllegalStateException
 */
@Slf4j
@Component
public class LlmChatClient {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json; charset=utf-8");
    private static final String DEFAULT_BASE_URL = "https://api.deepseek.com/chat/completions";
    private static final String DEFAULT_MODEL = "deepseek-chat";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final int maxAttempts;
    private final Integer maxTokens;

    public LlmChatClient(@Value("${llm.api-key:}") String apiKeyFromConfig,
                         @Value("${llm.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl,
                         @Value("${llm.model:" + DEFAULT_MODEL + "}") String model,
                         @Value("${llm.timeout.connect-ms:5000}") long connectTimeoutMs,
                         @Value("${llm.timeout.read-ms:60000}") long readTimeoutMs,
                         @Value("${llm.timeout.write-ms:20000}") long writeTimeoutMs,
                         @Value("${llm.timeout.call-ms:90000}") long callTimeoutMs,
                         @Value("${llm.retry.max-attempts:2}") int maxAttempts,
                         @Value("${llm.chat.max-tokens:2000}") Integer maxTokens,
                         ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(writeTimeoutMs, TimeUnit.MILLISECONDS)
                .callTimeout(callTimeoutMs, TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
        String finalKey = StringUtils.firstNonBlank(apiKeyFromConfig,
                System.getenv("LLM_API_KEY"), System.getenv("DEEPSEEK_API_KEY"));
        this.apiKey = StringUtils.trimToNull(finalKey);
        this.baseUrl = StringUtils.defaultIfBlank(baseUrl, DEFAULT_BASE_URL);
        this.model = StringUtils.defaultIfBlank(model, DEFAULT_MODEL);
        this.maxAttempts = Math.max(maxAttempts, 1);
        this.maxTokens = maxTokens != null && maxTokens > 0 ? maxTokens : null;
        if (this.apiKey == null) {
            log.warn("未配置大模型 API Key（llm.api-key 或环境变量 LLM_API_KEY / DEEPSEEK_API_KEY），生成与语义评估调用将失败");
        }
        log.info("LlmChatClient 初始化完成，使用 baseUrl={}, model={}", this.baseUrl, this.model);
    }

    public boolean isConfigured() {
        return apiKey != null;
    }

    public String chat(String systemPrompt, String userPrompt) {
        return chat(systemPrompt, userPrompt, null);
    }

    public String chat(String systemPrompt, String userPrompt, Double temperature) {
        if (apiKey == null) {
            throw new IllegalStateException("未配置大模型 API Key，请设置 llm.api-key 或环境变量 LLM_API_KEY / DEEPSEEK_API_KEY");
        }
        Map<String, Object> payload = buildPayload(systemPrompt, userPrompt, temperature);
        String jsonBody;
        try {
            jsonBody = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new IllegalStateException("构建大模型请求体失败: " + e.getMessage(), e);
        }
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                RequestBody body = RequestBody.create(jsonBody, JSON_MEDIA_TYPE);
                Request request = new Request.Builder()
                        .url(baseUrl)
                        .addHeader("Authorization", "Bearer " + apiKey)
                        .addHeader("Content-Type", "application/json")
                        .post(body)
                        .build();
                try (Response response = httpClient.newCall(request).execute()) {
                    if (!response.isSuccessful()) {
                        String message = response.body() != null ? response.body().string() : "";
                        log.error("调用大模型失败，code={}, body={}", response.code(), message);
                        throw new IllegalStateException("调用大模型失败，HTTP " + response.code());
                    }
                    String responseText = response.body() != null ? response.body().string() : "";
                    return parseContent(responseText);
                }
            } catch (SocketTimeoutException timeout) {
                log.warn("调用大模型超时，attempt={}/{}", attempt, maxAttempts);
                if (attempt >= maxAttempts) {
                    throw new IllegalStateException("调用大模型异常: timeout", timeout);
                }
                try {
                    Thread.sleep(300L * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("调用大模型被中断", ie);
                }
            } catch (IOException e) {
                log.error("调用大模型异常", e);
                throw new IllegalStateException("调用大模型异常: " + e.getMessage(), e);
            }
        }
        throw new IllegalStateException("调用大模型异常: 未知错误");
    }

    private Map<String, Object> buildPayload(String systemPrompt, String userPrompt, Double temperature) {
        if (StringUtils.isBlank(userPrompt)) {
            throw new IllegalArgumentException("userPrompt 不能为空");
        }
        List<Map<String, String>> messages = new ArrayList<>();
        if (StringUtils.isNotBlank(systemPrompt)) {
            Map<String, String> system = new HashMap<>();
            system.put("role", "system");
            system.put("content", systemPrompt);
            messages.add(system);
        }
        Map<String, String> user = new HashMap<>();
        user.put("role", "user");
        user.put("content", userPrompt);
        messages.add(user);

        Map<String, Object> payload = new HashMap<>();
        payload.put("model", model);
        payload.put("messages", messages);
        payload.put("temperature", temperature != null ? temperature : 0.7);
        payload.put("stream", Boolean.FALSE);
        if (maxTokens != null) {
            payload.put("max_tokens", maxTokens);
        }
        return payload;
    }

    private String parseContent(String responseText) throws IOException {
        JsonNode root = objectMapper.readTree(responseText);
        JsonNode errorNode = root.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            String errorMessage = errorNode.has("message") ? errorNode.get("message").asText() : errorNode.toString();
            throw new IllegalStateException("大模型返回错误：" + errorMessage);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new IllegalStateException("大模型未返回有效内容");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new IllegalStateException("大模型返回内容为空");
        }
        return content.asText();
    }
}
