package com.example.policy.analyzer.service;

import com.example.policy.analyzer.dto.LlmCallResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.RetryBackoffSpec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
public class LlmService {

    static final String SYSTEM_PROMPT = "你是一个专业的金融政策分析师，擅长分析政策新闻对股票市场的影响。"
            + "请根据政策内容分析相关的行业、板块和个股。";

    @Value("${llm.api.url}")
    private String apiUrl;

    @Value("${llm.api.key:}")
    private String apiKey;

    @Value("${llm.model}")
    private String model;

    // "chat" sends messages, "completion" sends a single prompt
    @Value("${llm.api.style:completion}")
    private String apiStyle;

    @Value("${llm.temperature:0.3}")
    private double temperature;

    @Value("${llm.max-tokens:2000}")
    private int maxTokens;

    @Value("${llm.timeout-seconds:120}")
    private long timeoutSeconds;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final RetryBackoffSpec retrySpec;

    public LlmService(HttpClient httpClient, ObjectMapper objectMapper, RateLimiter rateLimiter,
            @Qualifier("llmRetrySpec") RetryBackoffSpec retrySpec) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.retrySpec = retrySpec;
    }

    /**
     * Runs one completion. Each HTTP attempt waits for the shared rate limiter first; transient
     * failures are retried by the LLM retry policy. Never throws: every failure comes back as
     * {@link LlmCallResult#failure}.
     */
    public LlmCallResult complete(String prompt) {
        if (apiKey == null || apiKey.isEmpty()) {
            log.warn("LLM API key is missing, skipping completion call");
            return LlmCallResult.failure("LLM API key is missing", 0);
        }

        AtomicInteger attempts = new AtomicInteger();
        try {
            String text = Mono.fromCallable(RetrySpecs.withCallerMdc(() -> {
                        attempts.incrementAndGet();
                        rateLimiter.acquire();
                        return callLlm(prompt, maxTokens);
                    }))
                    .retryWhen(retrySpec)
                    .block();
            return LlmCallResult.success(text, attempts.get());
        } catch (RuntimeException e) {
            Throwable failure = RetrySpecs.rootFailure(e);
            String reason = Exceptions.isRetryExhausted(e)
                    ? "LLM completion failed after " + attempts.get() + " attempts: " + failure.getMessage()
                    : "LLM completion failed: " + failure.getMessage();
            log.error(reason);
            return LlmCallResult.failure(reason, attempts.get());
        }
    }

    /**
     * Sends a tiny request, without retries, to check that the endpoint and key work.
     */
    public boolean checkHealth() {
        if (apiKey == null || apiKey.isEmpty()) {
            return false;
        }
        try {
            rateLimiter.acquire();
            String text = callLlm("test", 10);
            log.info("LLM health check passed");
            return text != null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.error("LLM health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * HTTP 5xx and 429 responses and I/O errors (timeouts included) are worth another attempt;
     * everything else is a problem with the request itself.
     */
    public static boolean isTransient(Throwable error) {
        if (error instanceof LlmCallException) {
            return ((LlmCallException) error).isTransientFailure();
        }
        return error instanceof IOException;
    }

    private String callLlm(String prompt, int tokens) throws IOException, InterruptedException, LlmCallException {
        String jsonBody = objectMapper.writeValueAsString(buildRequestBody(prompt, tokens));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        int status = response.statusCode();
        if (status != 200) {
            String body = response.body() == null ? "" : response.body();
            if (body.length() > 200) {
                body = body.substring(0, 200);
            }
            boolean retryable = status >= 500 || status == 429;
            throw new LlmCallException("LLM API returned status " + status + ": " + body, status, retryable);
        }

        return extractText(response.body());
    }

    private ObjectNode buildRequestBody(String prompt, int tokens) {
        ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.put("model", model);

        if ("chat".equalsIgnoreCase(apiStyle)) {
            ArrayNode messages = requestBody.putArray("messages");
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", SYSTEM_PROMPT);
            ObjectNode user = messages.addObject();
            user.put("role", "user");
            user.put("content", prompt);
        } else {
            requestBody.put("prompt", SYSTEM_PROMPT + "\n\n" + prompt);
        }

        requestBody.put("temperature", temperature);
        requestBody.put("max_tokens", tokens);
        return requestBody;
    }

    private String extractText(String body) throws LlmCallException {
        JsonNode choices;
        try {
            choices = objectMapper.readTree(body).path("choices");
        } catch (IOException e) {
            throw new LlmCallException("LLM API returned a non-JSON body", 200, false);
        }
        if (!choices.isArray() || choices.isEmpty()) {
            throw new LlmCallException("LLM API response has no choices", 200, false);
        }

        JsonNode first = choices.get(0);
        JsonNode content = first.path("message").path("content");
        if (content.isTextual()) {
            return content.asText();
        }
        JsonNode text = first.path("text");
        if (text.isTextual()) {
            return text.asText();
        }
        throw new LlmCallException("LLM API response has neither message.content nor text", 200, false);
    }
}
