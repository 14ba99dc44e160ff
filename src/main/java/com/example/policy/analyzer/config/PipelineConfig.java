package com.example.policy.analyzer.config;

import com.example.policy.analyzer.service.LlmService;
import com.example.policy.analyzer.service.PolicyContentFetcher;
import com.example.policy.analyzer.service.RateLimiter;
import com.example.policy.analyzer.service.RetrySpecs;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import reactor.util.retry.RetryBackoffSpec;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableScheduling
public class PipelineConfig {

    @Bean
    public HttpClient httpClient(@Value("${llm.connect-timeout-seconds:10}") long connectTimeoutSeconds) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Shared by every LLM call in the process, sync and async paths alike.
     */
    @Bean
    public RateLimiter llmRateLimiter(@Value("${llm.rate-limit.max-calls:10}") int maxCalls,
            @Value("${llm.rate-limit.window-seconds:60}") long windowSeconds) {
        return new RateLimiter(maxCalls, Duration.ofSeconds(windowSeconds));
    }

    @Bean
    public RetryBackoffSpec llmRetrySpec(@Value("${llm.retry.max-attempts:3}") int maxAttempts,
            @Value("${llm.retry.base-delay-ms:2000}") long baseDelayMs,
            @Value("${llm.retry.max-delay-ms:30000}") long maxDelayMs,
            @Value("${llm.retry.jitter-factor:0.5}") double jitterFactor) {
        return RetrySpecs.backoff("LLM completion", maxAttempts, Duration.ofMillis(baseDelayMs),
                Duration.ofMillis(maxDelayMs), jitterFactor, LlmService::isTransient);
    }

    @Bean
    public RetryBackoffSpec contentFetchRetrySpec(@Value("${policy.content.retry.max-attempts:2}") int maxAttempts,
            @Value("${policy.content.retry.base-delay-ms:1000}") long baseDelayMs,
            @Value("${policy.content.retry.max-delay-ms:5000}") long maxDelayMs) {
        return RetrySpecs.backoff("Policy content fetch", maxAttempts, Duration.ofMillis(baseDelayMs),
                Duration.ofMillis(maxDelayMs), 0.5, PolicyContentFetcher::isTransient);
    }
}
