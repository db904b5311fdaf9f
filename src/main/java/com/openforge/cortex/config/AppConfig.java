package com.openforge.cortex.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - I/O executor          → runs HttpClient callbacks and NDJSON stream reading
 *  - Retry scheduler       → delays between Resilience4j retry attempts
 *  - Java HttpClient       → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper  → snake_case ↔ camelCase, tolerant deserialization
 */
@Configuration
public class AppConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService llmIoExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("llm-io-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService llmRetryScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("llm-retry-"));
    }

    /**
     * Single, shared HttpClient instance. The model server is local and speaks
     * HTTP/1.1 only; per-request deadlines are set at call site.
     */
    @Bean
    public HttpClient httpClient(@Qualifier("llmIoExecutor") ExecutorService llmIoExecutor) {
        return HttpClient.newBuilder()
                .executor(llmIoExecutor)
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    /**
     * ObjectMapper for the model server's JSON:
     *  - snake_case property names (tool_calls, num_predict …)
     *  - unknown properties silently ignored (the server adds timing fields freely)
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
