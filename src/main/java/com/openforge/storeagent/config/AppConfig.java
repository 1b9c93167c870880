package com.openforge.storeagent.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Core infrastructure beans:
 *  - chatTurnExecutor : runs chat turns off the HTTP thread (new messages and resumed approvals)
 *  - HttpClient       : the only HTTP engine (completion, embedding and Slack APIs)
 *  - ObjectMapper     : snake_case, ISO-8601 dates, tolerant deserialization
 *  - Clock            : the single time source for TTLs and expiry checks
 */
@Configuration
public class AppConfig {

    /**
     * Named "chatTurnExecutor" to stay clear of Spring Boot's auto-configured
     * "applicationTaskExecutor". Turns block on remote calls for seconds, so
     * the pool is sized for I/O wait rather than CPU.
     */
    @Bean
    public TaskExecutor chatTurnExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("chat-turn-");
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(500);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Single, shared HttpClient instance; per-request read timeouts are set
     * at each call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
