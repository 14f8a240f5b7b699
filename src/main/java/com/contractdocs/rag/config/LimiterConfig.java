package com.contractdocs.rag.config;

import com.contractdocs.rag.infra.InMemoryRpmRateLimiter;
import com.contractdocs.rag.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("generationLimiter")
    public RateLimiter generationLimiter(RagProperties properties) {
        return new InMemoryRpmRateLimiter(properties.llm().requestsPerMinute());
    }
}
