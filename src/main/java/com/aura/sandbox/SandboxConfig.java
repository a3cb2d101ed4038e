package com.aura.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SandboxConfig {

    @Bean
    @ConditionalOnProperty(name = "aura.sandbox.provider", havingValue = "local", matchIfMissing = true)
    public SandboxExecutor graalSandboxExecutor(SandboxProperties properties, ObjectMapper objectMapper) {
        return new GraalSandboxExecutor(objectMapper, properties.getTimeoutMs(), properties.getThreads());
    }

    @Bean
    @ConditionalOnProperty(name = "aura.sandbox.provider", havingValue = "remote")
    public SandboxExecutor httpSandboxExecutor(SandboxProperties properties, ObjectMapper objectMapper) {
        return new HttpSandboxExecutor(properties.getUrl(), objectMapper,
                properties.getConnectTimeoutMs(), properties.getTimeoutMs());
    }
}
