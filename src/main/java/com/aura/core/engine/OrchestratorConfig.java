package com.aura.core.engine;

import com.aura.core.events.EventBus;
import com.aura.core.generator.CodeGenerator;
import com.aura.core.generator.GeneratorProperties;
import com.aura.core.metrics.AuraMetrics;
import com.aura.core.resolver.MethodResolver;
import com.aura.core.security.SecurityAuditor;
import com.aura.core.store.ObjectStore;
import com.aura.sandbox.SandboxExecutor;
import com.aura.sandbox.SandboxProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the resolver and the single {@link DispatchOrchestrator} instance that
 * entry points receive by injection.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public MethodResolver methodResolver(ObjectStore objectStore, OrchestratorProperties properties) {
        return new MethodResolver(objectStore, properties.getMaxResolutionDepth());
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public DispatchOrchestrator dispatchOrchestrator(ObjectStore objectStore,
                                                     MethodResolver methodResolver,
                                                     SandboxExecutor sandboxExecutor,
                                                     SecurityAuditor securityAuditor,
                                                     CodeGenerator codeGenerator,
                                                     EventBus eventBus,
                                                     AuraMetrics metrics,
                                                     OrchestratorProperties properties,
                                                     SandboxProperties sandboxProperties,
                                                     GeneratorProperties generatorProperties) {
        return new DispatchOrchestrator(objectStore, methodResolver, sandboxExecutor, securityAuditor,
                codeGenerator, eventBus, metrics,
                properties.getStoreTimeoutMs(),
                sandboxProperties.getTimeoutMs() + properties.getExecutionGraceMs(),
                generatorProperties.getTimeoutMs());
    }
}
