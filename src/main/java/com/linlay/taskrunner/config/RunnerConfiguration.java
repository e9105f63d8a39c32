package com.linlay.taskrunner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.taskrunner.agent.AgentRunner;
import com.linlay.taskrunner.agent.mode.ModeServices;
import com.linlay.taskrunner.agent.runtime.PlanApprovalCoordinator;
import com.linlay.taskrunner.cache.InMemoryRunEventCache;
import com.linlay.taskrunner.cache.RunCacheKeyFactory;
import com.linlay.taskrunner.cache.RunEventCache;
import com.linlay.taskrunner.llm.ReasoningEngine;
import com.linlay.taskrunner.tool.ToolRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RunnerConfiguration {

    @Bean
    public ModeServices modeServices(ReasoningEngine reasoningEngine, ToolRegistry toolRegistry, AgentRunProperties properties) {
        return new ModeServices(reasoningEngine, toolRegistry, properties);
    }

    @Bean
    public RunEventCache runEventCache(RunCacheProperties properties) {
        return new InMemoryRunEventCache(properties);
    }

    @Bean
    public RunCacheKeyFactory runCacheKeyFactory(ObjectMapper objectMapper, RunCacheProperties properties) {
        return new RunCacheKeyFactory(objectMapper, properties);
    }

    @Bean
    public AgentRunner agentRunner(
            ModeServices modeServices,
            PlanApprovalCoordinator planApprovalCoordinator,
            RunEventCache runEventCache,
            RunCacheKeyFactory runCacheKeyFactory,
            RunCacheProperties cacheProperties,
            AgentProviderProperties providerProperties
    ) {
        return new AgentRunner(modeServices, planApprovalCoordinator, runEventCache, runCacheKeyFactory,
                cacheProperties, providerProperties);
    }
}
