package com.dispense.daemon;

import com.dispense.core.events.EventBus;
import com.dispense.core.metrics.DispenseMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the task supervisor. Only active when the process runs as the in-sandbox daemon.
 */
@Configuration
@ConditionalOnProperty(name = "dispense.mode", havingValue = "daemon")
public class DaemonConfig {

    @Bean
    public TaskRegistry taskRegistry() {
        return new TaskRegistry();
    }

    @Bean
    public TaskIdGenerator taskIdGenerator() {
        return new TaskIdGenerator();
    }

    @Bean
    public AgentInvocation agentInvocation(DaemonProperties properties) {
        return new AgentInvocation(properties.getAgent());
    }

    @Bean
    public AgentConfigurer agentConfigurer(DaemonProperties properties) {
        return new AgentConfigurer(properties.getAgent());
    }

    @Bean(destroyMethod = "shutdown")
    public TaskSupervisor taskSupervisor(TaskRegistry registry,
                                         TaskIdGenerator idGenerator,
                                         AgentInvocation invocation,
                                         AgentConfigurer configurer,
                                         DaemonProperties properties,
                                         EventBus eventBus,
                                         @Autowired(required = false) DispenseMetrics metrics) {
        return new TaskSupervisor(registry, idGenerator, invocation, configurer, properties, eventBus, metrics);
    }
}
