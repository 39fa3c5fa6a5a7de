package io.agentcron4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentcron4j.AgentInvoker;
import io.agentcron4j.AgentScheduler;
import io.agentcron4j.ErrorNotifier;
import io.agentcron4j.OutputRenderer;
import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.JobRegistry;
import io.agentcron4j.internal.CompositeAgentInvoker;
import io.agentcron4j.internal.DefaultAgentScheduler;
import io.agentcron4j.internal.ExecutionEngine;
import io.agentcron4j.internal.LoggingErrorNotifier;
import io.agentcron4j.internal.output.OutputDispatcher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the agent scheduler.
 *
 * <p>The scheduler itself is only created when the application provides at least one
 * {@link AgentInvoker} bean.
 */
@AutoConfiguration
@ConditionalOnClass(AgentScheduler.class)
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "agent-scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AgentSchedulerConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry agentJobRegistry() {
        return new JobRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobConfigLoader jobConfigLoader() {
        return new JobConfigLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorNotifier errorNotifier() {
        return new LoggingErrorNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public OutputDispatcher outputDispatcher(SchedulerProperties props,
                                             ObjectProvider<ObjectMapper> objectMapperProvider,
                                             ObjectProvider<OutputRenderer> customRenderers) {
        ObjectMapper om = objectMapperProvider.getIfAvailable(ObjectMapper::new);
        List<OutputRenderer> renderers = new ArrayList<>(OutputDispatcher.defaultRenderers(om));
        // application renderers replace the built-in ones of the same type
        customRenderers.orderedStream().forEach(renderers::add);
        return new OutputDispatcher(renderers, props.zone());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(AgentInvoker.class)
    public ExecutionEngine agentExecutionEngine(SchedulerProperties props,
                                                ObjectProvider<AgentInvoker> invokers,
                                                ErrorNotifier notifier) {
        AgentInvoker invoker = CompositeAgentInvoker.of(invokers.orderedStream().toList());
        return new ExecutionEngine(props, invoker, notifier, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(AgentInvoker.class)
    public AgentScheduler agentScheduler(SchedulerProperties props,
                                         JobRegistry registry,
                                         ExecutionEngine engine,
                                         OutputDispatcher dispatcher) {
        return new DefaultAgentScheduler(props, registry, engine, dispatcher, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(AgentScheduler.class)
    public AgentSchedulerLifecycle agentSchedulerLifecycle(AgentScheduler scheduler,
                                                           SchedulerProperties props,
                                                           JobConfigLoader loader,
                                                           ObjectProvider<JobDefinition> jobs) {
        return new AgentSchedulerLifecycle(scheduler, props, loader, jobs.orderedStream().toList());
    }
}
