package com.finops.advisor.config;

import com.finops.advisor.adapters.ResourceLister;
import com.finops.advisor.domain.model.ResourceKind;
import com.finops.advisor.savings.PricingTable;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wiring shared by every environment: clock, pricing, task pool and the
 * per-kind lister index.
 */
@Configuration
public class RemediationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PricingTable pricingTable(RemediationProperties properties) {
        return PricingTable.from(properties.getPricing());
    }

    @Bean("remediationTaskExecutor")
    public ThreadPoolTaskExecutor remediationTaskExecutor(RemediationProperties properties) {
        RemediationProperties.ExecutionProperties execution = properties.getExecution();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(execution.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(execution.getCorePoolSize(), execution.getMaxPoolSize()));
        executor.setQueueCapacity(execution.getQueueCapacity());
        executor.setThreadNamePrefix("Remediation-");
        executor.setTaskDecorator(RemediationConfig::propagateMdc);
        // Saturation and shutdown slow the pass down instead of dropping resources
        executor.setRejectedExecutionHandler(new RunInCallerPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(execution.getShutdownAwaitSeconds());
        executor.initialize();
        return executor;
    }

    /**
     * Runs a rejected task on the submitting thread, also after the pool has been
     * shut down. {@link ThreadPoolExecutor.CallerRunsPolicy} discards tasks once the
     * pool is shut down, which would leave the executor's futures incomplete.
     */
    static final class RunInCallerPolicy implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor pool) {
            task.run();
        }
    }

    /**
     * Carry the caller's MDC (checkId, actionId, dryRun) onto pool threads.
     */
    static Runnable propagateMdc(Runnable task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(context);
            }
            try {
                task.run();
            } finally {
                if (previous == null) {
                    MDC.clear();
                } else {
                    MDC.setContextMap(previous);
                }
            }
        };
    }

    @Bean
    public Map<ResourceKind, ResourceLister> resourceListers(List<ResourceLister> listers) {
        return listers.stream()
                .collect(Collectors.toMap(
                        ResourceLister::getKind,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate lister for " + a.getKind());
                        },
                        () -> new EnumMap<>(ResourceKind.class)
                ));
    }
}
