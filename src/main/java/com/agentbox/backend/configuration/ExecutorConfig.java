package com.agentbox.backend.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class ExecutorConfig {

    /** Detached work: mint jobs, funding transfers, remote sessions. */
    @Bean(name = "taskExecutor")
    public Executor taskExecutor(@Value("${executor.task.core-size:4}") int coreSize,
                                 @Value("${executor.task.max-size:16}") int maxSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("agentbox-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /** Audit writes. Single thread keeps insert order. */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor(@Value("${executor.event.synchronous:false}") boolean synchronous) {
        if (synchronous) {
            return Runnable::run;
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("agentbox-event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
