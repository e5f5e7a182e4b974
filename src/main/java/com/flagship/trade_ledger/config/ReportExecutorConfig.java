package com.flagship.trade_ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded pool for the concurrent reads behind a balance sheet.
 *
 * Saturation falls back to the caller thread. MDC (correlation id) is
 * copied onto the worker thread for the duration of each task.
 */
@Configuration
@Slf4j
public class ReportExecutorConfig {

    public static final String REPORT_EXECUTOR = "reportExecutor";

    @Value("${ledger.report.executor.core-size:4}")
    private int coreSize;

    @Value("${ledger.report.executor.max-size:8}")
    private int maxSize;

    @Value("${ledger.report.executor.queue-capacity:100}")
    private int queueCapacity;

    @Bean(name = REPORT_EXECUTOR)
    public ThreadPoolTaskExecutor reportExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("report-read-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setTaskDecorator(mdcPropagating());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Initialized report executor: core={}, max={}, queue={}", coreSize, maxSize, queueCapacity);
        return executor;
    }

    private static TaskDecorator mdcPropagating() {
        return task -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    task.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
