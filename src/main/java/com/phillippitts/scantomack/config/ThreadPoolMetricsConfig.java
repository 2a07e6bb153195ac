package com.phillippitts.scantomack.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Micrometer gauges for the OCR executor.
 *
 * <p>Exposes:
 * <ul>
 *   <li>ocr.pool.size - current number of threads</li>
 *   <li>ocr.pool.active - threads running engine calls</li>
 *   <li>ocr.pool.queued - engine calls waiting in the queue</li>
 *   <li>ocr.pool.completed - cumulative completed engine calls</li>
 *   <li>ocr.pool.max.size - configured maximum pool size</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> ocrExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("ocrExecutor") ObjectProvider<ThreadPoolTaskExecutor> ocrExecutorProvider) {
        this.ocrExecutorProvider = ocrExecutorProvider;
    }

    @Bean
    public MeterBinder ocrExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.ocrExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("ocr.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the OCR pool")
                    .register(registry);

            Gauge.builder("ocr.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively running engine calls")
                    .register(registry);

            Gauge.builder("ocr.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of engine calls waiting in the queue")
                    .register(registry);

            Gauge.builder("ocr.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed engine calls")
                    .register(registry);

            Gauge.builder("ocr.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the OCR executor")
                    .register(registry);

            LOG.info("OCR thread pool metrics registered: ocr.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.ocrExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("OCR Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
