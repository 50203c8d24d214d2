package com.di.qualityguard.config;

import com.di.qualityguard.analysis.QualityAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the analysis engine: the frozen {@link AnalysisConfig}, the bounded column worker pool
 * and the {@link QualityAnalyzer} that uses both.
 */
@Slf4j
@Configuration
public class AnalysisBeansConfig {

    @Bean
    public AnalysisConfig analysisConfig(AnalysisProperties properties) {
        AnalysisConfig config = properties.toAnalysisConfig();
        log.info("[CONFIG] Analysis thresholds: {}", config);
        return config;
    }

    /** Shared pool for column tasks; sized to the configured worker count (default: CPU count). */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(AnalysisProperties properties) {
        int threads = properties.getEffectiveWorkerThreads();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory tf = r -> {
            var t = new Thread(r, "qg-column-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        log.info("[CONFIG] Column worker pool size={}", threads);
        return Executors.newFixedThreadPool(threads, tf);
    }

    @Bean
    public QualityAnalyzer qualityAnalyzer(AnalysisConfig analysisConfig, ExecutorService analysisExecutor) {
        return new QualityAnalyzer(analysisConfig, analysisExecutor);
    }
}
