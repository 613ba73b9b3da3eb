package com.witty.infrastructure.pipeline;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExecutorConfig {

    /**
     * Runs adapter calls so a stage can wait on them with a timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService adapterExecutor() {
        return Executors.newCachedThreadPool();
    }

    /**
     * Runs asynchronously submitted formalization requests.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService formalizationExecutor(@Value("${formalizer.async.pool-size:4}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize);
    }
}
