package com.clinicflow.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipelineConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService dispensingExecutor(ClinicFlowProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getDispensing().getConcurrency()));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService providerExecutor() {
        return Executors.newCachedThreadPool();
    }
}
