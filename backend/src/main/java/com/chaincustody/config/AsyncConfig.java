package com.chaincustody.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: settlement-executor runs withdrawal lanes (one lane per wallet at a time).
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String SETTLEMENT_EXECUTOR = "settlement-executor";

    @Bean(name = SETTLEMENT_EXECUTOR)
    public Executor settlementExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("settlement-");
        e.initialize();
        return e;
    }
}
