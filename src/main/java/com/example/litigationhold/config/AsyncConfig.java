package com.example.litigationhold.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Worker pool for the mutation phase.
 * <p>
 * The pool size is the hard ceiling; each run admits at most its own
 * concurrency limit of tasks through a semaphore held by the bulk mutator.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "mutationExecutor", destroyMethod = "shutdown")
    public ExecutorService mutationExecutor(LitigationHoldProperties properties) {
        log.info("Creating mutation worker pool with {} threads", properties.getMaxWorkerThreads());

        var factory = new CustomizableThreadFactory("hold-mutator-");
        factory.setDaemon(true);

        return Executors.newFixedThreadPool(properties.getMaxWorkerThreads(), factory);
    }
}
