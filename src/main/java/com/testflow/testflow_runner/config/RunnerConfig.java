package com.testflow.testflow_runner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RunnerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /** Background runs; one thread per active run, threads are reused between runs. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService runExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "testflow-run-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }
}
