package com.github.salilvnair.storyengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration(proxyBeanMethods = false)
public class StoryEngineAsyncConfiguration {

    public static final String JUDGE_EXECUTOR = "storyEngineJudgeExecutor";

    // Judge calls block on remote latency, so they get their own bounded pool.
    @Bean(name = JUDGE_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService storyEngineJudgeExecutor(StoryEngineConfig config) {
        int threads = Math.max(1, config.getSemantic().getJudgeThreads());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "storyengine-judge-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }
}
