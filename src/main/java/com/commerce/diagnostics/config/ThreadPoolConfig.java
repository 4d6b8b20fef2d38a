package com.commerce.diagnostics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool for the concurrent current/baseline fetches issued inside a node.
 * Runs themselves stay on the request thread.
 */
@Configuration
public class ThreadPoolConfig {

    @Bean(name = "queryFetchExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor queryFetchExecutor(EngineConfig engineConfig) {
        EngineConfig.FetchPool pool = engineConfig.getFetchPool();
        int coreSize = Math.max(pool.getCorePoolSize(), 1);
        int maxSize = Math.max(pool.getMaxPoolSize(), coreSize);
        int queueCapacity = Math.max(pool.getQueueCapacity(), 0);
        BlockingQueue<Runnable> queue = queueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(queueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(pool.getThreadNamePrefix() + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(pool.getKeepAliveSeconds(), 0L),
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy());
    }
}
