package com.lumenlog.search.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Thread pools for delta fan-out and detached cache writes
 */
@Component
public class SearchExecutors {

    private static final Logger log = LoggerFactory.getLogger(SearchExecutors.class);

    private final SearchEngineConfig config;

    private ExecutorService deltaExecutor;
    private ExecutorService cacheWriterExecutor;

    @Autowired
    public SearchExecutors(SearchEngineConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void start() {
        deltaExecutor = Executors.newFixedThreadPool(
            Math.max(1, config.getLimit().getDeltaThreads()),
            new ThreadFactoryBuilder().setNameFormat("search-delta-%d").setDaemon(true).build());
        cacheWriterExecutor = Executors.newFixedThreadPool(
            Math.max(1, config.getResultCache().getWriterThreads()),
            new ThreadFactoryBuilder().setNameFormat("result-cache-writer-%d").setDaemon(true).build());
        log.info("Search executors started (delta threads: {}, cache writer threads: {})",
            config.getLimit().getDeltaThreads(), config.getResultCache().getWriterThreads());
    }

    public ExecutorService deltaExecutor() {
        return deltaExecutor;
    }

    public ExecutorService cacheWriterExecutor() {
        return cacheWriterExecutor;
    }

    @PreDestroy
    public void stop() {
        shutdown("delta", deltaExecutor);
        shutdown("cache writer", cacheWriterExecutor);
    }

    private void shutdown(String name, ExecutorService executor) {
        if (executor == null) {
            return;
        }
        log.info("Stopping {} executor...", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
