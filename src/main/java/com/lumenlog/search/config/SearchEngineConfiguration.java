package com.lumenlog.search.config;

import com.lumenlog.search.cache.ResultCacheIndex;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the search core.
 *
 * The schema resolver, file catalog, byte cache, tier scanners and delta executor are
 * supplied by the embedding application.
 */
@Configuration
@EnableConfigurationProperties(SearchEngineConfig.class)
@ComponentScan(basePackages = "com.lumenlog.search")
public class SearchEngineConfiguration {

    @Bean
    public Clock searchClock() {
        return Clock.systemUTC();
    }

    /**
     * Process-wide cache index, shared by the search and metrics result caches
     */
    @Bean
    public ResultCacheIndex resultCacheIndex(SearchEngineConfig config) {
        SearchEngineConfig.ResultCacheConfig cache = config.getResultCache();
        return new ResultCacheIndex(cache.getBuckets(), cache.getMaxEntries(),
            cache.getGcTrigger(), cache.getMaxEntriesPerKey());
    }
}
