package com.researchintel.deepresearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchintel.deepresearch.cache.CacheStore;
import com.researchintel.deepresearch.cache.FileCacheStore;
import com.researchintel.deepresearch.service.ContentFetcher;
import com.researchintel.deepresearch.service.HttpContentFetcher;
import com.researchintel.deepresearch.service.SourceHarvester;
import com.researchintel.deepresearch.service.SyntheticContentFetcher;
import com.researchintel.deepresearch.service.SyntheticSourceHarvester;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

@Configuration
@Slf4j
public class PipelineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheStore cacheStore(DeepResearchProperties properties, ObjectMapper objectMapper, Clock clock) {
        log.info("Fetch cache directory: {}", properties.getCacheDir());
        return new FileCacheStore(Paths.get(properties.getCacheDir()), objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SourceHarvester sourceHarvester() {
        return new SyntheticSourceHarvester();
    }

    @Bean
    @ConditionalOnMissingBean(ContentFetcher.class)
    @ConditionalOnProperty(prefix = "deep-research.fetch", name = "mode", havingValue = "http")
    public ContentFetcher httpContentFetcher(DeepResearchProperties properties, Clock clock) {
        return new HttpContentFetcher(properties.getFetch().getTimeout(), clock);
    }

    @Bean
    @ConditionalOnMissingBean(ContentFetcher.class)
    @ConditionalOnProperty(prefix = "deep-research.fetch", name = "mode", havingValue = "synthetic", matchIfMissing = true)
    public ContentFetcher syntheticContentFetcher(Clock clock) {
        return new SyntheticContentFetcher(clock);
    }
}
