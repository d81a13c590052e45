package com.pricewatch.tracker.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class HarvestConfig {
    private static final Logger log = LoggerFactory.getLogger(HarvestConfig.class);

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(HarvesterProperties properties) {
        int size = Math.max(4, properties.getWorkerCount() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "harvestRunExecutor", destroyMethod = "shutdown")
    public ExecutorService harvestRunExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("harvest-pass");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Clock harvestClock(HarvesterProperties properties) {
        return Clock.system(properties.zone());
    }

    @Bean
    public CatalogClientSettings catalogClientSettings(HarvesterProperties properties) {
        CatalogClientSettings settings = CatalogClientSettings.from(properties);
        if (!settings.hasApiKey()) {
            log.warn("No catalog API key configured; requests to {} are sent without x-apikey", settings.apiUrl());
        }
        return settings;
    }

    @Bean
    public ObjectMapper objectMapper() {
        return buildObjectMapper();
    }

    public static ObjectMapper buildObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
