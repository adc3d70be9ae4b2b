package com.vidnyan.lre.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.lre.LreProperties;
import com.vidnyan.lre.domain.engine.RuleEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for LRE components.
 * Wires the plain domain engine into the application.
 */
@Slf4j
@Configuration
public class LreConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RuleEngine ruleEngine(Clock clock, LreProperties properties) {
        int maxArticles = properties.getEngine().getMaxConclusionArticles();
        log.info("Rule engine ready, conclusions cite up to {} articles", maxArticles);
        return new RuleEngine(clock, maxArticles);
    }
}
