package com.example.filingcontacts.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;

/**
 * Logs the effective Gemini settings at startup. Calls go through the REST API
 * in {@code GeminiVisionExtractionService}, so no client library is configured here.
 */
@Configuration
public class GeminiConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(GeminiConfiguration.class);

    @Value("${gemini.api.key:}")
    private String apiKey;

    @Value("${gemini.api.enabled:true}")
    private boolean enabled;

    @Value("${gemini.api.model:gemini-2.5-flash}")
    private String modelName;

    @Value("${gemini.api.max-pages:100}")
    private int maxPages;

    @Value("${llm.retry.max-retries:3}")
    private int maxRetries;

    @PostConstruct
    public void initialize() {
        if (enabled && apiKey != null && !apiKey.isEmpty()) {
            logger.info("✅ Gemini contact extraction configured (REST API)");
            logger.info("   - Model: {}", modelName);
            logger.info("   - Max pages per request: {}", maxPages);
            logger.info("   - Fast retries: {}", maxRetries);
            logger.info("   - API Key: {}...{}",
                    apiKey.substring(0, Math.min(4, apiKey.length())),
                    apiKey.substring(Math.max(0, apiKey.length() - 4)));
        } else {
            logger.info("ℹ️ Gemini contact extraction is disabled or not configured");
        }
    }
}
