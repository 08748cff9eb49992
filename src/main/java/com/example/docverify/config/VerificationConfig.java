package com.example.docverify.config;

import com.example.docverify.model.EligibilityPolicy;
import com.example.docverify.ocr.OcrEngine;
import com.example.docverify.ocr.TesseractOcrEngine;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans for the verification pipeline.
 */
@Configuration
public class VerificationConfig {

    /**
     * Source of "today" for expiry, age and validity checks.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Shared ObjectMapper: ISO dates, unknown request properties ignored.
     * <p>
     * Replaces Boot's auto-configured mapper, so {@code spring.jackson.*} properties have no effect;
     * the HTTP message converters serialize with this instance.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public OcrEngine ocrEngine(VerificationProperties properties) {
        return new TesseractOcrEngine(properties.ocr());
    }

    /**
     * Policy applied when a request carries none ({@code verification.default-policy}).
     */
    @Bean
    public EligibilityPolicy defaultEligibilityPolicy(VerificationProperties properties) {
        if (properties.defaultPolicy() == null) {
            throw new IllegalStateException("verification.default-policy must be configured");
        }
        return properties.defaultPolicy();
    }
}
