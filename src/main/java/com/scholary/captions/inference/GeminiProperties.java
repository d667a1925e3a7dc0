package com.scholary.captions.inference;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Gemini inference client.
 *
 * <p>{@code apiKey} may be empty at startup; calls then fail and every window falls back to
 * placeholders. Timeouts are in seconds. {@code maxRetries} is the total number of attempts.
 */
@ConfigurationProperties(prefix = "gemini")
@Validated
public record GeminiProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @PositiveOrZero long retryBackoffMillis,
    @PositiveOrZero double temperature,
    @Positive int maxOutputTokens) {}
