package com.scholary.captions.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external media tools.
 *
 * <p>ffmpeg decodes audio and muxes subtitles, yt-dlp downloads YouTube sources. Audio is always
 * decoded to mono at {@code sampleRate}.
 */
@ConfigurationProperties(prefix = "media")
@Validated
public record MediaProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ytDlpPath,
    @Positive int sampleRate,
    @NotBlank String tempDir) {}
