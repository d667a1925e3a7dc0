package com.scholary.captions.config;

import com.scholary.captions.media.MediaProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for media tools.
 *
 * <p>Enables the MediaProperties (ffmpeg, yt-dlp, sample rate) to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(MediaProperties.class)
public class MediaConfig {}
