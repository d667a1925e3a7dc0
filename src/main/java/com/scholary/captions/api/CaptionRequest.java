package com.scholary.captions.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request to generate captions for a media source.
 *
 * @param source local path, YouTube or http(s) URL, or {@code s3://bucket/key}
 * @param format {@code srt} or {@code vtt}; defaults to {@code srt}
 * @param chunkSeconds window length override; defaults to the configured value
 * @param embed whether to mux the captions into a copy of the video; defaults to true
 * @param save whether to publish the outputs to the object store; defaults to false
 */
public record CaptionRequest(
    @NotBlank String source,
    String format,
    @Positive Double chunkSeconds,
    Boolean embed,
    Boolean save) {

  public CaptionRequest {
    if (format == null || format.isBlank()) {
      format = "srt";
    }
    if (embed == null) {
      embed = Boolean.TRUE;
    }
    if (save == null) {
      save = Boolean.FALSE;
    }
  }
}
