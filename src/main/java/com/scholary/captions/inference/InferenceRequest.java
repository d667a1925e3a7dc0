package com.scholary.captions.inference;

import java.util.Objects;

/**
 * A single prompt sent to the inference service, optionally carrying an audio payload.
 *
 * @param purpose what the request is for
 * @param prompt the instruction text
 * @param audio encoded audio bytes, or null for text-only requests
 * @param audioMimeType MIME type of {@code audio}, e.g. {@code audio/wav}
 * @param jsonResponse whether the service should be asked for a JSON-only reply
 */
public record InferenceRequest(
    InferencePurpose purpose,
    String prompt,
    byte[] audio,
    String audioMimeType,
    boolean jsonResponse) {

  public static final String WAV_MIME_TYPE = "audio/wav";

  public InferenceRequest {
    Objects.requireNonNull(purpose, "purpose");
    Objects.requireNonNull(prompt, "prompt");
    if (audio != null && audioMimeType == null) {
      throw new IllegalArgumentException("audioMimeType is required when audio is present");
    }
  }

  public static InferenceRequest withWav(InferencePurpose purpose, String prompt, byte[] wav) {
    return new InferenceRequest(purpose, prompt, wav, WAV_MIME_TYPE, false);
  }

  public static InferenceRequest textOnly(InferencePurpose purpose, String prompt) {
    return new InferenceRequest(purpose, prompt, null, null, false);
  }

  /** A text-only request whose reply must be JSON. */
  public static InferenceRequest jsonOnly(InferencePurpose purpose, String prompt) {
    return new InferenceRequest(purpose, prompt, null, null, true);
  }

  public boolean hasAudio() {
    return audio != null && audio.length > 0;
  }
}
