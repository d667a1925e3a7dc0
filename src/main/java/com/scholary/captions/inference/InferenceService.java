package com.scholary.captions.inference;

/**
 * Interface for multimodal inference (audio plus instruction in, free-form text out).
 *
 * <p>Abstracting the transport lets the pipeline be tested with scripted replies and lets the
 * backing model be swapped without touching transcription logic.
 */
public interface InferenceService {

  /**
   * Send a request and return the reply text.
   *
   * @param request the prompt and optional audio payload
   * @return the raw reply text, never null
   * @throws InferenceException if the call fails after retries
   */
  String generate(InferenceRequest request);
}
