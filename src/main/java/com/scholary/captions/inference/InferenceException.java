package com.scholary.captions.inference;

/**
 * Exception thrown when an inference call fails.
 *
 * <p>This could be due to network issues, an error status from the service, or a reply without
 * any candidate text.
 */
public class InferenceException extends RuntimeException {

  public InferenceException(String message) {
    super(message);
  }

  public InferenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
