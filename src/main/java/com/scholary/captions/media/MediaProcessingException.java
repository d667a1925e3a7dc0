package com.scholary.captions.media;

/**
 * Exception thrown when a local media operation fails.
 *
 * <p>Covers audio decoding, WAV encoding and subtitle muxing. These are fatal for the job.
 */
public class MediaProcessingException extends RuntimeException {

  public MediaProcessingException(String message) {
    super(message);
  }

  public MediaProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
