package com.scholary.captions.media;

/**
 * Exception thrown when the source media cannot be obtained.
 *
 * <p>Missing local files, failed downloads and unreadable object store keys all end here. No
 * transcript is attempted once this is raised.
 */
public class MediaAcquisitionException extends RuntimeException {

  public MediaAcquisitionException(String message) {
    super(message);
  }

  public MediaAcquisitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
