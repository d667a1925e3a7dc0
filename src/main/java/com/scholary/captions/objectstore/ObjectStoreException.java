package com.scholary.captions.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Storage failures fail the job that needed the object: an {@code s3://} source that cannot be
 * read, or captions that cannot be published.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
