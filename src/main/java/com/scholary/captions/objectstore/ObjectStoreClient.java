package com.scholary.captions.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Abstraction for object storage operations.
 *
 * <p>Used to read {@code s3://} media sources and to publish caption files. Implementations must be
 * thread-safe.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller is responsible for closing the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the object content
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String bucket, String key, byte[] data, String contentType);

  /**
   * Generate a presigned URL for temporary access to an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param ttl time-to-live for the URL
   * @return a presigned URL
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);
}
