package com.scholary.assetstore.objectstore;

import java.util.Optional;

/**
 * Thrown when an upload fails after a key has been generated.
 *
 * <p>The key is carried so the caller can delete a possibly partial object with {@link
 * ObjectDeleter#deleteObject(String)}.
 */
public class UploadException extends ObjectStoreException {

  private final String key;

  public UploadException(String message, String key, Throwable cause) {
    super(message, cause);
    this.key = key;
  }

  /** The key the object would have been stored under, if one was generated. */
  public Optional<String> getKey() {
    return Optional.ofNullable(key);
  }
}
