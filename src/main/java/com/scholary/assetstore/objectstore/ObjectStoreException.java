package com.scholary.assetstore.objectstore;

/**
 * Base exception for object storage failures that cross a component boundary.
 *
 * <p>This is a runtime exception: failures reach callers through failed futures, and the only
 * thing a caller can do with most of them is retry later or report the error.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
