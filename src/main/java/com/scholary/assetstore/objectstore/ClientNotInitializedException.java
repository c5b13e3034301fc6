package com.scholary.assetstore.objectstore;

/**
 * Thrown when an operation needs the storage client before initialization has completed.
 *
 * <p>The condition is transient. Callers should retry once startup has finished.
 */
public class ClientNotInitializedException extends ObjectStoreException {

  public ClientNotInitializedException(String message) {
    super(message);
  }

  public ClientNotInitializedException(String message, Throwable cause) {
    super(message, cause);
  }
}
