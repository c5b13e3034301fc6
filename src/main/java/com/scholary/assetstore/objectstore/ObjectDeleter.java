package com.scholary.assetstore.objectstore;

import com.scholary.assetstore.logging.StorageEventLogger;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;

/**
 * Removes objects by key.
 *
 * <p>Deletion is idempotent: an object that is already gone counts as deleted. The returned future
 * never fails; unexpected errors complete it with false. That makes it safe to call speculatively
 * from cleanup paths.
 */
public class ObjectDeleter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectDeleter.class);

  private final StorageClient storageClient;
  private final Executor executor;
  private final StorageEventLogger eventLogger = new StorageEventLogger(LOGGER);

  public ObjectDeleter(StorageClient storageClient, Executor executor) {
    this.storageClient = storageClient;
    this.executor = executor;
  }

  /**
   * Delete the object stored under the key.
   *
   * @param key the object key
   * @return true if the object was removed or did not exist, false on any other failure
   */
  public CompletableFuture<Boolean> deleteObject(String key) {
    StorageClientHandle handle;
    try {
      handle = storageClient.getClient();
    } catch (ClientNotInitializedException e) {
      LOGGER.warn("Cannot delete object before storage client is ready: key={}", key);
      return CompletableFuture.completedFuture(false);
    }

    try {
      return CompletableFuture.supplyAsync(() -> delete(handle, key), executor)
          .exceptionally(
              error -> {
                LOGGER.error("Unexpected error deleting object: key={}", key, error);
                return false;
              });
    } catch (RejectedExecutionException e) {
      LOGGER.error("Delete rejected by storage executor: key={}", key, e);
      return CompletableFuture.completedFuture(false);
    }
  }

  private boolean delete(StorageClientHandle handle, String key) {
    try {
      handle
          .client()
          .deleteObject(DeleteObjectRequest.builder().bucket(handle.bucket()).key(key).build());
      eventLogger.logObjectDeleted(handle.bucket(), key, false);
      return true;

    } catch (SdkException e) {
      if (S3ErrorClassifier.classify(e) == S3ErrorKind.NOT_FOUND) {
        eventLogger.logObjectDeleted(handle.bucket(), key, true);
        return true;
      }
      LOGGER.error("Error deleting object: bucket={}, key={}", handle.bucket(), key, e);
      return false;
    }
  }
}
