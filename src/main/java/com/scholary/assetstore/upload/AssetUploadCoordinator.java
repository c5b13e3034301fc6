package com.scholary.assetstore.upload;

import com.scholary.assetstore.objectstore.ObjectDeleter;
import com.scholary.assetstore.objectstore.S3ErrorClassifier;
import com.scholary.assetstore.objectstore.UploadException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.InputStreamSource;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers that store an uploaded file and then reference it from a domain record.
 *
 * <p>Keeps the bucket consistent with the records pointing into it:
 *
 * <ul>
 *   <li>the file is checked by {@link UploadPolicy} before its stream is opened
 *   <li>when the upload fails, the generated key is deleted in case a partial object was left
 *   <li>when linking the result to a record fails, the uploaded object is deleted
 * </ul>
 *
 * <p>In every failure case the returned future fails with the original error, after cleanup has
 * finished.
 */
@Service
public class AssetUploadCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssetUploadCoordinator.class);

  private final UploadPolicy uploadPolicy;
  private final UploadAdapter uploadAdapter;
  private final ObjectDeleter objectDeleter;

  public AssetUploadCoordinator(
      UploadPolicy uploadPolicy, UploadAdapter uploadAdapter, ObjectDeleter objectDeleter) {
    this.uploadPolicy = uploadPolicy;
    this.uploadAdapter = uploadAdapter;
    this.objectDeleter = objectDeleter;
  }

  /**
   * Validate and upload a file.
   *
   * @param source supplies the file body; opened only once the file passed the policy check
   * @param originalName the client-supplied filename
   * @param contentType the declared MIME type
   * @param size the declared size in bytes
   * @return a future completing with the upload result
   */
  public CompletableFuture<UploadResult> upload(
      InputStreamSource source, String originalName, String contentType, long size) {
    InputStream data;
    try {
      uploadPolicy.check(originalName, contentType, size);
      data = source.getInputStream();
    } catch (InvalidUploadException e) {
      return CompletableFuture.failedFuture(e);
    } catch (IOException e) {
      return CompletableFuture.failedFuture(
          new UploadException("Failed to open upload stream for " + originalName, null, e));
    }

    CompletableFuture<UploadResult> outcome = new CompletableFuture<>();
    uploadAdapter
        .upload(data, originalName, contentType)
        .whenComplete(
            (result, error) -> {
              closeQuietly(data, originalName);
              if (error == null) {
                outcome.complete(result);
              } else {
                cleanUpAfterFailedUpload(S3ErrorClassifier.unwrap(error), outcome);
              }
            });
    return outcome;
  }

  /**
   * Upload a file and hand the result to a linking step, such as attaching it to a product.
   *
   * <p>If the linker fails (or returns a failed future), the uploaded object is deleted before the
   * returned future fails with the linker's error.
   *
   * @param linker associates the upload with a domain record
   * @return a future completing with the linker's value
   */
  public <T> CompletableFuture<T> uploadAndLink(
      InputStreamSource source,
      String originalName,
      String contentType,
      long size,
      Function<UploadResult, CompletableFuture<T>> linker) {
    return upload(source, originalName, contentType, size)
        .thenCompose(result -> link(result, linker));
  }

  private <T> CompletableFuture<T> link(
      UploadResult result, Function<UploadResult, CompletableFuture<T>> linker) {
    CompletableFuture<T> linked;
    try {
      linked = linker.apply(result);
    } catch (RuntimeException e) {
      linked = CompletableFuture.failedFuture(e);
    }

    CompletableFuture<T> outcome = new CompletableFuture<>();
    linked.whenComplete(
        (value, error) -> {
          if (error == null) {
            outcome.complete(value);
            return;
          }
          Throwable cause = S3ErrorClassifier.unwrap(error);
          LOGGER.warn(
              "Linking upload failed, deleting uploaded object: key={}, error={}",
              result.key(),
              cause.getMessage());
          deleteThenFail(result.key(), cause, outcome);
        });
    return outcome;
  }

  private <T> void cleanUpAfterFailedUpload(Throwable cause, CompletableFuture<T> outcome) {
    Optional<String> key =
        cause instanceof UploadException ? ((UploadException) cause).getKey() : Optional.empty();
    if (key.isEmpty()) {
      outcome.completeExceptionally(cause);
      return;
    }
    LOGGER.info("Upload failed, removing any partial object: key={}", key.get());
    deleteThenFail(key.get(), cause, outcome);
  }

  private <T> void deleteThenFail(String key, Throwable cause, CompletableFuture<T> outcome) {
    objectDeleter
        .deleteObject(key)
        .whenComplete(
            (deleted, deleteError) -> {
              if (deleteError != null || !Boolean.TRUE.equals(deleted)) {
                LOGGER.error("Cleanup delete failed, object may be orphaned: key={}", key);
              }
              outcome.completeExceptionally(cause);
            });
  }

  private static void closeQuietly(InputStream data, String originalName) {
    try {
      data.close();
    } catch (IOException e) {
      LOGGER.warn("Failed to close upload stream: originalName={}", originalName, e);
    }
  }
}
