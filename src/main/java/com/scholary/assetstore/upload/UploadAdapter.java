package com.scholary.assetstore.upload;

import com.scholary.assetstore.logging.StorageEventLogger;
import com.scholary.assetstore.objectstore.ClientNotInitializedException;
import com.scholary.assetstore.objectstore.ObjectStoreProperties;
import com.scholary.assetstore.objectstore.S3ErrorClassifier;
import com.scholary.assetstore.objectstore.SignedUrlIssuer;
import com.scholary.assetstore.objectstore.StorageClient;
import com.scholary.assetstore.objectstore.StorageClientHandle;
import com.scholary.assetstore.objectstore.UploadException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;

/**
 * Streams an uploaded file into the bucket under a generated key and signs a URL for it.
 *
 * <p>The pipeline is strictly sequential: key generation, transfer, signing. The stream is read
 * one part at a time, so memory use is bounded by the part size no matter how large the file is.
 * A stream that fits in a single part is stored with one PutObject; anything larger goes through a
 * multipart upload, which is aborted if any part fails so no partial object remains.
 *
 * <p>Failures after key generation surface as {@link UploadException} carrying the key. This class
 * never deletes objects itself; see {@link AssetUploadCoordinator} for cleanup.
 */
@Service
public class UploadAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadAdapter.class);

  private final StorageClient storageClient;
  private final SignedUrlIssuer signedUrlIssuer;
  private final ObjectKeyGenerator keyGenerator;
  private final int partSize;
  private final Duration urlTtl;
  private final Executor executor;
  private final StorageEventLogger eventLogger = new StorageEventLogger(LOGGER);

  public UploadAdapter(
      StorageClient storageClient,
      SignedUrlIssuer signedUrlIssuer,
      ObjectKeyGenerator keyGenerator,
      ObjectStoreProperties properties,
      @Qualifier("storageExecutor") Executor executor) {
    this.storageClient = storageClient;
    this.signedUrlIssuer = signedUrlIssuer;
    this.keyGenerator = keyGenerator;
    this.partSize = Math.toIntExact(properties.partSize().toBytes());
    this.urlTtl = properties.uploadUrlTtl();
    this.executor = executor;
  }

  /**
   * Upload a file.
   *
   * @param data the file body; read to the end but not closed
   * @param originalName the client-supplied filename, used for the key extension
   * @param contentType the declared MIME type
   * @return a future completing with the result, or failing with {@link
   *     ClientNotInitializedException} (retryable) or {@link UploadException}
   */
  public CompletableFuture<UploadResult> upload(
      InputStream data, String originalName, String contentType) {
    StorageClientHandle handle;
    try {
      handle = storageClient.getClient();
    } catch (ClientNotInitializedException e) {
      LOGGER.warn("Upload rejected, storage client not ready: originalName={}", originalName);
      return CompletableFuture.failedFuture(e);
    }

    String key;
    try {
      key = keyGenerator.generate(originalName);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(
          new UploadException("Failed to generate object key for " + originalName, null, e));
    }

    long startedAt = System.currentTimeMillis();
    CompletableFuture<UploadResult> outcome = new CompletableFuture<>();
    try {
      CompletableFuture.supplyAsync(() -> transfer(handle, key, data, contentType), executor)
          .thenApply(
              transfer -> {
                eventLogger.logUploadCompleted(
                    handle.bucket(),
                    key,
                    transfer.size(),
                    transfer.parts(),
                    contentType,
                    System.currentTimeMillis() - startedAt);
                return toResult(handle, key, transfer, contentType, originalName);
              })
          .whenComplete(
              (result, error) -> {
                if (error == null) {
                  outcome.complete(result);
                } else {
                  outcome.completeExceptionally(toUploadException(handle, key, error));
                }
              });
    } catch (RuntimeException e) {
      outcome.completeExceptionally(toUploadException(handle, key, e));
    }
    return outcome;
  }

  private Transfer transfer(
      StorageClientHandle handle, String key, InputStream data, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, region={}", handle.bucket(), key, handle.region());
    try {
      byte[] first = data.readNBytes(partSize);
      if (first.length < partSize) {
        return putSingle(handle, key, first, contentType);
      }
      byte[] second = data.readNBytes(partSize);
      if (second.length == 0) {
        return putSingle(handle, key, first, contentType);
      }
      return putMultipart(handle, key, contentType, first, second, data);

    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private Transfer putSingle(
      StorageClientHandle handle, String key, byte[] body, String contentType) {
    PutObjectRequest request =
        PutObjectRequest.builder()
            .bucket(handle.bucket())
            .key(key)
            .contentType(contentType)
            .contentLength((long) body.length)
            .build();

    PutObjectResponse response = handle.client().putObject(request, RequestBody.fromBytes(body));
    return new Transfer(response.eTag(), body.length, 1);
  }

  private Transfer putMultipart(
      StorageClientHandle handle,
      String key,
      String contentType,
      byte[] first,
      byte[] second,
      InputStream remaining)
      throws IOException {
    S3Client client = handle.client();
    String uploadId =
        client
            .createMultipartUpload(
                CreateMultipartUploadRequest.builder()
                    .bucket(handle.bucket())
                    .key(key)
                    .contentType(contentType)
                    .build())
            .uploadId();

    try {
      List<CompletedPart> parts = new ArrayList<>();
      long size = 0;
      byte[] chunk = first;
      byte[] next = second;

      while (chunk.length > 0) {
        int partNumber = parts.size() + 1;
        UploadPartResponse response =
            client.uploadPart(
                UploadPartRequest.builder()
                    .bucket(handle.bucket())
                    .key(key)
                    .uploadId(uploadId)
                    .partNumber(partNumber)
                    .contentLength((long) chunk.length)
                    .build(),
                RequestBody.fromBytes(chunk));

        parts.add(CompletedPart.builder().partNumber(partNumber).eTag(response.eTag()).build());
        size += chunk.length;
        LOGGER.debug("Uploaded part: key={}, part={}, bytes={}", key, partNumber, chunk.length);

        chunk = next;
        next = chunk.length > 0 ? remaining.readNBytes(partSize) : new byte[0];
      }

      CompleteMultipartUploadResponse done =
          client.completeMultipartUpload(
              CompleteMultipartUploadRequest.builder()
                  .bucket(handle.bucket())
                  .key(key)
                  .uploadId(uploadId)
                  .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
                  .build());

      return new Transfer(done.eTag(), size, parts.size());

    } catch (IOException | RuntimeException e) {
      abort(handle, key, uploadId, e);
      throw e;
    }
  }

  private void abort(StorageClientHandle handle, String key, String uploadId, Exception failure) {
    try {
      handle
          .client()
          .abortMultipartUpload(
              AbortMultipartUploadRequest.builder()
                  .bucket(handle.bucket())
                  .key(key)
                  .uploadId(uploadId)
                  .build());
      LOGGER.info("Aborted multipart upload: key={}, uploadId={}", key, uploadId);

    } catch (SdkException abortError) {
      failure.addSuppressed(abortError);
      LOGGER.warn(
          "Failed to abort multipart upload, parts may linger until lifecycle cleanup: "
              + "key={}, uploadId={}",
          key,
          uploadId,
          abortError);
    }
  }

  private UploadResult toResult(
      StorageClientHandle handle,
      String key,
      Transfer transfer,
      String contentType,
      String originalName) {
    String signedUrl = signedUrlIssuer.issueUrl(key, urlTtl).orElse(null);
    if (signedUrl == null) {
      LOGGER.warn("Object stored but URL signing failed, refresh later: key={}", key);
    }
    return new UploadResult(
        handle.bucket(),
        key,
        signedUrl,
        transfer.eTag(),
        transfer.size(),
        contentType,
        originalName);
  }

  private UploadException toUploadException(
      StorageClientHandle handle, String key, Throwable error) {
    Throwable cause = S3ErrorClassifier.unwrap(error);
    if (cause instanceof UploadException) {
      return (UploadException) cause;
    }
    if (cause instanceof UncheckedIOException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    eventLogger.logUploadFailed(
        handle.bucket(), key, cause.getClass().getSimpleName(), cause.getMessage());
    return new UploadException(
        "Upload failed: bucket=" + handle.bucket() + ", key=" + key, key, cause);
  }

  private record Transfer(String eTag, long size, int parts) {}
}
