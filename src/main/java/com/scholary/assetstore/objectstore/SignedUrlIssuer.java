package com.scholary.assetstore.objectstore;

import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

/**
 * Issues time-limited GET URLs for stored objects.
 *
 * <p>Signing failures are not fatal to the operation that needs the URL, so they come back as an
 * empty optional, never as an exception. An empty result means "try again later".
 */
public class SignedUrlIssuer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SignedUrlIssuer.class);

  private final StorageClient storageClient;
  private final Duration defaultTtl;
  private final Duration refreshTtl;

  public SignedUrlIssuer(StorageClient storageClient, Duration defaultTtl, Duration refreshTtl) {
    this.storageClient = storageClient;
    this.defaultTtl = defaultTtl;
    this.refreshTtl = refreshTtl;
  }

  /** Sign a URL with the default TTL. */
  public Optional<String> issueUrl(String key) {
    return issueUrl(key, defaultTtl);
  }

  /**
   * Sign a GET URL for the key.
   *
   * @param key the object key
   * @param ttl how long the URL stays valid; null, zero or negative means the default TTL
   * @return the URL, or empty if signing failed
   */
  public Optional<String> issueUrl(String key, Duration ttl) {
    Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;

    try {
      StorageClientHandle handle = storageClient.getClient();

      GetObjectRequest getObjectRequest =
          GetObjectRequest.builder().bucket(handle.bucket()).key(key).build();

      GetObjectPresignRequest presignRequest =
          GetObjectPresignRequest.builder()
              .signatureDuration(effectiveTtl)
              .getObjectRequest(getObjectRequest)
              .build();

      PresignedGetObjectRequest presigned = handle.presigner().presignGetObject(presignRequest);

      LOGGER.debug("Generated signed URL: key={}, ttl={}", key, effectiveTtl);
      return Optional.of(presigned.url().toString());

    } catch (Exception e) {
      LOGGER.error("Error generating signed URL: key={}, ttl={}", key, effectiveTtl, e);
      return Optional.empty();
    }
  }

  /** Sign a fresh URL for an object whose previous URL expired or is about to. */
  public Optional<String> refreshUrl(String key) {
    return issueUrl(key, refreshTtl);
  }

  public Duration refreshTtl() {
    return refreshTtl;
  }
}
