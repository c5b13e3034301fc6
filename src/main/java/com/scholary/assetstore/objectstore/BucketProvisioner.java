package com.scholary.assetstore.objectstore;

import com.scholary.assetstore.logging.StorageEventLogger;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;

/**
 * Makes sure the bucket exists in a given region, creating it if it is absent.
 *
 * <p>A forbidden existence check means someone else owns the bucket or restricts introspection; it
 * is treated as usable without attempting creation. Creation is attempted once and never retried.
 */
public class BucketProvisioner {

  private static final Logger LOGGER = LoggerFactory.getLogger(BucketProvisioner.class);

  private final S3ClientFactory clientFactory;
  private final Executor executor;
  private final StorageEventLogger eventLogger = new StorageEventLogger(LOGGER);

  public BucketProvisioner(S3ClientFactory clientFactory, Executor executor) {
    this.clientFactory = clientFactory;
    this.executor = executor;
  }

  /**
   * Ensure the bucket is usable in the region.
   *
   * @param bucketName the bucket
   * @param region the region the bucket should live in
   * @return a future completing with true if the bucket is usable, false otherwise; it never
   *     completes exceptionally
   */
  public CompletableFuture<Boolean> ensureBucket(String bucketName, String region) {
    try {
      return CompletableFuture.supplyAsync(() -> provision(bucketName, region), executor)
          .exceptionally(
              error -> {
                LOGGER.error(
                    "Unexpected error provisioning bucket: bucket={}, region={}",
                    bucketName,
                    region,
                    S3ErrorClassifier.unwrap(error));
                eventLogger.logBucketProvisioning(bucketName, region, "check_failed", false);
                return false;
              });
    } catch (RejectedExecutionException e) {
      LOGGER.error(
          "Bucket provisioning rejected by storage executor: bucket={}, region={}",
          bucketName,
          region,
          e);
      return CompletableFuture.completedFuture(false);
    }
  }

  private boolean provision(String bucketName, String region) {
    LOGGER.debug("Checking if bucket exists: bucket={}, region={}", bucketName, region);

    try (S3Client client = clientFactory.create(region)) {
      try {
        client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
        eventLogger.logBucketProvisioning(bucketName, region, "exists", true);
        return true;

      } catch (SdkException e) {
        S3ErrorKind kind = S3ErrorClassifier.classify(e);
        switch (kind) {
          case NOT_FOUND:
            return create(client, bucketName, region);
          case FORBIDDEN:
            LOGGER.warn(
                "Bucket exists but access denied, continuing anyway: bucket={}, region={}",
                bucketName,
                region);
            eventLogger.logBucketProvisioning(bucketName, region, "forbidden", true);
            return true;
          default:
            LOGGER.error(
                "Error checking bucket: bucket={}, region={}, kind={}", bucketName, region, kind, e);
            eventLogger.logBucketProvisioning(bucketName, region, "check_failed", false);
            return false;
        }
      }
    }
  }

  private boolean create(S3Client client, String bucketName, String region) {
    LOGGER.info("Bucket does not exist, creating: bucket={}, region={}", bucketName, region);

    CreateBucketRequest.Builder request = CreateBucketRequest.builder().bucket(bucketName);
    // us-east-1 rejects an explicit location constraint
    if (!ObjectStoreProperties.DEFAULT_REGION.equals(region)) {
      request.createBucketConfiguration(
          CreateBucketConfiguration.builder().locationConstraint(region).build());
    }

    try {
      client.createBucket(request.build());
      eventLogger.logBucketProvisioning(bucketName, region, "created", true);
      return true;

    } catch (SdkException e) {
      LOGGER.error("Error creating bucket: bucket={}, region={}", bucketName, region, e);
      eventLogger.logBucketProvisioning(bucketName, region, "create_failed", false);
      return false;
    }
  }
}
