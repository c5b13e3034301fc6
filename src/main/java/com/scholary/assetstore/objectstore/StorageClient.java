package com.scholary.assetstore.objectstore;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide owner of the {@link StorageClientHandle}.
 *
 * <p>Initialization is a one-shot future installed with compare-and-set: concurrent callers of
 * {@link #initialize()} all get the same future, and at most one handle is ever installed. The
 * sequence is:
 *
 * <ol>
 *   <li>resolve the bucket region
 *   <li>ensure the bucket exists there (an unusable bucket is logged, not fatal)
 *   <li>build the handle bound to that region
 * </ol>
 *
 * <p>If resolving or provisioning throws, the handle is built against the fallback region after a
 * best-effort provisioning attempt there, so the process can still run degraded. Only a failure to
 * construct the handle leaves the future failed; a later {@link #initialize()} call then retries.
 *
 * <p>Callers only ever receive copies of the internal future, so cancelling or timing out a wait
 * does not settle initialization. After {@link #close()} no new attempt starts, and a handle that
 * is still being built is closed as soon as it arrives.
 */
public class StorageClient implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(StorageClient.class);

  private final ObjectStoreProperties properties;
  private final RegionResolver regionResolver;
  private final BucketProvisioner bucketProvisioner;
  private final S3ClientFactory clientFactory;

  private final AtomicReference<CompletableFuture<StorageClientHandle>> initialization =
      new AtomicReference<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  public StorageClient(
      ObjectStoreProperties properties,
      RegionResolver regionResolver,
      BucketProvisioner bucketProvisioner,
      S3ClientFactory clientFactory) {
    this.properties = properties;
    this.regionResolver = regionResolver;
    this.bucketProvisioner = bucketProvisioner;
    this.clientFactory = clientFactory;
  }

  /**
   * Start initialization if it has not started yet, or if the previous attempt failed.
   *
   * @return a future completing with the installed handle; completing or cancelling it has no
   *     effect on initialization
   */
  public CompletableFuture<StorageClientHandle> initialize() {
    while (true) {
      if (closed.get()) {
        return CompletableFuture.failedFuture(closedException());
      }
      CompletableFuture<StorageClientHandle> current = initialization.get();
      if (current != null && !current.isCompletedExceptionally()) {
        return current.copy();
      }
      CompletableFuture<StorageClientHandle> attempt = new CompletableFuture<>();
      if (initialization.compareAndSet(current, attempt)) {
        // close() flips the flag before reading the reference, so either it sees this attempt or
        // this check sees the flag
        if (closed.get()) {
          attempt.completeExceptionally(closedException());
        } else {
          start(attempt);
        }
        return attempt.copy();
      }
    }
  }

  /**
   * Return the handle if initialization has completed.
   *
   * @throws ClientNotInitializedException if initialization has not started, is still running, or
   *     failed
   */
  public StorageClientHandle getClient() {
    if (closed.get()) {
      throw closedException();
    }
    CompletableFuture<StorageClientHandle> current = initialization.get();
    if (current == null || !current.isDone()) {
      throw new ClientNotInitializedException(
          "Storage client not initialized. Please wait for initialization to complete.");
    }
    if (current.isCompletedExceptionally()) {
      throw new ClientNotInitializedException(
          "Storage client initialization failed; it will be retried on the next initialize()");
    }
    return current.join();
  }

  /** Wait for the handle, starting initialization if nobody has yet. */
  public CompletableFuture<StorageClientHandle> awaitClient() {
    return initialize();
  }

  /** True once a handle is installed. */
  public boolean isReady() {
    CompletableFuture<StorageClientHandle> current = initialization.get();
    return !closed.get()
        && current != null
        && current.isDone()
        && !current.isCompletedExceptionally();
  }

  private void start(CompletableFuture<StorageClientHandle> attempt) {
    String bucket = properties.bucket();
    LOGGER.info("Initializing storage client: bucket={}", bucket);

    CompletableFuture<String> region;
    try {
      region =
          regionResolver
              .resolveRegion(bucket)
              .thenCompose(resolved -> provision(bucket, resolved))
              .exceptionallyCompose(error -> fallback(bucket, error));
    } catch (RuntimeException e) {
      region = fallback(bucket, e);
    }

    region
        .thenApply(this::buildHandle)
        .whenComplete(
            (handle, error) -> {
              if (error != null) {
                LOGGER.error("Failed to initialize storage client: bucket={}", bucket, error);
                attempt.completeExceptionally(S3ErrorClassifier.unwrap(error));
              } else {
                attempt.complete(handle);
              }
            });
  }

  private CompletableFuture<String> provision(String bucket, String region) {
    return bucketProvisioner
        .ensureBucket(bucket, region)
        .thenApply(
            usable -> {
              if (!usable) {
                LOGGER.warn(
                    "Bucket provisioning failed, continuing with client initialization: "
                        + "bucket={}, region={}",
                    bucket,
                    region);
              }
              return region;
            });
  }

  private CompletableFuture<String> fallback(String bucket, Throwable error) {
    String fallbackRegion = properties.fallbackRegion();
    LOGGER.error(
        "Region detection or provisioning failed, using fallback region: bucket={}, region={}",
        bucket,
        fallbackRegion,
        S3ErrorClassifier.unwrap(error));

    CompletableFuture<Boolean> provisioned;
    try {
      provisioned = bucketProvisioner.ensureBucket(bucket, fallbackRegion);
    } catch (RuntimeException e) {
      provisioned = CompletableFuture.failedFuture(e);
    }
    return provisioned.handle(
        (usable, provisionError) -> {
          if (provisionError != null || !Boolean.TRUE.equals(usable)) {
            LOGGER.warn(
                "Bucket provisioning failed in fallback region: bucket={}, region={}",
                bucket,
                fallbackRegion,
                provisionError == null ? null : S3ErrorClassifier.unwrap(provisionError));
          }
          return fallbackRegion;
        });
  }

  private StorageClientHandle buildHandle(String region) {
    S3Client client = clientFactory.create(region);
    S3Presigner presigner;
    try {
      presigner = clientFactory.createPresigner(region);
    } catch (RuntimeException e) {
      client.close();
      throw e;
    }
    StorageClientHandle handle =
        new StorageClientHandle(properties.bucket(), region, client, presigner);
    LOGGER.info("Storage client initialized: bucket={}, region={}", handle.bucket(), region);
    return handle;
  }

  /**
   * Release the handle's connections when the application shuts down. A handle still being built
   * is closed once it arrives. Later {@link #initialize()} calls fail.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    LOGGER.info("Closing storage client");
    CompletableFuture<StorageClientHandle> current = initialization.get();
    if (current != null) {
      current.whenComplete(
          (handle, error) -> {
            if (handle != null) {
              handle.close();
            }
          });
    }
  }

  private static ClientNotInitializedException closedException() {
    return new ClientNotInitializedException("Storage client is closed");
  }
}
