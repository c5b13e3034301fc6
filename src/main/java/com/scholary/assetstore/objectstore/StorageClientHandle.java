package com.scholary.assetstore.objectstore;

import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Authenticated, region-bound access to the asset bucket.
 *
 * <p>Built once by {@link StorageClient} and shared read-only by all operations. A handle is never
 * modified; if it has to change, a new one replaces it.
 */
public record StorageClientHandle(
    String bucket, String region, S3Client client, S3Presigner presigner)
    implements AutoCloseable {

  @Override
  public void close() {
    client.close();
    presigner.close();
  }
}
