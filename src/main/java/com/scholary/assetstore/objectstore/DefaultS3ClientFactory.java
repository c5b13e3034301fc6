package com.scholary.assetstore.objectstore;

import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * AWS SDK v2 implementation of {@link S3ClientFactory}.
 *
 * <p>Works against real S3 and S3-compatible services like MinIO. For the latter, set an endpoint
 * override and path-style access. Every client carries the configured per-call timeout; retries
 * stay at the SDK default.
 */
public class DefaultS3ClientFactory implements S3ClientFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultS3ClientFactory.class);

  private final ObjectStoreProperties properties;
  private final AwsCredentialsProvider credentialsProvider;

  public DefaultS3ClientFactory(ObjectStoreProperties properties) {
    this.properties = properties;
    this.credentialsProvider = StaticCredentialsProvider.create(credentials(properties));
  }

  @Override
  public S3Client create(String region) {
    LOGGER.debug(
        "Building S3 client: region={}, endpoint={}, pathStyleAccess={}",
        region,
        properties.endpoint(),
        properties.pathStyleAccess());

    S3ClientBuilder builder =
        S3Client.builder()
            .region(Region.of(region))
            .credentialsProvider(credentialsProvider)
            .forcePathStyle(properties.pathStyleAccess())
            .overrideConfiguration(
                ClientOverrideConfiguration.builder()
                    .apiCallTimeout(properties.apiCallTimeout())
                    .apiCallAttemptTimeout(properties.apiCallTimeout())
                    .build());

    if (properties.hasEndpointOverride()) {
      builder.endpointOverride(URI.create(properties.endpoint()));
    }
    return builder.build();
  }

  @Override
  public S3Presigner createPresigner(String region) {
    S3Presigner.Builder builder =
        S3Presigner.builder()
            .region(Region.of(region))
            .credentialsProvider(credentialsProvider)
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(properties.pathStyleAccess())
                    .build());

    if (properties.hasEndpointOverride()) {
      builder.endpointOverride(URI.create(properties.endpoint()));
    }
    return builder.build();
  }

  private static AwsCredentials credentials(ObjectStoreProperties properties) {
    if (properties.hasSessionToken()) {
      return AwsSessionCredentials.create(
          properties.accessKey(), properties.secretKey(), properties.sessionToken());
    }
    return AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());
  }
}
