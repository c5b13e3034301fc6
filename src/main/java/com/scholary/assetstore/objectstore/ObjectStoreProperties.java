package com.scholary.assetstore.objectstore;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the asset bucket.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. Credentials, bucket and region hint
 * are read once at startup and treated as immutable for the lifetime of the process. Optional keys
 * fall back to the defaults below when absent.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    String sessionToken,
    @NotBlank String bucket,
    String region,
    String fallbackRegion,
    List<String> candidateRegions,
    String endpoint,
    boolean pathStyleAccess,
    String keyPrefix,
    DataSize partSize,
    Duration uploadUrlTtl,
    Duration defaultUrlTtl,
    Duration apiCallTimeout) {

  public static final String DEFAULT_REGION = "us-east-1";

  /** Regions probed, in order, when the bucket region is not known. */
  public static final List<String> DEFAULT_CANDIDATE_REGIONS =
      List.of(
          "us-east-1",
          "us-west-1",
          "us-west-2",
          "eu-west-1",
          "eu-west-2",
          "eu-central-1",
          "ap-south-1",
          "ap-southeast-1",
          "ap-southeast-2",
          "ap-northeast-1");

  /** S3 rejects multipart parts smaller than this, except for the last one. */
  public static final DataSize MINIMUM_PART_SIZE = DataSize.ofMegabytes(5);

  public ObjectStoreProperties {
    fallbackRegion = isBlank(fallbackRegion) ? DEFAULT_REGION : fallbackRegion;
    candidateRegions =
        candidateRegions == null || candidateRegions.isEmpty()
            ? DEFAULT_CANDIDATE_REGIONS
            : List.copyOf(candidateRegions);
    keyPrefix = isBlank(keyPrefix) ? "products" : keyPrefix;
    partSize = partSize == null ? MINIMUM_PART_SIZE : partSize;
    uploadUrlTtl = uploadUrlTtl == null ? Duration.ofHours(24) : uploadUrlTtl;
    defaultUrlTtl = defaultUrlTtl == null ? Duration.ofHours(1) : defaultUrlTtl;
    apiCallTimeout = apiCallTimeout == null ? Duration.ofSeconds(30) : apiCallTimeout;

    if (partSize.compareTo(MINIMUM_PART_SIZE) < 0) {
      throw new IllegalArgumentException(
          "objectstore.part-size must be at least " + MINIMUM_PART_SIZE + " but was " + partSize);
    }
  }

  /** True when a session token was supplied alongside the access key pair. */
  public boolean hasSessionToken() {
    return !isBlank(sessionToken);
  }

  public boolean hasEndpointOverride() {
    return !isBlank(endpoint);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
