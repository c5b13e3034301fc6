package com.scholary.assetstore.objectstore;

import com.scholary.assetstore.logging.StorageEventLogger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;

/**
 * Finds the region that serves a bucket by probing candidate regions in order.
 *
 * <p>Each candidate gets exactly one HeadBucket call through a client bound to that region:
 *
 * <ul>
 *   <li>success: the candidate is the bucket region
 *   <li>region mismatch: move on to the next candidate
 *   <li>any other error: the candidate is taken as authoritative. The bucket most likely lives
 *       there but is unreadable (or absent) for another reason
 * </ul>
 *
 * <p>If every candidate reports a region mismatch, the configured fallback region is returned. A
 * resolution makes at most one probe per distinct candidate.
 */
public class RegionResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(RegionResolver.class);

  private final S3ClientFactory clientFactory;
  private final ObjectStoreProperties properties;
  private final Executor executor;
  private final StorageEventLogger eventLogger = new StorageEventLogger(LOGGER);

  public RegionResolver(
      S3ClientFactory clientFactory, ObjectStoreProperties properties, Executor executor) {
    this.clientFactory = clientFactory;
    this.properties = properties;
    this.executor = executor;
  }

  /**
   * Determine which region currently serves the bucket.
   *
   * @param bucketName the bucket to locate
   * @return a future completing with the region; it fails only if a probe client cannot be built
   */
  public CompletableFuture<String> resolveRegion(String bucketName) {
    List<String> candidates = candidateRegions();
    return CompletableFuture.supplyAsync(() -> probe(bucketName, candidates), executor);
  }

  /**
   * Candidate regions in probe order: the preferred region first, then the configured list, with
   * duplicates removed.
   */
  public List<String> candidateRegions() {
    Set<String> ordered = new LinkedHashSet<>();
    String preferred = properties.region();
    if (preferred != null && !preferred.isBlank()) {
      ordered.add(preferred.trim());
    }
    ordered.addAll(properties.candidateRegions());
    return new ArrayList<>(ordered);
  }

  private String probe(String bucketName, List<String> candidates) {
    LOGGER.info("Detecting region for bucket: {} ({} candidates)", bucketName, candidates.size());

    int attempt = 0;
    for (String region : candidates) {
      attempt++;
      try (S3Client probeClient = clientFactory.create(region)) {
        probeClient.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
        eventLogger.logRegionProbe(bucketName, region, attempt, "found");
        eventLogger.logRegionResolved(bucketName, region, attempt, true);
        return region;

      } catch (SdkException e) {
        S3ErrorKind kind = S3ErrorClassifier.classify(e);
        eventLogger.logRegionProbe(bucketName, region, attempt, kind.name());

        if (kind != S3ErrorKind.REGION_MISMATCH) {
          LOGGER.info(
              "Non-region error probing bucket={} in region={} ({}), bucket might exist there",
              bucketName,
              region,
              kind);
          eventLogger.logRegionResolved(bucketName, region, attempt, true);
          return region;
        }
      }
    }

    String fallback = properties.fallbackRegion();
    eventLogger.logRegionResolved(bucketName, fallback, attempt, false);
    return fallback;
  }
}
