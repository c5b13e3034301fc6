package com.scholary.assetstore.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log storage events with structured fields that can be queried in the log
 * backend. Fields are removed again after each event.
 */
public class StorageEventLogger {

  private final Logger logger;

  public StorageEventLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a single region probe. */
  public void logRegionProbe(String bucket, String region, int attempt, String outcome) {
    try {
      MDC.put("event_type", "region_probe");
      MDC.put("bucket", bucket);
      MDC.put("region", region);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("outcome", outcome);

      logger.debug(
          "Region probe: bucket={}, region={}, attempt={}, outcome={}",
          bucket,
          region,
          attempt,
          outcome);
    } finally {
      clearEventFields();
    }
  }

  /** Log the end of a region resolution. */
  public void logRegionResolved(String bucket, String region, int probes, boolean confident) {
    try {
      MDC.put("event_type", "region_resolved");
      MDC.put("bucket", bucket);
      MDC.put("region", region);
      MDC.put("probes", String.valueOf(probes));
      MDC.put("confident", String.valueOf(confident));

      if (confident) {
        logger.info("Resolved bucket region: bucket={}, region={}, probes={}", bucket, region, probes);
      } else {
        logger.warn(
            "Could not detect bucket region, using fallback: bucket={}, region={}, probes={}",
            bucket,
            region,
            probes);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of a bucket provisioning check. */
  public void logBucketProvisioning(String bucket, String region, String action, boolean usable) {
    try {
      MDC.put("event_type", "bucket_provisioning");
      MDC.put("bucket", bucket);
      MDC.put("region", region);
      MDC.put("action", action);
      MDC.put("usable", String.valueOf(usable));

      if (usable) {
        logger.info("Bucket ready: bucket={}, region={}, action={}", bucket, region, action);
      } else {
        logger.error("Bucket unusable: bucket={}, region={}, action={}", bucket, region, action);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a completed upload. */
  public void logUploadCompleted(
      String bucket, String key, long size, int parts, String contentType, long durationMs) {
    try {
      MDC.put("event_type", "upload_completed");
      MDC.put("bucket", bucket);
      MDC.put("key", key);
      MDC.put("size", String.valueOf(size));
      MDC.put("parts", String.valueOf(parts));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Upload completed: bucket={}, key={}, size={} bytes, parts={}, contentType={}, took={}ms",
          bucket,
          key,
          size,
          parts,
          contentType,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed upload. */
  public void logUploadFailed(String bucket, String key, String errorType, String message) {
    try {
      MDC.put("event_type", "upload_failed");
      MDC.put("bucket", bucket);
      MDC.put("key", key);
      MDC.put("errorType", errorType);

      logger.error(
          "Upload failed: bucket={}, key={}, error={}, message={}",
          bucket,
          key,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log an object deletion. */
  public void logObjectDeleted(String bucket, String key, boolean alreadyAbsent) {
    try {
      MDC.put("event_type", "object_deleted");
      MDC.put("bucket", bucket);
      MDC.put("key", key);
      MDC.put("alreadyAbsent", String.valueOf(alreadyAbsent));

      logger.info(
          "Object deleted: bucket={}, key={}, alreadyAbsent={}", bucket, key, alreadyAbsent);
    } finally {
      clearEventFields();
    }
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("bucket");
    MDC.remove("region");
    MDC.remove("key");
    MDC.remove("attempt");
    MDC.remove("outcome");
    MDC.remove("probes");
    MDC.remove("confident");
    MDC.remove("action");
    MDC.remove("usable");
    MDC.remove("size");
    MDC.remove("parts");
    MDC.remove("durationMs");
    MDC.remove("errorType");
    MDC.remove("alreadyAbsent");
  }
}
