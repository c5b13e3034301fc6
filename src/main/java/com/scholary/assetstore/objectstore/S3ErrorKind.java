package com.scholary.assetstore.objectstore;

/** Closed set of outcomes {@link S3ErrorClassifier} maps remote failures to. */
public enum S3ErrorKind {
  /** The request went to a region that does not serve the bucket. */
  REGION_MISMATCH,
  /** Bucket or key does not exist. */
  NOT_FOUND,
  /** Access denied; the resource is presumed to exist. */
  FORBIDDEN,
  OTHER
}
