package com.scholary.assetstore.objectstore;

import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Builds region-bound S3 clients from the configured credentials.
 *
 * <p>Region probing needs a fresh client per candidate region, so client construction sits behind
 * this seam. Tests substitute a factory that hands out mocks.
 */
public interface S3ClientFactory {

  /**
   * Create a client bound to the given region. The caller owns the client and must close it.
   *
   * @param region the AWS region identifier, e.g. "eu-west-1"
   * @return a new client
   */
  S3Client create(String region);

  /**
   * Create a presigner bound to the given region. The caller owns the presigner and must close it.
   *
   * @param region the AWS region identifier
   * @return a new presigner
   */
  S3Presigner createPresigner(String region);
}
