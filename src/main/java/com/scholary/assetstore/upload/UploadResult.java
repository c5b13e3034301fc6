package com.scholary.assetstore.upload;

/**
 * Outcome of a successful upload.
 *
 * <p>The caller associates it with a domain record. {@code signedUrl} is null when the object was
 * stored but signing failed; a fresh URL can be requested later.
 */
public record UploadResult(
    String bucket,
    String key,
    String signedUrl,
    String eTag,
    long size,
    String contentType,
    String originalFilename) {}
