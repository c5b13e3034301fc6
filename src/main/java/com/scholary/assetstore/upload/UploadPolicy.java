package com.scholary.assetstore.upload;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Accept/reject filter for inbound files.
 *
 * <p>Runs before the file stream is opened: only image types from the allowed set and files up to
 * the size ceiling get through.
 */
@Component
public class UploadPolicy {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadPolicy.class);

  private final UploadProperties properties;

  public UploadPolicy(UploadProperties properties) {
    this.properties = properties;
  }

  /**
   * Check an inbound file.
   *
   * @param originalName the client-supplied filename
   * @param contentType the declared MIME type
   * @param size the file size in bytes, or a negative value if unknown
   * @throws InvalidUploadException if the file is not accepted
   */
  public void check(String originalName, String contentType, long size) {
    if (originalName == null || originalName.isBlank()) {
      throw reject("Original filename is required", originalName, contentType, size);
    }

    String normalizedType = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
    int parameters = normalizedType.indexOf(';');
    if (parameters >= 0) {
      normalizedType = normalizedType.substring(0, parameters).trim();
    }
    if (!properties.allowedContentTypes().contains(normalizedType)) {
      throw reject(
          "Only image files are allowed: " + properties.allowedContentTypes(),
          originalName,
          contentType,
          size);
    }

    long maxBytes = properties.maxFileSize().toBytes();
    if (size > maxBytes) {
      throw reject(
          "File size exceeds maximum allowed: " + maxBytes + " bytes",
          originalName,
          contentType,
          size);
    }
  }

  private static InvalidUploadException reject(
      String message, String originalName, String contentType, long size) {
    LOGGER.warn(
        "Upload rejected: reason={}, originalName={}, contentType={}, size={}",
        message,
        originalName,
        contentType,
        size);
    return new InvalidUploadException(message);
  }
}
