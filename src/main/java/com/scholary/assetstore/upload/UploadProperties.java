package com.scholary.assetstore.upload;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * Limits applied to inbound files before anything is sent to the bucket.
 *
 * <p>Maps to the "upload.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "upload")
@Validated
public record UploadProperties(DataSize maxFileSize, Set<String> allowedContentTypes) {

  public static final Set<String> DEFAULT_CONTENT_TYPES =
      Set.of("image/jpeg", "image/png", "image/gif", "image/webp");

  public UploadProperties {
    maxFileSize = maxFileSize == null ? DataSize.ofMegabytes(10) : maxFileSize;
    allowedContentTypes =
        allowedContentTypes == null || allowedContentTypes.isEmpty()
            ? DEFAULT_CONTENT_TYPES
            : allowedContentTypes.stream()
                .map(type -> type.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
  }
}
