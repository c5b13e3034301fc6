package com.scholary.assetstore.api;

import java.time.Instant;

/** Response for a signed URL refresh. */
public record SignedUrlResponse(String key, String url, Instant expiresAt) {}
