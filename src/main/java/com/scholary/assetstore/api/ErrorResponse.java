package com.scholary.assetstore.api;

/**
 * Error body returned by the API.
 *
 * <p>{@code retryable} tells the client whether the same request may succeed later.
 */
public record ErrorResponse(String error, String message, boolean retryable) {}
