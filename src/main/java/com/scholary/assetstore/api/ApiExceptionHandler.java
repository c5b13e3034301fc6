package com.scholary.assetstore.api;

import com.scholary.assetstore.objectstore.ClientNotInitializedException;
import com.scholary.assetstore.objectstore.UploadException;
import com.scholary.assetstore.upload.InvalidUploadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Maps storage failures to HTTP responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String RETRY_AFTER_SECONDS = "5";

  @ExceptionHandler(InvalidUploadException.class)
  public ResponseEntity<ErrorResponse> handleInvalidUpload(InvalidUploadException e) {
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("invalid_upload", e.getMessage(), false));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException e) {
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(new ErrorResponse("file_too_large", e.getMessage(), false));
  }

  @ExceptionHandler(ClientNotInitializedException.class)
  public ResponseEntity<ErrorResponse> handleNotInitialized(ClientNotInitializedException e) {
    LOGGER.warn("Storage not ready: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .body(new ErrorResponse("storage_not_ready", e.getMessage(), true));
  }

  @ExceptionHandler(UploadException.class)
  public ResponseEntity<ErrorResponse> handleUploadFailure(UploadException e) {
    LOGGER.error("Upload failed: key={}", e.getKey().orElse(null), e);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ErrorResponse("upload_failed", e.getMessage(), true));
  }
}
