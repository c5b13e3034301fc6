package com.scholary.assetstore.api;

import com.scholary.assetstore.objectstore.ObjectDeleter;
import com.scholary.assetstore.objectstore.SignedUrlIssuer;
import com.scholary.assetstore.upload.AssetUploadCoordinator;
import com.scholary.assetstore.upload.UploadResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for image assets.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Uploading an image and receiving a signed URL for it
 *   <li>Refreshing the signed URL of a stored image
 *   <li>Deleting a stored image
 * </ul>
 */
@RestController
@RequestMapping("/v1/assets")
@Tag(name = "Assets", description = "Image upload, signed URL and deletion API")
public class AssetController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssetController.class);

  private final AssetUploadCoordinator uploadCoordinator;
  private final SignedUrlIssuer signedUrlIssuer;
  private final ObjectDeleter objectDeleter;

  public AssetController(
      AssetUploadCoordinator uploadCoordinator,
      SignedUrlIssuer signedUrlIssuer,
      ObjectDeleter objectDeleter) {
    this.uploadCoordinator = uploadCoordinator;
    this.signedUrlIssuer = signedUrlIssuer;
    this.objectDeleter = objectDeleter;
  }

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload an image",
      description =
          "Stores the image under a generated key and returns a signed URL valid for 24 hours. "
              + "Responds 503 with Retry-After while storage is still initializing.")
  public CompletableFuture<ResponseEntity<UploadResult>> upload(
      @RequestParam("file") MultipartFile file) {
    LOGGER.info(
        "Upload request: originalName={}, contentType={}, size={}",
        file.getOriginalFilename(),
        file.getContentType(),
        file.getSize());

    return uploadCoordinator
        .upload(file, file.getOriginalFilename(), file.getContentType(), file.getSize())
        .thenApply(result -> ResponseEntity.status(HttpStatus.CREATED).body(result));
  }

  @GetMapping("/url")
  @Operation(summary = "Refresh the signed URL of a stored image")
  public ResponseEntity<SignedUrlResponse> refreshUrl(@RequestParam("key") String key) {
    Instant expiresAt = Instant.now().plus(signedUrlIssuer.refreshTtl());
    return signedUrlIssuer
        .refreshUrl(key)
        .map(url -> ResponseEntity.ok(new SignedUrlResponse(key, url, expiresAt)))
        .orElseGet(
            () ->
                ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .header(HttpHeaders.RETRY_AFTER, ApiExceptionHandler.RETRY_AFTER_SECONDS)
                    .build());
  }

  @DeleteMapping
  @Operation(summary = "Delete a stored image", description = "Deleting a missing key succeeds.")
  public CompletableFuture<ResponseEntity<Void>> delete(@RequestParam("key") String key) {
    return objectDeleter
        .deleteObject(key)
        .thenApply(
            deleted ->
                deleted
                    ? ResponseEntity.noContent().<Void>build()
                    : ResponseEntity.status(HttpStatus.BAD_GATEWAY).<Void>build());
  }
}
