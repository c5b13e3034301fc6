package com.scholary.assetstore.objectstore;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.http.SdkHttpResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/**
 * Maps failures from the AWS SDK to an {@link S3ErrorKind}.
 *
 * <p>All inspection of SDK status codes, error codes and message text happens here. Everything
 * else in the package branches on the returned kind only.
 *
 * <p>HeadBucket responses carry no body, so a wrong-region probe usually surfaces as a bare 301
 * (or a 400 AuthorizationHeaderMalformed when the signing region is rejected). A bodiless 400 has
 * no error code at all; S3 still names the bucket's region in the {@code x-amz-bucket-region}
 * header, which marks it as a region mismatch. Client-side failures are matched on their message as
 * a last resort.
 */
public final class S3ErrorClassifier {

  static final String BUCKET_REGION_HEADER = "x-amz-bucket-region";

  private static final Set<String> REGION_MISMATCH_CODES =
      Set.of(
          "PermanentRedirect",
          "TemporaryRedirect",
          "AuthorizationHeaderMalformed",
          "IllegalLocationConstraintException",
          "IncorrectEndpoint");

  private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchBucket", "NoSuchKey", "NotFound");

  private static final Set<String> FORBIDDEN_CODES =
      Set.of("AccessDenied", "Forbidden", "AllAccessDisabled");

  private S3ErrorClassifier() {}

  public static S3ErrorKind classify(Throwable error) {
    Throwable cause = unwrap(error);
    if (cause == null) {
      return S3ErrorKind.OTHER;
    }
    if (cause instanceof NoSuchBucketException || cause instanceof NoSuchKeyException) {
      return S3ErrorKind.NOT_FOUND;
    }
    if (cause instanceof AwsServiceException) {
      S3ErrorKind kind = classifyServiceError((AwsServiceException) cause);
      if (kind != S3ErrorKind.OTHER) {
        return kind;
      }
    }
    return mentionsRegion(cause.getMessage()) ? S3ErrorKind.REGION_MISMATCH : S3ErrorKind.OTHER;
  }

  /** Strips the wrappers CompletableFuture adds around the original failure. */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static S3ErrorKind classifyServiceError(AwsServiceException error) {
    String code = errorCode(error);
    int status = error.statusCode();

    if (status == 301 || status == 307 || REGION_MISMATCH_CODES.contains(code)) {
      return S3ErrorKind.REGION_MISMATCH;
    }
    if (status == 400 && hasBucketRegionHeader(error)) {
      return S3ErrorKind.REGION_MISMATCH;
    }
    if (status == 404 || NOT_FOUND_CODES.contains(code)) {
      return S3ErrorKind.NOT_FOUND;
    }
    if (status == 403 || FORBIDDEN_CODES.contains(code)) {
      return S3ErrorKind.FORBIDDEN;
    }
    return S3ErrorKind.OTHER;
  }

  private static String errorCode(AwsServiceException error) {
    AwsErrorDetails details = error.awsErrorDetails();
    if (details == null || details.errorCode() == null) {
      return "";
    }
    return details.errorCode();
  }

  private static boolean hasBucketRegionHeader(AwsServiceException error) {
    AwsErrorDetails details = error.awsErrorDetails();
    if (details == null) {
      return false;
    }
    SdkHttpResponse response = details.sdkHttpResponse();
    return response != null && response.firstMatchingHeader(BUCKET_REGION_HEADER).isPresent();
  }

  private static boolean mentionsRegion(String message) {
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return message.contains("PermanentRedirect")
        || lower.contains("region")
        || lower.contains("endpoint");
  }
}
