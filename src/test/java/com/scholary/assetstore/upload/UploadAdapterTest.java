package com.scholary.assetstore.upload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.assetstore.objectstore.ClientNotInitializedException;
import com.scholary.assetstore.objectstore.ObjectDeleter;
import com.scholary.assetstore.objectstore.ObjectStoreProperties;
import com.scholary.assetstore.objectstore.SignedUrlIssuer;
import com.scholary.assetstore.objectstore.StorageClient;
import com.scholary.assetstore.objectstore.StorageClientHandle;
import com.scholary.assetstore.objectstore.UploadException;
import java.io.ByteArrayInputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@ExtendWith(MockitoExtension.class)
class UploadAdapterTest {

  private static final String BUCKET = "textile-inventory-images";
  private static final String KEY_PATTERN = "products/\\d+-[0-9a-f-]{36}\\.jpg";
  private static final int MB = 1024 * 1024;

  @Mock private StorageClient storageClient;
  @Mock private S3Client s3Client;

  private S3Presigner presigner;
  private ObjectStoreProperties properties;
  private UploadAdapter adapter;

  @BeforeEach
  void setUp() {
    presigner =
        S3Presigner.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create("AKIAEXAMPLE", "secret-example")))
            .build();
    lenient()
        .when(storageClient.getClient())
        .thenReturn(new StorageClientHandle(BUCKET, "us-east-1", s3Client, presigner));
    properties =
        new ObjectStoreProperties(
            "access", "secret", null, BUCKET, null, null, null, null, false, null, null, null,
            null, null);
    adapter = newAdapter(Runnable::run);
  }

  @AfterEach
  void tearDown() {
    presigner.close();
  }

  @Test
  void upload_smallImage_storesUnderGeneratedKeyAndSignsUrl() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().eTag("\"etag-1\"").build());

    UploadResult result =
        adapter.upload(new ByteArrayInputStream(new byte[2048]), "photo.jpg", "image/jpeg").join();

    assertThat(result.bucket()).isEqualTo(BUCKET);
    assertThat(result.key()).matches(KEY_PATTERN);
    assertThat(result.size()).isEqualTo(2048);
    assertThat(result.eTag()).isEqualTo("\"etag-1\"");
    assertThat(result.originalFilename()).isEqualTo("photo.jpg");
    assertThat(result.signedUrl())
        .contains(result.key())
        .contains("X-Amz-Signature=")
        .contains("X-Amz-Expires=86400");

    ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(request.capture(), any(RequestBody.class));
    assertThat(request.getValue().key()).isEqualTo(result.key());
    assertThat(request.getValue().contentType()).isEqualTo("image/jpeg");
    verify(s3Client, never()).createMultipartUpload(any(CreateMultipartUploadRequest.class));
  }

  @Test
  void upload_exactlyOnePart_usesSinglePut() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().eTag("\"etag-1\"").build());

    UploadResult result =
        adapter
            .upload(new ByteArrayInputStream(new byte[5 * MB]), "photo.jpg", "image/jpeg")
            .join();

    assertThat(result.size()).isEqualTo(5 * MB);
    verify(s3Client, never()).createMultipartUpload(any(CreateMultipartUploadRequest.class));
  }

  @Test
  void upload_largeFile_splitsIntoPartsAndCompletes() {
    stubMultipartStart();
    when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
        .thenReturn(UploadPartResponse.builder().eTag("\"part\"").build());
    when(s3Client.completeMultipartUpload(any(CompleteMultipartUploadRequest.class)))
        .thenReturn(CompleteMultipartUploadResponse.builder().eTag("\"multi-3\"").build());

    UploadResult result =
        adapter
            .upload(new ByteArrayInputStream(new byte[12 * MB]), "bolt.jpg", "image/jpeg")
            .join();

    assertThat(result.size()).isEqualTo(12L * MB);
    assertThat(result.eTag()).isEqualTo("\"multi-3\"");

    ArgumentCaptor<UploadPartRequest> parts = ArgumentCaptor.forClass(UploadPartRequest.class);
    verify(s3Client, times(3)).uploadPart(parts.capture(), any(RequestBody.class));
    assertThat(parts.getAllValues())
        .extracting(UploadPartRequest::partNumber, UploadPartRequest::contentLength)
        .containsExactly(tuple(1, 5L * MB), tuple(2, 5L * MB), tuple(3, 2L * MB));

    ArgumentCaptor<CompleteMultipartUploadRequest> complete =
        ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);
    verify(s3Client).completeMultipartUpload(complete.capture());
    assertThat(complete.getValue().multipartUpload().parts()).hasSize(3);
    verify(s3Client, never()).abortMultipartUpload(any(AbortMultipartUploadRequest.class));
  }

  @Test
  void upload_partFails_abortsAndReportsKey() {
    stubMultipartStart();
    when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
        .thenReturn(UploadPartResponse.builder().eTag("\"part\"").build())
        .thenThrow(S3Exception.builder().statusCode(500).message("connection dropped").build());

    CompletableFuture<UploadResult> upload =
        adapter.upload(new ByteArrayInputStream(new byte[12 * MB]), "bolt.jpg", "image/jpeg");

    assertThatThrownBy(upload::join)
        .isInstanceOf(CompletionException.class)
        .cause()
        .isInstanceOf(UploadException.class)
        .hasCauseInstanceOf(S3Exception.class);
    UploadException failure = (UploadException) upload.handle((r, e) -> e).join();
    assertThat(failure.getKey()).hasValueSatisfying(key -> assertThat(key).matches("products/.+"));

    verify(s3Client).abortMultipartUpload(any(AbortMultipartUploadRequest.class));
    verify(s3Client, never()).completeMultipartUpload(any(CompleteMultipartUploadRequest.class));

    when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().statusCode(404).build());
    ObjectDeleter deleter = new ObjectDeleter(storageClient, Runnable::run);

    assertThat(deleter.deleteObject(failure.getKey().get()).join()).isTrue();
  }

  @Test
  void upload_singlePutFails_wrapsCauseWithKey() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());

    CompletableFuture<UploadResult> upload =
        adapter.upload(new ByteArrayInputStream(new byte[10]), "photo.jpg", "image/jpeg");

    Throwable failure = upload.handle((r, e) -> e).join();
    assertThat(failure).isInstanceOf(UploadException.class);
    assertThat(((UploadException) failure).getKey()).isPresent();
    assertThat(failure.getMessage()).contains(BUCKET);
  }

  @Test
  void upload_concurrentSameName_getsDistinctKeysAndUrls() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().eTag("\"etag\"").build());
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      UploadAdapter concurrent = newAdapter(pool);

      CompletableFuture<UploadResult> first =
          concurrent.upload(new ByteArrayInputStream(new byte[512]), "photo.jpg", "image/jpeg");
      CompletableFuture<UploadResult> second =
          concurrent.upload(new ByteArrayInputStream(new byte[512]), "photo.jpg", "image/jpeg");

      List<UploadResult> results = List.of(first.join(), second.join());
      assertThat(results).extracting(UploadResult::key).doesNotHaveDuplicates();
      assertThat(results).extracting(UploadResult::signedUrl).doesNotHaveDuplicates();
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void upload_clientNotReady_failsFastWithoutRemoteCalls() {
    when(storageClient.getClient()).thenThrow(new ClientNotInitializedException("not yet"));

    CompletableFuture<UploadResult> upload =
        adapter.upload(new ByteArrayInputStream(new byte[10]), "photo.jpg", "image/jpeg");

    assertThat(upload.handle((r, e) -> e).join())
        .isInstanceOf(ClientNotInitializedException.class);
    verify(s3Client, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  private void stubMultipartStart() {
    when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
        .thenReturn(CreateMultipartUploadResponse.builder().uploadId("upload-1").build());
  }

  private UploadAdapter newAdapter(Executor executor) {
    SignedUrlIssuer issuer =
        new SignedUrlIssuer(storageClient, Duration.ofHours(1), Duration.ofHours(24));
    return new UploadAdapter(
        storageClient, issuer, new ObjectKeyGenerator("products"), properties, executor);
  }
}
