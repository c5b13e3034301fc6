package com.scholary.assetstore.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@ExtendWith(MockitoExtension.class)
class ObjectDeleterTest {

  @Mock private StorageClient storageClient;
  @Mock private S3Client s3Client;
  @Mock private S3Presigner presigner;

  private ObjectDeleter deleter;

  @BeforeEach
  void setUp() {
    deleter = new ObjectDeleter(storageClient, Runnable::run);
  }

  @Test
  void deleteObject_existingKey_returnsTrue() {
    readyClient();
    when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
        .thenReturn(DeleteObjectResponse.builder().build());

    assertThat(deleter.deleteObject("products/1-a.jpg").join()).isTrue();
    verify(s3Client)
        .deleteObject(
            DeleteObjectRequest.builder().bucket("asset-bucket").key("products/1-a.jpg").build());
  }

  @Test
  void deleteObject_neverCreatedKey_returnsTrue() {
    readyClient();
    when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().statusCode(404).build());

    assertThat(deleter.deleteObject("products/missing.jpg").join()).isTrue();
  }

  @Test
  void deleteObject_accessDenied_returnsFalse() {
    readyClient();
    when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
        .thenThrow(S3Exception.builder().statusCode(403).build());

    assertThat(deleter.deleteObject("products/1-a.jpg").join()).isFalse();
  }

  @Test
  void deleteObject_transportError_returnsFalse() {
    readyClient();
    when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
        .thenThrow(SdkClientException.create("Connection reset"));

    assertThat(deleter.deleteObject("products/1-a.jpg")).isCompletedWithValue(false);
  }

  @Test
  void deleteObject_clientNotReady_returnsFalseWithoutRemoteCall() {
    when(storageClient.getClient()).thenThrow(new ClientNotInitializedException("not yet"));

    assertThat(deleter.deleteObject("products/1-a.jpg")).isCompletedWithValue(false);
    verify(s3Client, never()).deleteObject(any(DeleteObjectRequest.class));
  }

  private void readyClient() {
    when(storageClient.getClient())
        .thenReturn(new StorageClientHandle("asset-bucket", "us-east-1", s3Client, presigner));
  }
}
