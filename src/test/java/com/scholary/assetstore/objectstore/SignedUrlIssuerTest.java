package com.scholary.assetstore.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

class SignedUrlIssuerTest {

  private static final String KEY = "products/1700000000000-abc.jpg";

  private S3Presigner presigner;
  private StorageClient storageClient;
  private SignedUrlIssuer issuer;

  @BeforeEach
  void setUp() {
    presigner =
        S3Presigner.builder()
            .region(Region.EU_WEST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create("AKIAEXAMPLE", "secret-example")))
            .build();
    storageClient = mock(StorageClient.class);
    when(storageClient.getClient())
        .thenReturn(
            new StorageClientHandle("asset-bucket", "eu-west-1", mock(S3Client.class), presigner));
    issuer = new SignedUrlIssuer(storageClient, Duration.ofHours(1), Duration.ofHours(24));
  }

  @AfterEach
  void tearDown() {
    presigner.close();
  }

  @Test
  void issueUrl_containsKeyExpiryAndSignature() {
    Optional<String> url = issuer.issueUrl(KEY, Duration.ofMinutes(15));

    assertThat(url).isPresent();
    assertThat(url.get())
        .contains(KEY)
        .contains("asset-bucket")
        .contains("X-Amz-Expires=900")
        .contains("X-Amz-Signature=");
  }

  @Test
  void issueUrl_withoutTtl_usesOneHour() {
    assertThat(issuer.issueUrl(KEY)).hasValueSatisfying(expiresIn("3600"));
  }

  @Test
  void issueUrl_nonPositiveTtl_substitutesDefault() {
    assertThat(issuer.issueUrl(KEY, Duration.ZERO)).hasValueSatisfying(expiresIn("3600"));
    assertThat(issuer.issueUrl(KEY, Duration.ofSeconds(-30))).hasValueSatisfying(expiresIn("3600"));
    assertThat(issuer.issueUrl(KEY, null)).hasValueSatisfying(expiresIn("3600"));
  }

  @Test
  void refreshUrl_usesRefreshTtl() {
    assertThat(issuer.refreshUrl(KEY)).hasValueSatisfying(expiresIn("86400"));
  }

  @Test
  void issueUrl_clientNotReady_returnsEmpty() {
    when(storageClient.getClient()).thenThrow(new ClientNotInitializedException("not yet"));

    assertThat(issuer.issueUrl(KEY)).isEmpty();
  }

  @Test
  void issueUrl_signingFailure_returnsEmpty() {
    S3Presigner failing = mock(S3Presigner.class);
    when(failing.presignGetObject(any(GetObjectPresignRequest.class)))
        .thenThrow(SdkClientException.create("Unable to load credentials"));
    when(storageClient.getClient())
        .thenReturn(
            new StorageClientHandle("asset-bucket", "eu-west-1", mock(S3Client.class), failing));

    assertThat(issuer.issueUrl(KEY)).isEmpty();
  }

  private static Consumer<String> expiresIn(String seconds) {
    return url -> assertThat(url).contains(KEY).contains("X-Amz-Expires=" + seconds);
  }
}
