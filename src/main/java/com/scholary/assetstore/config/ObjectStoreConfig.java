package com.scholary.assetstore.config;

import com.scholary.assetstore.objectstore.BucketProvisioner;
import com.scholary.assetstore.objectstore.DefaultS3ClientFactory;
import com.scholary.assetstore.objectstore.ObjectDeleter;
import com.scholary.assetstore.objectstore.ObjectStoreProperties;
import com.scholary.assetstore.objectstore.RegionResolver;
import com.scholary.assetstore.objectstore.S3ClientFactory;
import com.scholary.assetstore.objectstore.SignedUrlIssuer;
import com.scholary.assetstore.objectstore.StorageClient;
import com.scholary.assetstore.upload.ObjectKeyGenerator;
import com.scholary.assetstore.upload.UploadProperties;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>This wires up the storage components using properties from application.yml. The storage
 * client starts initializing once the application is ready; nothing at startup waits for it.
 */
@Configuration
@EnableConfigurationProperties({ObjectStoreProperties.class, UploadProperties.class})
public class ObjectStoreConfig {

  @Bean
  public S3ClientFactory s3ClientFactory(ObjectStoreProperties properties) {
    return new DefaultS3ClientFactory(properties);
  }

  @Bean
  public RegionResolver regionResolver(
      S3ClientFactory clientFactory,
      ObjectStoreProperties properties,
      @Qualifier("storageExecutor") Executor executor) {
    return new RegionResolver(clientFactory, properties, executor);
  }

  @Bean
  public BucketProvisioner bucketProvisioner(
      S3ClientFactory clientFactory, @Qualifier("storageExecutor") Executor executor) {
    return new BucketProvisioner(clientFactory, executor);
  }

  @Bean
  public StorageClient storageClient(
      ObjectStoreProperties properties,
      RegionResolver regionResolver,
      BucketProvisioner bucketProvisioner,
      S3ClientFactory clientFactory) {
    return new StorageClient(properties, regionResolver, bucketProvisioner, clientFactory);
  }

  @Bean
  public SignedUrlIssuer signedUrlIssuer(
      StorageClient storageClient, ObjectStoreProperties properties) {
    return new SignedUrlIssuer(
        storageClient, properties.defaultUrlTtl(), properties.uploadUrlTtl());
  }

  @Bean
  public ObjectDeleter objectDeleter(
      StorageClient storageClient, @Qualifier("storageExecutor") Executor executor) {
    return new ObjectDeleter(storageClient, executor);
  }

  @Bean
  public ObjectKeyGenerator objectKeyGenerator(ObjectStoreProperties properties) {
    return new ObjectKeyGenerator(properties.keyPrefix());
  }

  @Bean
  public ApplicationListener<ApplicationReadyEvent> storageClientInitializer(
      StorageClient storageClient) {
    return event -> storageClient.initialize();
  }
}
