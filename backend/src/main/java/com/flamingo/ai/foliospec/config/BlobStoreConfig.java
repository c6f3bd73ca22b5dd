package com.flamingo.ai.foliospec.config;

import java.net.URI;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

/** S3 client wiring for the MinIO-compatible blob store. */
@Configuration
public class BlobStoreConfig {

  @Bean
  public S3Client blobStoreS3Client(ConversionConfig conversionConfig) {
    ConversionConfig.Storage storage = conversionConfig.getStorage();
    return S3Client.builder()
        .region(Region.of(storage.getRegion()))
        .credentialsProvider(
            StaticCredentialsProvider.create(
                AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey())))
        .endpointOverride(URI.create(storage.getEndpoint()))
        // MinIO serves buckets on the path, not on a virtual host
        .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
        .build();
  }
}
