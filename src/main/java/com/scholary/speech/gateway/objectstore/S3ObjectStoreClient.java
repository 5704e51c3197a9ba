package com.scholary.speech.gateway.objectstore;

import java.io.InputStream;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>The AWS SDK retries throttling and 5xx responses itself. Missing objects are reported with
 * {@link ObjectStoreException#isNotFound()} so the API can answer 404 instead of 502.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    this(buildClient(properties));
    LOGGER.info(
        "Initialized S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());
  }

  S3ObjectStoreClient(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    StaticCredentialsProvider credentialsProvider =
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(properties.accessKey(), properties.secretKey()));

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    return S3Client.builder()
        .region(region)
        .credentialsProvider(credentialsProvider)
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess())
        .build();
  }

  @Override
  public InputStream getObjectStream(String bucket, String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);

    try {
      InputStream stream =
          s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Retrieved object: bucket={}, key={}", bucket, key);
      return stream;

    } catch (NoSuchKeyException | NoSuchBucketException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.warn(message);
      throw new ObjectStoreException(message, e, true);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        contentLength,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(contentLength)
              .build();

      s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));

      LOGGER.info("Uploaded object: bucket={}, key={}", bucket, key);

    } catch (NoSuchBucketException e) {
      String message = String.format("Bucket not found: bucket=%s", bucket);
      LOGGER.warn(message);
      throw new ObjectStoreException(message, e, true);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String bucket, String key) {
    LOGGER.debug("Getting metadata for object: bucket={}, key={}", bucket, key);

    try {
      HeadObjectResponse response =
          s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());

      LOGGER.debug(
          "Retrieved metadata: bucket={}, key={}, size={} bytes, contentType={}",
          bucket,
          key,
          response.contentLength(),
          response.contentType());

      return new ObjectMetadata(response.contentLength(), response.contentType());

    } catch (NoSuchKeyException | NoSuchBucketException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.warn(message);
      throw new ObjectStoreException(message, e, true);

    } catch (S3Exception e) {
      // HEAD responses carry no error body, so a missing key surfaces as a bare 404
      if (e.statusCode() == 404) {
        throw new ObjectStoreException(
            String.format("Object not found: bucket=%s, key=%s", bucket, key), e, true);
      }
      String message =
          String.format(
              "Failed to get metadata: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
