package com.starscape.imagepipeline.features.processimage.infra;

import com.starscape.imagepipeline.common.config.PipelineProperties;
import com.starscape.imagepipeline.common.exception.DependencyException;
import com.starscape.imagepipeline.common.exception.ValidationException;
import com.starscape.imagepipeline.features.processimage.domain.BlobNotFoundException;
import com.starscape.imagepipeline.features.processimage.domain.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.io.IOException;

@Service
public class S3BlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(S3BlobStore.class);

    private final S3Client s3Client;
    private final long maxObjectBytes;

    public S3BlobStore(S3Client s3Client, PipelineProperties properties) {
        this.s3Client = s3Client;
        this.maxObjectBytes = properties.getImages().getMaxObjectSize().toBytes();
    }

    /**
     * @throws ValidationException if the object is larger than the configured maximum
     */
    @Override
    public byte[] get(String bucket, String key) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        try (ResponseInputStream<GetObjectResponse> object = s3Client.getObject(request)) {
            Long contentLength = object.response().contentLength();
            if (contentLength != null && contentLength > maxObjectBytes) {
                object.abort();
                throw tooLarge(bucket, key);
            }

            // Bounded read, in case the declared length is missing or wrong
            byte[] bytes = object.readNBytes((int) Math.min(maxObjectBytes + 1, Integer.MAX_VALUE - 8));
            if (bytes.length > maxObjectBytes) {
                object.abort();
                throw tooLarge(bucket, key);
            }
            log.debug("Read S3 object: bucket={}, key={}, bytes={}", bucket, key, bytes.length);
            return bytes;
        } catch (NoSuchKeyException e) {
            throw new BlobNotFoundException(bucket, key, e);
        } catch (SdkException | IOException e) {
            throw new DependencyException("Failed to read S3 object s3://" + bucket + "/" + key, e);
        }
    }

    private ValidationException tooLarge(String bucket, String key) {
        return new ValidationException(String.format(
                "Object s3://%s/%s exceeds the %d byte limit", bucket, key, maxObjectBytes));
    }
}
