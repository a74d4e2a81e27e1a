package com.starscape.imagepipeline.features.processimage.infra;

import com.starscape.imagepipeline.common.config.PipelineProperties;
import com.starscape.imagepipeline.common.exception.DependencyException;
import com.starscape.imagepipeline.common.exception.ValidationException;
import com.starscape.imagepipeline.features.processimage.domain.BlobNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.util.unit.DataSize;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.io.ByteArrayInputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class S3BlobStoreTest {

    private S3Client s3Client;
    private S3BlobStore blobStore;

    @BeforeEach
    void setUp() {
        s3Client = mock(S3Client.class);
        PipelineProperties properties = new PipelineProperties();
        properties.getImages().setMaxObjectSize(DataSize.ofBytes(4));
        blobStore = new S3BlobStore(s3Client, properties);
    }

    @Test
    void shouldReadObjectBytes() {
        byte[] content = {10, 20, 30};
        when(s3Client.getObject(any(GetObjectRequest.class))).thenReturn(new ResponseInputStream<>(
            GetObjectResponse.builder().contentLength(3L).build(),
            AbortableInputStream.create(new ByteArrayInputStream(content))));

        assertArrayEquals(content, blobStore.get("photos", "cat photo.jpeg"));

        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObject(captor.capture());
        assertEquals("photos", captor.getValue().bucket());
        assertEquals("cat photo.jpeg", captor.getValue().key());
    }

    @Test
    void shouldRejectObjectDeclaredLargerThanLimit() {
        when(s3Client.getObject(any(GetObjectRequest.class))).thenReturn(new ResponseInputStream<>(
            GetObjectResponse.builder().contentLength(5_000_000_000L).build(),
            AbortableInputStream.create(new ByteArrayInputStream(new byte[0]))));

        ValidationException e = assertThrows(ValidationException.class, () -> blobStore.get("photos", "huge.png"));
        assertEquals("Object s3://photos/huge.png exceeds the 4 byte limit", e.getMessage());
    }

    @Test
    void shouldStopReadingPastLimitWhenLengthIsMissing() {
        when(s3Client.getObject(any(GetObjectRequest.class))).thenReturn(new ResponseInputStream<>(
            GetObjectResponse.builder().build(),
            AbortableInputStream.create(new ByteArrayInputStream(new byte[]{1, 2, 3, 4, 5, 6}))));

        assertThrows(ValidationException.class, () -> blobStore.get("photos", "chunked.png"));
    }

    @Test
    void shouldReportMissingObject() {
        when(s3Client.getObject(any(GetObjectRequest.class)))
            .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());

        BlobNotFoundException e = assertThrows(BlobNotFoundException.class, () -> blobStore.get("photos", "gone.png"));
        assertEquals("Object not found: s3://photos/gone.png", e.getMessage());
    }

    @Test
    void shouldWrapClientFailures() {
        when(s3Client.getObject(any(GetObjectRequest.class))).thenThrow(SdkClientException.create("timeout"));

        assertThrows(DependencyException.class, () -> blobStore.get("photos", "cat.png"));
    }
}
