package com.starscape.imagepipeline.features.imagemetadata.app;

import com.starscape.imagepipeline.common.exception.DependencyException;
import com.starscape.imagepipeline.common.exception.ValidationException;
import com.starscape.imagepipeline.features.changestream.app.ChangeLogService;
import com.starscape.imagepipeline.features.changestream.domain.ChangeOperation;
import com.starscape.imagepipeline.features.imagemetadata.domain.ImageRecord;
import com.starscape.imagepipeline.features.imagemetadata.domain.ImageRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class ImageMetadataStoreTest {

    private ImageRecordRepository repository;
    private ChangeLogService changeLog;
    private ImageMetadataStore store;

    @BeforeEach
    void setUp() {
        repository = mock(ImageRecordRepository.class);
        changeLog = mock(ChangeLogService.class);
        when(repository.save(any(ImageRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));
        store = new ImageMetadataStore(repository, changeLog);
    }

    @Test
    void shouldInsertNewRecord() {
        when(repository.findByName("cat.jpeg")).thenReturn(Optional.empty());

        ImageRecord record = store.put("cat.jpeg", "photos");

        assertEquals("photos", record.getBucket());
        verify(repository).save(any(ImageRecord.class));
        verify(changeLog).append(eq(ChangeOperation.INSERT), eq("cat.jpeg"), isNull(),
            eq(Map.of("ImageName", "cat.jpeg", "BucketName", "photos")));
    }

    @Test
    void shouldLeaveExistingRecordUntouchedOnReplay() {
        ImageRecord existing = new ImageRecord("cat.jpeg", "photos");
        existing.describe("A cat");
        when(repository.findByName("cat.jpeg")).thenReturn(Optional.of(existing));

        ImageRecord record = store.put("cat.jpeg", "photos");

        assertEquals("A cat", record.getDescription());
        verify(repository, never()).save(any());
        verifyNoInteractions(changeLog);
    }

    @Test
    void shouldKeepDescriptionWhenBucketChanges() {
        ImageRecord existing = new ImageRecord("cat.jpeg", "old-photos");
        existing.describe("A cat");
        when(repository.findByName("cat.jpeg")).thenReturn(Optional.of(existing));

        ImageRecord record = store.put("cat.jpeg", "photos");

        assertEquals("photos", record.getBucket());
        assertEquals("A cat", record.getDescription());
        verify(changeLog).append(eq(ChangeOperation.MODIFY), eq("cat.jpeg"), any(), any());
    }

    @Test
    void shouldRejectDescriptionUpdateForAbsentRecord() {
        when(repository.findByName("ghost.jpeg")).thenReturn(Optional.empty());

        ValidationException e = assertThrows(ValidationException.class,
            () -> store.updateDescription("ghost.jpeg", "Boo"));

        assertEquals("Image ghost.jpeg does not exist", e.getMessage());
        verify(repository, never()).save(any());
        verifyNoInteractions(changeLog);
    }

    @Test
    void shouldUpdateDescriptionOfExistingRecord() {
        when(repository.findByName("cat.jpeg")).thenReturn(Optional.of(new ImageRecord("cat.jpeg", "photos")));

        ImageRecord record = store.updateDescription("cat.jpeg", "A cat");

        assertEquals("A cat", record.getDescription());
        verify(changeLog).append(eq(ChangeOperation.MODIFY), eq("cat.jpeg"),
            eq(Map.of("ImageName", "cat.jpeg", "BucketName", "photos")),
            eq(Map.of("ImageName", "cat.jpeg", "BucketName", "photos", "Description", "A cat")));
    }

    @Test
    void shouldRecordRemovalOnlyWhenRecordExisted() {
        ImageRecord existing = new ImageRecord("cat.jpeg", "photos");
        when(repository.findByName("cat.jpeg")).thenReturn(Optional.of(existing));
        when(repository.findByName("ghost.jpeg")).thenReturn(Optional.empty());

        assertTrue(store.delete("cat.jpeg"));
        assertFalse(store.delete("ghost.jpeg"));

        verify(repository).delete(existing);
        verify(changeLog).append(eq(ChangeOperation.REMOVE), eq("cat.jpeg"), any(), isNull());
        verify(changeLog, never()).append(any(), eq("ghost.jpeg"), any(), any());
    }

    @Test
    void shouldWrapStorageFailures() {
        when(repository.findByName(anyString())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThrows(DependencyException.class, () -> store.put("cat.jpeg", "photos"));
        assertThrows(DependencyException.class, () -> store.delete("cat.jpeg"));
    }
}
