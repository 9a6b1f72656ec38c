package com.simscan.corpus.impl;

import com.simscan.document.domain.CorpusDocument;
import com.simscan.error.NotFoundException;
import com.simscan.error.StorageException;
import com.simscan.mapper.DocumentMapper;
import com.simscan.storage.StorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlobCorpusStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

    @Mock
    private StorageService storage;
    @Mock
    private DocumentMapper documentMapper;

    private BlobCorpusStore store;

    @BeforeEach
    void setUp() {
        store = new BlobCorpusStore(storage, documentMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void keysStayUniqueWithinTheSameMillisecond() {
        String first = store.allocateKey("report.txt");
        String second = store.allocateKey("report.txt");

        assertNotEquals(first, second);
        assertTrue(first.startsWith(NOW.toEpochMilli() + "_"));
        assertTrue(first.endsWith("_report.txt"));
        assertTrue(first.matches("\\d+_[0-9a-f]{8}_report\\.txt"), first);
    }

    @Test
    void fileNamesAreSanitized() {
        assertEquals("unnamed", BlobCorpusStore.safeFileName(null));
        assertEquals("unnamed", BlobCorpusStore.safeFileName("  "));
        assertEquals(".._.._etc_passwd", BlobCorpusStore.safeFileName("../../etc/passwd"));
        assertEquals("my_essay__1_.txt", BlobCorpusStore.safeFileName("my essay (1).txt"));
        assertEquals(120, BlobCorpusStore.safeFileName("a".repeat(300)).length());
    }

    @Test
    void putWritesUtf8TextToTheDefaultBucket() {
        when(storage.getDefaultBucket()).thenReturn("documents");
        when(storage.ensureBucket("documents")).thenReturn(Mono.empty());
        when(storage.uploadBytes(eq("documents"), eq("k"), any(byte[].class), anyString())).thenReturn(Mono.just("k"));

        StepVerifier.create(store.put("k", "héllo", Duration.ofSeconds(1)))
                .verifyComplete();

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(storage).uploadBytes(eq("documents"), eq("k"), bytes.capture(), eq(BlobCorpusStore.CONTENT_TYPE));
        assertArrayEquals("héllo".getBytes(StandardCharsets.UTF_8), bytes.getValue());
    }

    @Test
    void slowWriteTimesOutAsStorageError() {
        when(storage.getDefaultBucket()).thenReturn("documents");
        when(storage.ensureBucket("documents")).thenReturn(Mono.empty());
        when(storage.uploadBytes(eq("documents"), eq("k"), any(byte[].class), anyString())).thenReturn(Mono.never());

        StepVerifier.create(store.put("k", "text", Duration.ofMillis(50)))
                .expectErrorSatisfies(err -> {
                    assertTrue(err instanceof StorageException);
                    assertTrue(err.getCause() instanceof TimeoutException);
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void missingBodyStaysNotFound() {
        when(storage.getDefaultBucket()).thenReturn("documents");
        when(storage.getObjectBytes("documents", "gone")).thenReturn(Mono.error(new NotFoundException("gone")));

        StepVerifier.create(store.read("gone", Duration.ofSeconds(1)))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void readDecodesUtf8() {
        when(storage.getDefaultBucket()).thenReturn("documents");
        when(storage.getObjectBytes("documents", "k"))
                .thenReturn(Mono.just("naïve".getBytes(StandardCharsets.UTF_8)));

        StepVerifier.create(store.read("k", Duration.ofSeconds(1)))
                .expectNext("naïve")
                .verifyComplete();
    }

    @Test
    void listExceptMapsRowsToEntries() {
        when(documentMapper.selectAllExcept("mine")).thenReturn(List.of(
                CorpusDocument.builder().id(5L).userId(9L).storageKey("other").fileName("other.txt").build()));

        StepVerifier.create(store.listExcept("mine"))
                .assertNext(entry -> {
                    assertEquals(5L, entry.documentId());
                    assertEquals("other", entry.storageKey());
                    assertEquals("other.txt", entry.displayName());
                    assertEquals(9L, entry.ownerId());
                })
                .verifyComplete();
    }
}
