package com.knowledgeplatform.knowledge.store;

import com.knowledgeplatform.common.exception.StorageException;
import com.knowledgeplatform.knowledge.model.Topic;
import com.knowledgeplatform.knowledge.repository.TopicRepository;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TopicStoreTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 15, 12, 0);

    private final TopicRepository repository = mock(TopicRepository.class);
    private final TopicStore store = new TopicStore(repository);

    @Test
    void upsert_writesThroughSingleStatementAndReturnsStoredRow() {
        Topic stored = new Topic();
        stored.setId(1L);
        stored.setSector("physics");
        stored.setContent("Newton's laws");
        stored.setFurtherReading("http://x");
        stored.setLastUpdate(NOW);
        when(repository.upsertBySector("physics", "Newton's laws", "http://x", NOW)).thenReturn(Mono.empty());
        when(repository.findBySector("physics")).thenReturn(Mono.just(stored));

        StepVerifier.create(store.upsert("physics", "Newton's laws", "http://x", NOW))
            .assertNext(t -> {
                assertEquals(1L, t.getId());
                assertEquals("Newton's laws", t.getContent());
                assertEquals("http://x", t.getFurtherReading());
                assertEquals(NOW, t.getLastUpdate());
            })
            .verifyComplete();

        verify(repository).upsertBySector("physics", "Newton's laws", "http://x", NOW);
        verify(repository, never()).save(any(Topic.class));
    }

    @Test
    void upsert_nullFurtherReadingIsPassedThrough() {
        Topic stored = new Topic();
        stored.setId(7L);
        stored.setSector("physics");
        stored.setContent("new");
        stored.setLastUpdate(NOW);
        when(repository.upsertBySector("physics", "new", null, NOW)).thenReturn(Mono.empty());
        when(repository.findBySector("physics")).thenReturn(Mono.just(stored));

        StepVerifier.create(store.upsert("physics", "new", null, NOW))
            .assertNext(t -> {
                assertEquals(7L, t.getId());
                assertNull(t.getFurtherReading());
            })
            .verifyComplete();
    }

    @Test
    void upsert_statementFailure_becomesStorageException() {
        when(repository.upsertBySector(anyString(), anyString(), any(), any()))
            .thenReturn(Mono.error(new IllegalStateException("disk full")));

        StepVerifier.create(store.upsert("physics", "c", null, NOW))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(StorageException.class, e);
                assertEquals("upsert", ((StorageException) e).getOperation());
            })
            .verify();
        verify(repository, never()).findBySector(anyString());
    }

    @Test
    void upsert_rowMissingAfterWrite_becomesStorageException() {
        when(repository.upsertBySector(anyString(), anyString(), any(), any())).thenReturn(Mono.empty());
        when(repository.findBySector("physics")).thenReturn(Mono.empty());

        StepVerifier.create(store.upsert("physics", "c", null, NOW))
            .expectError(StorageException.class)
            .verify();
    }

    @Test
    void find_unknownSector_isEmpty() {
        when(repository.findBySector("chemistry")).thenReturn(Mono.empty());

        StepVerifier.create(store.find("chemistry")).verifyComplete();
    }

    @Test
    void find_repositoryFailure_becomesStorageException() {
        when(repository.findBySector("physics")).thenReturn(Mono.error(new IllegalStateException("pool closed")));

        StepVerifier.create(store.find("physics"))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(StorageException.class, e);
                assertEquals("find", ((StorageException) e).getOperation());
                assertInstanceOf(IllegalStateException.class, e.getCause());
            })
            .verify();
    }

    @Test
    void find_repositoryThrowingEagerly_becomesStorageException() {
        when(repository.findBySector("physics")).thenThrow(new IllegalStateException("no connection"));

        StepVerifier.create(store.find("physics"))
            .expectError(StorageException.class)
            .verify();
    }

    @Test
    void scanAll_failure_becomesStorageException() {
        when(repository.findAllByOrderByIdAsc()).thenReturn(Flux.error(new IllegalStateException("down")));

        StepVerifier.create(store.scanAll())
            .expectError(StorageException.class)
            .verify();
    }
}
