package com.knowledgeplatform.knowledge.store;

import com.knowledgeplatform.common.exception.StorageException;
import com.knowledgeplatform.knowledge.model.Topic;
import com.knowledgeplatform.knowledge.repository.TopicRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Access layer over the {@code topics} table.
 *
 * <p>Every repository failure surfaces as {@link StorageException} so callers can tell
 * store faults apart from remote-source faults. An unknown sector is an empty
 * {@code Mono}, not an error.
 *
 * <p>{@link #upsert} is a single {@code INSERT ... ON CONFLICT} statement followed by a
 * read of the resulting row; concurrent upserts for one sector resolve as last writer wins.
 */
@Component
public class TopicStore {

    private static final Logger log = LoggerFactory.getLogger(TopicStore.class);

    private final TopicRepository topicRepository;

    public TopicStore(TopicRepository topicRepository) {
        this.topicRepository = topicRepository;
    }

    public Mono<Topic> find(String sector) {
        return Mono.defer(() -> topicRepository.findBySector(sector))
            .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("find", "Topic lookup failed for sector " + sector, e));
    }

    /**
     * Inserts the sector's topic or overwrites its content, further reading and
     * last-update timestamp.
     */
    public Mono<Topic> upsert(String sector, String content, String furtherReading, LocalDateTime updatedAt) {
        return Mono.defer(() -> topicRepository.upsertBySector(sector, content, furtherReading, updatedAt))
            .then(Mono.defer(() -> topicRepository.findBySector(sector)))
            .switchIfEmpty(Mono.error(() -> new StorageException(
                "upsert", "Topic missing after upsert for sector " + sector, null)))
            .doOnSuccess(t -> log.info("Topic upserted. sector={} id={} lastUpdate={}",
                                       sector, t.getId(), t.getLastUpdate()))
            .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("upsert", "Topic upsert failed for sector " + sector, e));
    }

    /**
     * Scans the whole corpus in id order. Acceptable while the corpus stays small.
     */
    public Flux<Topic> scanAll() {
        return Flux.defer(topicRepository::findAllByOrderByIdAsc)
            .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("scan", "Topic scan failed", e));
    }
}
