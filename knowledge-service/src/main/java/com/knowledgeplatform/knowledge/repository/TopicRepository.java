package com.knowledgeplatform.knowledge.repository;

import com.knowledgeplatform.knowledge.model.Topic;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface TopicRepository extends ReactiveCrudRepository<Topic, Long> {

    Mono<Topic> findBySector(String sector);

    /** Full-corpus scan in insertion order; search ties fall back to this order. */
    Flux<Topic> findAllByOrderByIdAsc();

    /**
     * Atomic UPSERT keyed on the unique sector: inserts the topic or overwrites its
     * content, further reading and last update. Concurrent writers never collide on
     * the constraint; the last one to commit wins.
     */
    @Modifying
    @Query("""
        INSERT INTO topics (sector, content, further_reading, last_update)
        VALUES (:sector, :content, :furtherReading, :lastUpdate)
        ON CONFLICT (sector) DO UPDATE SET
            content         = EXCLUDED.content,
            further_reading = EXCLUDED.further_reading,
            last_update     = EXCLUDED.last_update
        """)
    Mono<Void> upsertBySector(String sector, String content, String furtherReading, LocalDateTime lastUpdate);
}
