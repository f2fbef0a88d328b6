package com.knowledgeplatform.knowledge.service;

import com.knowledgeplatform.knowledge.model.UserProgress;
import com.knowledgeplatform.knowledge.repository.UserProgressRepository;
import com.knowledgeplatform.knowledge.support.MutableClock;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProgressServiceTest {

    private final UserProgressRepository repository = mock(UserProgressRepository.class);
    private final ProgressService service =
        new ProgressService(repository, new MutableClock(Instant.parse("2024-03-15T12:00:00Z")));

    @Test
    void record_stampsStudyDate() {
        when(repository.save(any(UserProgress.class))).thenAnswer(inv -> {
            UserProgress p = inv.getArgument(0);
            p.setId(5L);
            return Mono.just(p);
        });

        StepVerifier.create(service.record("physics", 0.75, "chapter 3"))
            .assertNext(p -> {
                assertEquals(5L, p.getId());
                assertEquals("physics", p.getSector());
                assertEquals(0.75, p.getPerformance());
                assertEquals("chapter 3", p.getNotes());
                assertEquals(LocalDateTime.of(2024, 3, 15, 12, 0), p.getLastStudyDate());
            })
            .verifyComplete();
    }
}
