package com.knowledgeplatform.knowledge.service;

import com.knowledgeplatform.knowledge.model.UserProgress;
import com.knowledgeplatform.knowledge.repository.UserProgressRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Pass-through persistence for study progress records. No behaviour beyond storage.
 */
@Service
public class ProgressService {

    private static final Logger log = LoggerFactory.getLogger(ProgressService.class);

    private final UserProgressRepository userProgressRepository;
    private final Clock clock;

    public ProgressService(UserProgressRepository userProgressRepository, Clock clock) {
        this.userProgressRepository = userProgressRepository;
        this.clock                  = clock;
    }

    public Mono<UserProgress> record(String sector, Double performance, String notes) {
        UserProgress progress = new UserProgress();
        progress.setSector(sector);
        progress.setPerformance(performance);
        progress.setNotes(notes);
        progress.setLastStudyDate(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));

        return userProgressRepository.save(progress)
            .doOnSuccess(p -> log.info("Progress recorded. id={} sector={} performance={}",
                                       p.getId(), p.getSector(), p.getPerformance()))
            .doOnError(e -> log.error("Failed to record progress. sector={}", sector, e));
    }

    public Flux<UserProgress> forSector(String sector) {
        return userProgressRepository.findBySectorOrderByLastStudyDateDesc(sector);
    }
}
