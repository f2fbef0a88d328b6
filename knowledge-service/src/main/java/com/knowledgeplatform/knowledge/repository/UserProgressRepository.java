package com.knowledgeplatform.knowledge.repository;

import com.knowledgeplatform.knowledge.model.UserProgress;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface UserProgressRepository extends ReactiveCrudRepository<UserProgress, Long> {

    Flux<UserProgress> findBySectorOrderByLastStudyDateDesc(String sector);
}
