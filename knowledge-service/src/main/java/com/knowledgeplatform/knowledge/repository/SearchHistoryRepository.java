package com.knowledgeplatform.knowledge.repository;

import com.knowledgeplatform.knowledge.model.SearchHistory;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SearchHistoryRepository extends ReactiveCrudRepository<SearchHistory, Long> {
}
