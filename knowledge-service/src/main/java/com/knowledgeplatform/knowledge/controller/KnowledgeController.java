package com.knowledgeplatform.knowledge.controller;

import com.knowledgeplatform.knowledge.controller.dto.AdvancedSearchRequest;
import com.knowledgeplatform.knowledge.controller.dto.ProgressRequest;
import com.knowledgeplatform.knowledge.controller.dto.SearchResultResponse;
import com.knowledgeplatform.knowledge.controller.dto.TopicContentRequest;
import com.knowledgeplatform.knowledge.controller.dto.TopicContentResponse;
import com.knowledgeplatform.knowledge.model.UserProgress;
import com.knowledgeplatform.knowledge.service.ProgressService;
import com.knowledgeplatform.knowledge.service.TopicContentService;
import com.knowledgeplatform.knowledge.service.TopicSearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
public class KnowledgeController {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeController.class);

    private final TopicContentService topicContentService;
    private final TopicSearchService topicSearchService;
    private final ProgressService progressService;

    public KnowledgeController(TopicContentService topicContentService,
                               TopicSearchService topicSearchService,
                               ProgressService progressService) {
        this.topicContentService = topicContentService;
        this.topicSearchService  = topicSearchService;
        this.progressService     = progressService;
    }

    @PostMapping("/get_topic_content")
    public Mono<TopicContentResponse> getTopicContent(@RequestBody TopicContentRequest request) {
        log.info("Topic content request received. sector={} offline={}",
                 request.sectorOrEmpty(), request.offline());
        return topicContentService
            .getTopicContent(request.questionOrEmpty(), request.sectorOrEmpty(), request.offline())
            .map(TopicContentResponse::from);
    }

    @PostMapping("/advanced_search")
    public Mono<List<SearchResultResponse>> advancedSearch(@RequestBody AdvancedSearchRequest request) {
        log.info("Advanced search request received. query={}", request.queryOrEmpty());
        return topicSearchService.advancedSearch(request.queryOrEmpty(), request.preferences())
            .map(results -> results.stream().map(SearchResultResponse::from).toList());
    }

    @PostMapping("/progress")
    public Mono<ResponseEntity<UserProgress>> recordProgress(@RequestBody ProgressRequest request) {
        log.info("Progress record received. sector={}", request.sector());
        return progressService.record(request.sector(), request.performance(), request.notes())
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Progress endpoint error. sector={}", request.sector(), e));
    }

    @GetMapping("/progress/{sector}")
    public Flux<UserProgress> progress(@PathVariable String sector) {
        log.info("Progress query received. sector={}", sector);
        return progressService.forSector(sector);
    }
}
