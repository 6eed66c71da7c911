package com.koni.uns.infrastructure.web.controller;

import com.koni.uns.application.query.DataPointResponse;
import com.koni.uns.application.query.GetHistoryQuery;
import com.koni.uns.application.query.GetHistoryQueryHandler;
import com.koni.uns.application.query.GetLatestValueQuery;
import com.koni.uns.application.query.GetLatestValueQueryHandler;
import com.koni.uns.application.query.GetTopicsQuery;
import com.koni.uns.application.query.GetTopicsQueryHandler;
import com.koni.uns.application.query.TopicResponse;
import com.koni.uns.application.topic.TopicConfigurationService;
import com.koni.uns.infrastructure.web.dto.AssignNamespaceRequest;
import com.koni.uns.infrastructure.web.dto.RenameTopicRequest;
import com.koni.uns.infrastructure.web.dto.TopicActivationRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST controller for topics, their namespace assignment and their values.
 *
 * Raw topics contain "/" and are passed as the {@code topic} query parameter.
 * Namespace paths are serialized as "Enterprise/Site/Area".
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class TopicController {

    private final GetTopicsQueryHandler topicsQueryHandler;
    private final GetLatestValueQueryHandler latestValueQueryHandler;
    private final GetHistoryQueryHandler historyQueryHandler;
    private final TopicConfigurationService topicService;

    @GetMapping("/v1/topics")
    public ResponseEntity<List<TopicResponse>> getTopics(
            @RequestParam(required = false) String pathPrefix,
            @RequestParam(defaultValue = "false") boolean unmapped) {
        log.info("Received request to get topics: pathPrefix={}, unmapped={}", pathPrefix, unmapped);
        List<TopicResponse> topics = topicsQueryHandler.handle(new GetTopicsQuery(pathPrefix, unmapped));
        log.info("Returning {} topics", topics.size());
        return ResponseEntity.ok(topics);
    }

    @GetMapping("/v1/topics/detail")
    public ResponseEntity<TopicResponse> getTopic(@RequestParam String topic) {
        log.info("Received request to get topic: topic={}", topic);
        return ResponseEntity.ok(topicsQueryHandler.handleSingle(topic));
    }

    @GetMapping("/v1/topics/latest")
    public ResponseEntity<DataPointResponse> getLatest(@RequestParam String topic) {
        log.info("Received request to get latest value: topic={}", topic);
        return ResponseEntity.ok(latestValueQueryHandler.handle(GetLatestValueQuery.forTopic(topic)));
    }

    @GetMapping("/v1/topics/latest/by-path")
    public ResponseEntity<List<DataPointResponse>> getLatestByPath(@RequestParam String path) {
        log.info("Received request to get latest values: path={}", path);
        return ResponseEntity.ok(latestValueQueryHandler.handleByPath(GetLatestValueQuery.forPath(path)));
    }

    /**
     * Values of one topic within {@code [from, to]}, oldest first. Bounds are ISO-8601 instants
     * and default to the last hour.
     */
    @GetMapping("/v1/topics/history")
    public ResponseEntity<List<DataPointResponse>> getHistory(
            @RequestParam String topic,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        log.info("Received request to get history: topic={}, from={}, to={}", topic, from, to);
        return ResponseEntity.ok(historyQueryHandler.handle(new GetHistoryQuery(topic, null, from, to)));
    }

    @GetMapping("/v1/topics/history/by-path")
    public ResponseEntity<List<DataPointResponse>> getHistoryByPath(
            @RequestParam String path,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        log.info("Received request to get history: path={}, from={}, to={}", path, from, to);
        return ResponseEntity.ok(historyQueryHandler.handle(new GetHistoryQuery(null, path, from, to)));
    }

    @PutMapping("/v1/topics/namespace")
    public ResponseEntity<TopicResponse> assignNamespace(@RequestBody @Valid AssignNamespaceRequest request) {
        log.info("Received request to assign namespace: topic={}, nsPath={}", request.getTopic(), request.getNsPath());
        return ResponseEntity.ok(TopicResponse.from(topicService.assignNamespace(request.getTopic(), request.getNsPath())));
    }

    @DeleteMapping("/v1/topics/namespace")
    public ResponseEntity<TopicResponse> clearNamespace(@RequestParam String topic) {
        log.info("Received request to clear namespace: topic={}", topic);
        return ResponseEntity.ok(TopicResponse.from(topicService.clearNamespace(topic)));
    }

    @PutMapping("/v1/topics/name")
    public ResponseEntity<TopicResponse> rename(@RequestBody @Valid RenameTopicRequest request) {
        log.info("Received request to rename topic: topic={}, unsName={}", request.getTopic(), request.getUnsName());
        return ResponseEntity.ok(TopicResponse.from(topicService.rename(request.getTopic(), request.getUnsName())));
    }

    @PutMapping("/v1/topics/active")
    public ResponseEntity<TopicResponse> setActive(@RequestBody @Valid TopicActivationRequest request) {
        log.info("Received request to change topic activation: topic={}, active={}", request.getTopic(), request.getActive());
        return ResponseEntity.ok(TopicResponse.from(topicService.setActive(request.getTopic(), request.getActive())));
    }

    @DeleteMapping("/v1/topics")
    public ResponseEntity<Void> deleteTopic(@RequestParam String topic) {
        log.info("Received request to delete topic: topic={}", topic);
        topicService.delete(topic);
        return ResponseEntity.noContent().build();
    }
}
