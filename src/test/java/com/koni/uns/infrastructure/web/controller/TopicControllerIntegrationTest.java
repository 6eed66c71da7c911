package com.koni.uns.infrastructure.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.uns.application.cache.CacheEntry;
import com.koni.uns.application.cache.MultiLevelCacheManager;
import com.koni.uns.application.ingestion.DataIngestionService;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.infrastructure.web.dto.AssignNamespaceRequest;
import com.koni.uns.infrastructure.web.dto.RenameTopicRequest;
import com.koni.uns.infrastructure.web.dto.TopicActivationRequest;
import com.koni.uns.tags.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for TopicController.
 * Values enter through the ingestion service as if a connection had delivered them.
 *
 * Tests:
 * - auto-mapped topics with their latest value and history
 * - unmapped topics
 * - manual assignment, rename, deactivation and deletion
 * - error responses
 */
@IntegrationTest
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TopicControllerIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private DataIngestionService ingestionService;

    @Autowired
    private MultiLevelCacheManager cacheManager;

    private String area;

    @BeforeEach
    void setUp() {
        area = "Area" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    void shouldMapTopicAndServeLatestValueAndHistory() throws Exception {
        // Given
        String topic = "Acme/Dallas/" + area + "/Line1/temperature";
        String nsPath = "Acme/Dallas/" + area + "/Line1";
        ingest(topic, 20.5);
        awaitMapped(topic, nsPath);

        // When
        ingest(topic, 21.5);

        // Then
        mockMvc.perform(get("/api/v1/topics").param("pathPrefix", "Acme/Dallas/" + area))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].topic").value(topic))
                .andExpect(jsonPath("$[0].nsPath").value(nsPath))
                .andExpect(jsonPath("$[0].sourceType").value("test"));

        await().atMost(TIMEOUT).untilAsserted(() ->
                mockMvc.perform(get("/api/v1/topics/latest").param("topic", topic))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.value").value(21.5))
                        .andExpect(jsonPath("$.nsPath").value(nsPath)));

        await().atMost(TIMEOUT).untilAsserted(() ->
                mockMvc.perform(get("/api/v1/topics/history").param("topic", topic))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.length()").value(2))
                        .andExpect(jsonPath("$[0].value").value(20.5))
                        .andExpect(jsonPath("$[1].value").value(21.5)));

        await().atMost(TIMEOUT).untilAsserted(() ->
                mockMvc.perform(get("/api/v1/topics/history/by-path").param("path", "Acme/Dallas/" + area))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.length()").value(1))
                        .andExpect(jsonPath("$[0].value").value(21.5)));
    }

    @Test
    void shouldListTopicWithoutMatchingPatternAsUnmapped() throws Exception {
        // Given
        String topic = "misc/" + area;

        // When
        ingest(topic, 1);

        // Then
        await().atMost(TIMEOUT).untilAsserted(() ->
                mockMvc.perform(get("/api/v1/topics").param("unmapped", "true"))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$[*].topic", hasItem(topic))));
        mockMvc.perform(get("/api/v1/topics/detail").param("topic", topic))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nsPath").doesNotExist());
    }

    @Test
    void shouldAssignRenameDeactivateAndDeleteTopic() throws Exception {
        // Given
        String topic = "Acme/Dallas/" + area + "/Line1/pressure";
        ingest(topic, 3.0);
        awaitMapped(topic, "Acme/Dallas/" + area + "/Line1");

        // When / Then
        mockMvc.perform(put("/api/v1/topics/namespace")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new AssignNamespaceRequest(topic, "Acme/Dallas/" + area))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nsPath").value("Acme/Dallas/" + area));
        awaitMapped(topic, "Acme/Dallas/" + area);

        mockMvc.perform(put("/api/v1/topics/name")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RenameTopicRequest(topic, " Line pressure "))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unsName").value("Line pressure"));

        mockMvc.perform(put("/api/v1/topics/active")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new TopicActivationRequest(topic, false))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(delete("/api/v1/topics").param("topic", topic))
                .andExpect(status().isNoContent());
        await().atMost(TIMEOUT).untilAsserted(() ->
                mockMvc.perform(get("/api/v1/topics/detail").param("topic", topic))
                        .andExpect(status().isNotFound()));
        mockMvc.perform(get("/api/v1/topics"))
                .andExpect(jsonPath("$[*].topic", not(hasItem(topic))));
    }

    @Test
    void shouldRejectAssignmentWhereTopicsAreNotAllowed() throws Exception {
        // Given
        String topic = "Acme/Dallas/" + area + "/Line2/flow";
        ingest(topic, 7);
        awaitMapped(topic, "Acme/Dallas/" + area + "/Line2");

        // When / Then
        mockMvc.perform(put("/api/v1/topics/namespace")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new AssignNamespaceRequest(topic, "Acme/Dallas"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("Topics are not allowed")));
    }

    @Test
    void shouldReturnErrorsForBadTopicRequests() throws Exception {
        mockMvc.perform(get("/api/v1/topics/latest").param("topic", "never/seen/" + area))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/v1/topics/history"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/topics/history")
                        .param("topic", "t")
                        .param("from", "2024-05-01T12:00:00Z")
                        .param("to", "2024-05-01T11:00:00Z"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("from must not be after to"));

        mockMvc.perform(put("/api/v1/topics/namespace")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new AssignNamespaceRequest("unknown/" + area, "Acme/Dallas/Press"))))
                .andExpect(status().isNotFound());

        mockMvc.perform(delete("/api/v1/topics").param("topic", "unknown/" + area))
                .andExpect(status().isNotFound());
    }

    private void ingest(String topic, Object value) {
        ingestionService.onDataReceived("it-connection",
                DataPoint.builder().topic(topic).value(value).sourceSystem("test").build());
    }

    private void awaitMapped(String topic, String nsPath) {
        await().atMost(TIMEOUT).untilAsserted(() -> assertThat(cacheManager.getEntry(topic))
                .map(CacheEntry::getNsPath)
                .hasValue(nsPath));
    }
}
