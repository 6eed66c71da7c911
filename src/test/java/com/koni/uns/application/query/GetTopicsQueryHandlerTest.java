package com.koni.uns.application.query;

import com.koni.uns.TestHierarchies;
import com.koni.uns.application.cache.CacheEntry;
import com.koni.uns.application.cache.MultiLevelCacheManager;
import com.koni.uns.domain.exception.NotFoundException;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.model.NamespaceType;
import com.koni.uns.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GetTopicsQueryHandler.
 * Tests the cache lookups selected by each query shape and the DTO mapping.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class GetTopicsQueryHandlerTest {

    @Mock
    private MultiLevelCacheManager cacheManager;

    private GetTopicsQueryHandler handler;

    private final CacheEntry mapped = new CacheEntry("acme/dallas/press/line1/temp", "Line 1 temperature",
            TestHierarchies.path("Acme/Dallas/Press/Line1"), "simulated", "sim-1", true,
            "Press line 1", NamespaceType.FUNCTIONAL, Instant.parse("2024-05-01T10:00:00Z"));

    private final CacheEntry unmapped = new CacheEntry("misc/probe", "misc/probe",
            HierarchicalPath.empty(), "simulated", "sim-1", true, null, null, Instant.parse("2024-05-01T10:00:00Z"));

    @BeforeEach
    void setUp() {
        handler = new GetTopicsQueryHandler(cacheManager);
    }

    @Test
    void shouldReturnAllTopics() {
        // Given
        when(cacheManager.getAll()).thenReturn(List.of(mapped, unmapped));

        // When
        List<TopicResponse> result = handler.handle(GetTopicsQuery.all());

        // Then
        assertThat(result).hasSize(2);
        TopicResponse response = result.get(0);
        assertThat(response.getTopic()).isEqualTo("acme/dallas/press/line1/temp");
        assertThat(response.getUnsName()).isEqualTo("Line 1 temperature");
        assertThat(response.getNsPath()).isEqualTo("Acme/Dallas/Press/Line1");
        assertThat(response.getNamespaceName()).isEqualTo("Press line 1");
        assertThat(response.getNamespaceType()).isEqualTo(NamespaceType.FUNCTIONAL);
        assertThat(result.get(1).getNsPath()).isNull();
    }

    @Test
    void shouldFilterByPathPrefix() {
        // Given
        when(cacheManager.getEntriesUnder("Acme/Dallas")).thenReturn(List.of(mapped));

        // When
        List<TopicResponse> result = handler.handle(new GetTopicsQuery("Acme/Dallas", false));

        // Then
        assertThat(result).extracting(TopicResponse::getTopic).containsExactly("acme/dallas/press/line1/temp");
        verify(cacheManager, never()).getAll();
    }

    @Test
    void shouldReturnOnlyUnmappedTopics() {
        // Given
        when(cacheManager.getUnmapped()).thenReturn(List.of(unmapped));

        // When
        List<TopicResponse> result = handler.handle(new GetTopicsQuery(null, true));

        // Then
        assertThat(result).extracting(TopicResponse::getTopic).containsExactly("misc/probe");
    }

    @Test
    void shouldReturnSingleTopicOrThrow() {
        // Given
        when(cacheManager.getEntry("acme/dallas/press/line1/temp")).thenReturn(Optional.of(mapped));
        when(cacheManager.getEntry("missing")).thenReturn(Optional.empty());

        // When
        TopicResponse response = handler.handleSingle("acme/dallas/press/line1/temp");

        // Then
        assertThat(response.getConnectionId()).isEqualTo("sim-1");
        assertThatThrownBy(() -> handler.handleSingle("missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("missing");
    }
}
