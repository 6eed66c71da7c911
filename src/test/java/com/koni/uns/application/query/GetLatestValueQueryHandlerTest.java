package com.koni.uns.application.query;

import com.koni.uns.TestHierarchies;
import com.koni.uns.application.namespace.HierarchyService;
import com.koni.uns.domain.exception.NotFoundException;
import com.koni.uns.domain.exception.ValidationException;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.DataQuality;
import com.koni.uns.infrastructure.persistence.memory.InMemoryRealtimeStorage;
import com.koni.uns.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GetLatestValueQueryHandler.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class GetLatestValueQueryHandlerTest {

    @Mock
    private HierarchyService hierarchyService;

    private InMemoryRealtimeStorage realtimeStorage;
    private GetLatestValueQueryHandler handler;

    @BeforeEach
    void setUp() {
        realtimeStorage = new InMemoryRealtimeStorage();
        handler = new GetLatestValueQueryHandler(realtimeStorage, hierarchyService);
    }

    @Test
    void shouldReturnLatestValueOfTopic() {
        // Given
        realtimeStorage.store(DataPoint.builder().topic("t").value(1).build());
        realtimeStorage.store(DataPoint.builder().topic("t").value(2).quality(DataQuality.UNCERTAIN).build());

        // When
        DataPointResponse response = handler.handle(GetLatestValueQuery.forTopic("t"));

        // Then
        assertThat(response.getValue()).isEqualTo(2);
        assertThat(response.getQuality()).isEqualTo(DataQuality.UNCERTAIN);
        assertThat(response.getNsPath()).isNull();
    }

    @Test
    void shouldThrowNotFoundForTopicWithoutValue() {
        assertThatThrownBy(() -> handler.handle(GetLatestValueQuery.forTopic("missing")))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> handler.handle(GetLatestValueQuery.forTopic("")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldReturnLatestValuesUnderPath() {
        // Given
        when(hierarchyService.getActiveHierarchy()).thenReturn(TestHierarchies.isa95());
        realtimeStorage.store(DataPoint.builder().topic("a")
                .path(TestHierarchies.path("Acme/Dallas/Press/Line1")).value(1).build());
        realtimeStorage.store(DataPoint.builder().topic("b")
                .path(TestHierarchies.path("Acme/Dallas/Paint")).value(2).build());

        // When
        List<DataPointResponse> result = handler.handleByPath(GetLatestValueQuery.forPath("Acme/Dallas/Press"));

        // Then
        assertThat(result).extracting(DataPointResponse::getTopic).containsExactly("a");
    }
}
