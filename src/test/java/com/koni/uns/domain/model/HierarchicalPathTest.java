package com.koni.uns.domain.model;

import com.koni.uns.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class HierarchicalPathTest {

    private static HierarchicalPath path(String... pairs) {
        Map<String, String> levels = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            levels.put(pairs[i], pairs[i + 1]);
        }
        return HierarchicalPath.of(levels);
    }

    @Test
    void shouldSerializePopulatedLevelsInOrder() {
        HierarchicalPath path = path("Enterprise", "Acme", "Site", "Dallas", "Area", "Press");

        assertThat(path.getFullPath()).isEqualTo("Acme/Dallas/Press");
        assertThat(path.depth()).isEqualTo(3);
        assertThat(path.getDeepestLevel()).isEqualTo("Area");
        assertThat(path.getValue("Site")).isEqualTo("Dallas");
    }

    @Test
    void shouldSkipBlankValues() {
        HierarchicalPath path = path("Enterprise", "Acme", "Site", " ");

        assertThat(path.depth()).isEqualTo(1);
        assertThat(path.getLevelNames()).containsExactly("Enterprise");
    }

    @Test
    void shouldBeEqualWhenAllPopulatedLevelsMatch() {
        assertThat(path("Enterprise", "Acme", "Site", "Dallas"))
                .isEqualTo(path("Enterprise", "Acme", "Site", "Dallas"))
                .hasSameHashCodeAs(path("Enterprise", "Acme", "Site", "Dallas"));
        assertThat(path("Enterprise", "Acme", "Site", "Dallas"))
                .isNotEqualTo(path("Enterprise", "Acme", "Site", "Austin"));
        assertThat(path("Enterprise", "Acme"))
                .isNotEqualTo(path("Enterprise", "Acme", "Site", "Dallas"));
    }

    @Test
    void shouldTruncateAndResolveParent() {
        HierarchicalPath path = path("Enterprise", "Acme", "Site", "Dallas", "Area", "Press");

        assertThat(path.truncate(2).getFullPath()).isEqualTo("Acme/Dallas");
        assertThat(path.parent().getFullPath()).isEqualTo("Acme/Dallas");
        assertThat(path.truncate(10)).isSameAs(path);
        assertThat(path("Enterprise", "Acme").parent().isEmpty()).isTrue();
        assertThat(HierarchicalPath.empty().parent().isEmpty()).isTrue();
    }

    @Test
    void shouldDetectPrefixes() {
        HierarchicalPath path = path("Enterprise", "Acme", "Site", "Dallas", "Area", "Press");

        assertThat(path.startsWith(path("Enterprise", "Acme"))).isTrue();
        assertThat(path.startsWith(path)).isTrue();
        assertThat(path.startsWith(HierarchicalPath.empty())).isTrue();
        assertThat(path.startsWith(path("Enterprise", "Other"))).isFalse();
        assertThat(path("Enterprise", "Acme").startsWith(path)).isFalse();
    }

    @Test
    void emptyPathShouldHaveNoDeepestLevel() {
        assertThat(HierarchicalPath.empty().isEmpty()).isTrue();
        assertThat(HierarchicalPath.empty().getDeepestLevel()).isNull();
        assertThat(HierarchicalPath.of(null)).isSameAs(HierarchicalPath.empty());
        assertThat(HierarchicalPath.empty().getFullPath()).isEmpty();
    }
}
