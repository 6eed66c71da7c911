package com.koni.uns.domain.model;

import com.koni.uns.TestHierarchies;
import com.koni.uns.domain.exception.ValidationException;
import com.koni.uns.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@UnitTest
class HierarchyConfigurationTest {

    private final HierarchyConfiguration hierarchy = TestHierarchies.isa95();

    @Test
    void shouldAcceptWellFormedHierarchy() {
        assertThat(hierarchy.validate().isValid()).isTrue();
        assertThat(hierarchy.getLevelNames()).containsExactly("Enterprise", "Site", "Area", "Line", "Unit");
    }

    @Test
    void shouldRejectEmptyHierarchy() {
        ValidationResult result = new HierarchyConfiguration("x", "x", List.of()).validate();

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrorMessage()).contains("at least one level");
    }

    @Test
    void shouldRejectDuplicateNamesAndUnknownParents() {
        HierarchyConfiguration broken = new HierarchyConfiguration("x", "x", List.of(
                new HierarchyNode("a", "Enterprise", 0, null, false, null),
                new HierarchyNode("b", "enterprise", 1, "a", false, null),
                new HierarchyNode("c", "Area", 2, "missing", true, null)));

        ValidationResult result = broken.validate();

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors())
                .anyMatch(error -> error.contains("Duplicate hierarchy level name"))
                .anyMatch(error -> error.contains("unknown parent missing"));
    }

    @Test
    void shouldRejectMultipleRoots() {
        HierarchyConfiguration broken = new HierarchyConfiguration("x", "x", List.of(
                new HierarchyNode("a", "Enterprise", 0, null, false, null),
                new HierarchyNode("b", "Site", 1, null, false, null)));

        assertThat(broken.validate().getErrorMessage()).contains("exactly one root");
    }

    @Test
    void shouldRejectParentCycles() {
        HierarchyConfiguration broken = new HierarchyConfiguration("x", "x", List.of(
                new HierarchyNode("root", "Enterprise", 0, null, false, null),
                new HierarchyNode("a", "Site", 1, "b", false, null),
                new HierarchyNode("b", "Area", 2, "a", true, null)));

        assertThat(broken.validate().getErrors()).anyMatch(error -> error.contains("Cycle detected"));
    }

    @Test
    void shouldParsePathOntoLevelsInOrder() {
        HierarchicalPath path = hierarchy.parsePath("/Acme/Dallas/Press/");

        assertThat(path.getLevelNames()).containsExactly("Enterprise", "Site", "Area");
        assertThat(path.getFullPath()).isEqualTo("Acme/Dallas/Press");
        assertThat(hierarchy.isValidPath(path)).isTrue();
    }

    @Test
    void shouldRejectPathDeeperThanHierarchy() {
        assertThatThrownBy(() -> hierarchy.parsePath("a/b/c/d/e/f"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("defines only 5");
    }

    @Test
    void shouldRejectPathsWithUndefinedOrMisorderedLevels() {
        HierarchicalPath skipped = HierarchicalPath.of(new LinkedHashMap<>(Map.of("Site", "Dallas")));

        assertThat(hierarchy.isValidPath(skipped)).isFalse();
        assertThatThrownBy(() -> hierarchy.requireValidPath(skipped))
                .isInstanceOf(ValidationException.class);
        assertThat(hierarchy.isValidPath(null)).isFalse();
    }
}
