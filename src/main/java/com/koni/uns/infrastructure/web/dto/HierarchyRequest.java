package com.koni.uns.infrastructure.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body replacing the active hierarchy. Levels are listed root first.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyRequest {

    @NotBlank(message = "id is required")
    private String id;

    @NotBlank(message = "name is required")
    private String name;

    @Valid
    @NotEmpty(message = "levels are required")
    private List<Level> levels;

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Level {

        @NotBlank(message = "level name is required")
        private String name;

        private boolean allowTopics;

        private String description;
    }
}
