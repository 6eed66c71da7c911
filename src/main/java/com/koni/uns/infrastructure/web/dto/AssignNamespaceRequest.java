package com.koni.uns.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AssignNamespaceRequest {

    @NotBlank(message = "topic is required")
    private String topic;

    @NotBlank(message = "nsPath is required")
    private String nsPath;
}
