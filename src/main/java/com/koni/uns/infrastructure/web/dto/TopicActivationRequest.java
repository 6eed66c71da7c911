package com.koni.uns.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TopicActivationRequest {

    @NotBlank(message = "topic is required")
    private String topic;

    @NotNull(message = "active is required")
    private Boolean active;
}
