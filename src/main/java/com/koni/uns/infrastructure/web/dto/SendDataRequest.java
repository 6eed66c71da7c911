package com.koni.uns.infrastructure.web.dto;

import com.koni.uns.domain.model.DataQuality;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Request body for sending a value out through a connection.
 * {@code outputId} is optional; the connection picks its first enabled output when absent.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SendDataRequest {

    @NotBlank(message = "topic is required")
    private String topic;

    private Object value;

    private DataQuality quality;

    private String outputId;
}
