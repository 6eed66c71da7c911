package com.koni.uns.infrastructure.web.dto;

import com.koni.uns.domain.model.ConnectionSettings;
import com.koni.uns.domain.model.InputConfiguration;
import com.koni.uns.domain.model.OutputConfiguration;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for creating or updating a connection.
 *
 * {@code settings} carries a {@code type} property naming the connection type; when omitted,
 * the default settings of {@code connectionType} are used.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionRequest {

    @NotBlank(message = "id is required")
    private String id;

    @NotBlank(message = "name is required")
    private String name;

    private String description;

    @NotBlank(message = "connectionType is required")
    private String connectionType;

    private boolean enabled = true;

    private boolean autoStart = true;

    private ConnectionSettings settings;

    private List<InputConfiguration> inputs;

    private List<OutputConfiguration> outputs;

    private List<String> tags;
}
