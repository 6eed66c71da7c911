package com.koni.uns.application.query;

import com.koni.uns.domain.model.ConnectionSettings;
import com.koni.uns.domain.model.ConnectionStatus;
import com.koni.uns.domain.model.InputConfiguration;
import com.koni.uns.domain.model.OutputConfiguration;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A connection's configuration together with its live status.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionResponse {

    private String id;
    private String name;
    private String description;
    private String connectionType;
    private boolean enabled;
    private boolean autoStart;
    private ConnectionStatus status;
    private String statusMessage;
    private ConnectionSettings settings;
    private List<InputConfiguration> inputs;
    private List<OutputConfiguration> outputs;
    private List<String> tags;
}
