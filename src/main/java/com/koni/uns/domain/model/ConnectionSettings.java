package com.koni.uns.domain.model;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Strongly-typed, connector-specific settings of a connection.
 *
 * Each connection type contributes its own implementation, registered with Jackson under
 * the connection type string so that the {@code type} property selects the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public interface ConnectionSettings {
}
