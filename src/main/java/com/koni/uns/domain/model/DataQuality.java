package com.koni.uns.domain.model;

/**
 * Quality indicator attached to every data point by its source connection.
 */
public enum DataQuality {
    GOOD,
    UNCERTAIN,
    BAD
}
