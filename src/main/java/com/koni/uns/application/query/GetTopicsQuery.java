package com.koni.uns.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for known topics. {@code pathPrefix} restricts the result to topics mapped at or
 * below a serialized namespace path; {@code unmappedOnly} returns the topics without a path.
 */
@Getter
@AllArgsConstructor
public class GetTopicsQuery {

    private final String pathPrefix;
    private final boolean unmappedOnly;

    public static GetTopicsQuery all() {
        return new GetTopicsQuery(null, false);
    }
}
