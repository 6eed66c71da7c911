package com.koni.uns.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Query for historical values in {@code [from, to]}, either of one topic or of every topic
 * at or below a namespace path. Missing bounds default to the last hour.
 */
@Getter
@AllArgsConstructor
public class GetHistoryQuery {

    private final String topic;
    private final String path;
    private final Instant from;
    private final Instant to;
}
