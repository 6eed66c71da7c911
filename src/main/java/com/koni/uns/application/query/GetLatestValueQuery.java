package com.koni.uns.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for the latest value of one topic, or of every topic at or below a namespace path.
 * Exactly one of {@code topic} and {@code path} is expected.
 */
@Getter
@AllArgsConstructor
public class GetLatestValueQuery {

    private final String topic;
    private final String path;

    public static GetLatestValueQuery forTopic(String topic) {
        return new GetLatestValueQuery(topic, null);
    }

    public static GetLatestValueQuery forPath(String path) {
        return new GetLatestValueQuery(null, path);
    }
}
