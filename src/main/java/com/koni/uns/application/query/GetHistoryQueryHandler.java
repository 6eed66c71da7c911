package com.koni.uns.application.query;

import com.koni.uns.application.namespace.HierarchyService;
import com.koni.uns.domain.exception.ValidationException;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.repository.HistoricalStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads value history from historical storage, oldest first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetHistoryQueryHandler {

    static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

    private final HistoricalStorage historicalStorage;
    private final HierarchyService hierarchyService;

    public List<DataPointResponse> handle(GetHistoryQuery query) {
        Instant to = query.getTo() != null ? query.getTo() : Instant.now();
        Instant from = query.getFrom() != null ? query.getFrom() : to.minus(DEFAULT_WINDOW);
        if (from.isAfter(to)) {
            throw new ValidationException("from must not be after to");
        }

        List<DataPoint> values;
        if (query.getTopic() != null && !query.getTopic().isBlank()) {
            log.debug("Handling GetHistoryQuery: topic={}, from={}, to={}", query.getTopic(), from, to);
            values = historicalStorage.getHistory(query.getTopic(), from, to);
        } else {
            HierarchicalPath path = hierarchyService.getActiveHierarchy().parsePath(query.getPath());
            if (path.isEmpty()) {
                throw new ValidationException("Either topic or path is required");
            }
            log.debug("Handling GetHistoryQuery: path={}, from={}, to={}", path, from, to);
            values = historicalStorage.getHistoryByPath(path, from, to);
        }

        log.info("Retrieved {} historical values", values.size());
        return values.stream()
                .map(DataPointResponse::from)
                .collect(Collectors.toList());
    }
}
