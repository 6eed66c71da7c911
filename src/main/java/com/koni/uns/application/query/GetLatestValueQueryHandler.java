package com.koni.uns.application.query;

import com.koni.uns.application.namespace.HierarchyService;
import com.koni.uns.domain.exception.NotFoundException;
import com.koni.uns.domain.exception.ValidationException;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.repository.RealtimeStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads latest values from realtime storage.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetLatestValueQueryHandler {

    private final RealtimeStorage realtimeStorage;
    private final HierarchyService hierarchyService;

    /**
     * @throws NotFoundException if no value was stored for the topic yet
     */
    public DataPointResponse handle(GetLatestValueQuery query) {
        if (query.getTopic() == null || query.getTopic().isBlank()) {
            throw new ValidationException("topic is required");
        }
        log.debug("Handling GetLatestValueQuery: topic={}", query.getTopic());
        return realtimeStorage.getLatest(query.getTopic())
                .map(DataPointResponse::from)
                .orElseThrow(() -> new NotFoundException("No value stored for topic: " + query.getTopic()));
    }

    public List<DataPointResponse> handleByPath(GetLatestValueQuery query) {
        HierarchicalPath path = hierarchyService.getActiveHierarchy().parsePath(query.getPath());
        if (path.isEmpty()) {
            throw new ValidationException("path is required");
        }
        log.debug("Handling GetLatestValueQuery: path={}", path);
        List<DataPointResponse> values = realtimeStorage.getLatestByPath(path).stream()
                .map(DataPointResponse::from)
                .collect(Collectors.toList());
        log.info("Retrieved {} latest values under {}", values.size(), path);
        return values;
    }
}
