package com.koni.uns.infrastructure.web.controller;

import com.koni.uns.application.namespace.HierarchyService;
import com.koni.uns.application.query.NamespaceResponse;
import com.koni.uns.domain.model.HierarchyConfiguration;
import com.koni.uns.domain.model.HierarchyNode;
import com.koni.uns.domain.model.NamespaceConfiguration;
import com.koni.uns.infrastructure.web.dto.HierarchyRequest;
import com.koni.uns.infrastructure.web.dto.HierarchyResponse;
import com.koni.uns.infrastructure.web.dto.NamespaceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the hierarchy and the namespace set.
 * Every change here triggers a re-evaluation of topic mappings and a cache rebuild.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class NamespaceController {

    private final HierarchyService hierarchyService;

    @GetMapping("/v1/namespaces/hierarchy")
    public ResponseEntity<HierarchyResponse> getHierarchy() {
        log.info("Received request to get hierarchy");
        return ResponseEntity.ok(HierarchyResponse.from(hierarchyService.getActiveHierarchy()));
    }

    @PutMapping("/v1/namespaces/hierarchy")
    public ResponseEntity<HierarchyResponse> updateHierarchy(@RequestBody @Valid HierarchyRequest request) {
        log.info("Received request to update hierarchy: id={}, levels={}", request.getId(), request.getLevels().size());
        hierarchyService.updateHierarchy(toHierarchy(request));
        return ResponseEntity.ok(HierarchyResponse.from(hierarchyService.getActiveHierarchy()));
    }

    @GetMapping("/v1/namespaces")
    public ResponseEntity<List<NamespaceResponse>> getNamespaces() {
        log.info("Received request to get all namespaces");
        List<NamespaceResponse> namespaces = hierarchyService.getNamespaces().stream()
                .sorted(Comparator.comparing(NamespaceConfiguration::getId))
                .map(NamespaceResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(namespaces);
    }

    @GetMapping("/v1/namespaces/{id}")
    public ResponseEntity<NamespaceResponse> getNamespace(@PathVariable String id) {
        return ResponseEntity.ok(NamespaceResponse.from(hierarchyService.getNamespace(id)));
    }

    @PostMapping("/v1/namespaces")
    public ResponseEntity<NamespaceResponse> saveNamespace(@RequestBody @Valid NamespaceRequest request) {
        log.info("Received request to save namespace: id={}, path={}", request.getId(), request.getPath());
        NamespaceConfiguration namespace = NamespaceConfiguration.builder()
                .id(request.getId())
                .name(request.getName())
                .type(request.getType())
                .description(request.getDescription())
                .path(hierarchyService.getActiveHierarchy().parsePath(request.getPath()))
                .parentNamespaceId(request.getParentNamespaceId())
                .allowTopics(request.getAllowTopics())
                .active(request.isActive())
                .build();
        NamespaceConfiguration stored = hierarchyService.saveNamespace(namespace);
        return ResponseEntity.status(HttpStatus.CREATED).body(NamespaceResponse.from(stored));
    }

    @DeleteMapping("/v1/namespaces/{id}")
    public ResponseEntity<Void> deleteNamespace(@PathVariable String id) {
        log.info("Received request to delete namespace: id={}", id);
        hierarchyService.deleteNamespace(id);
        return ResponseEntity.noContent().build();
    }

    private static HierarchyConfiguration toHierarchy(HierarchyRequest request) {
        List<HierarchyNode> nodes = new ArrayList<>();
        String parentId = null;
        for (int i = 0; i < request.getLevels().size(); i++) {
            HierarchyRequest.Level level = request.getLevels().get(i);
            nodes.add(new HierarchyNode(level.getName(), level.getName(), i, parentId,
                    level.isAllowTopics(), level.getDescription()));
            parentId = level.getName();
        }
        return new HierarchyConfiguration(request.getId(), request.getName(), nodes);
    }
}
