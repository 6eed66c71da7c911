package com.koni.uns.infrastructure.web.dto;

import com.koni.uns.domain.model.HierarchyConfiguration;
import com.koni.uns.domain.model.HierarchyNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyResponse {

    private String id;
    private String name;
    private List<HierarchyNode> levels;

    public static HierarchyResponse from(HierarchyConfiguration hierarchy) {
        return new HierarchyResponse(hierarchy.getId(), hierarchy.getName(), hierarchy.getNodes());
    }
}
