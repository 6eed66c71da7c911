package com.koni.uns.infrastructure.config;

import com.koni.uns.domain.model.NamespaceType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural configuration seeded at startup, bound from {@code uns}.
 *
 * <pre>
 * uns:
 *   hierarchy:
 *     levels:
 *       - name: Enterprise
 *         allow-topics: false
 *   namespaces:
 *     - id: press-line
 *       name: Press Line
 *       type: FUNCTIONAL
 *       path: Acme/Dallas/Press
 *   bootstrap:
 *     connections-file: classpath:connections.json
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "uns")
public class UnsProperties {

    private Hierarchy hierarchy = new Hierarchy();

    private List<Namespace> namespaces = new ArrayList<>();

    private Bootstrap bootstrap = new Bootstrap();

    @Getter
    @Setter
    public static class Hierarchy {

        private String id = "default";

        private String name = "ISA-95";

        private List<Level> levels = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Level {

        private String name;

        private boolean allowTopics;

        private String description;
    }

    @Getter
    @Setter
    public static class Namespace {

        private String id;

        private String name;

        private NamespaceType type = NamespaceType.FUNCTIONAL;

        /**
         * Serialized hierarchy path, values separated by "/".
         */
        private String path;

        private String parentId;

        /**
         * Overrides the AllowTopics flag of the level at {@code path}; unset keeps the level flag.
         */
        private Boolean allowTopics;

        private String description;

        private boolean active = true;
    }

    @Getter
    @Setter
    public static class Bootstrap {

        /**
         * JSON array of connection configurations created on startup when not yet stored.
         */
        private Resource connectionsFile;
    }
}
