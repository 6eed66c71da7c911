package com.koni.uns.application.mapping;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-mapping settings, bound from {@code uns.mapping}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "uns.mapping")
public class AutoMappingProperties {

    public enum MatchOrder {
        /**
         * Lower priority value first, then declaration order.
         */
        CONFIGURATION_ORDER,
        /**
         * Longer prefix first, then more literal tokens, then declaration order.
         */
        SPECIFICITY
    }

    private boolean enabled = true;

    private MatchOrder matchOrder = MatchOrder.CONFIGURATION_ORDER;

    /**
     * Prefixes removed from every topic before tokenization, e.g. the Sparkplug "spBv1.0/" segment.
     */
    private List<String> stripPrefixes = new ArrayList<>(List.of("spBv1.0/"));

    private boolean caseSensitive = false;

    /**
     * Assign the nearest ancestor accepting topics when the resolved level does not.
     */
    private boolean fallbackToAllowedAncestor = false;

    private List<Pattern> patterns = new ArrayList<>();

    @Getter
    @Setter
    public static class Pattern {

        private String name;

        /**
         * Token template such as {@code {Prefix}/{Enterprise}/{Site}/{Area}}.
         */
        private String template;

        private String prefix;

        private int priority;
    }
}
