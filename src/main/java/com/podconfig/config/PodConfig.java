package com.podconfig.config;

import com.podconfig.policy.PriorityClassConfig;
import com.podconfig.source.PodSources;

import java.util.List;

/**
 * Root configuration of the pod configuration core.
 *
 * @param sources  Validated pod sources the node reads from
 * @param priority System priority classes used by the criticality policy
 */
public record PodConfig(
        List<String> sources,
        PriorityClassConfig priority
) {
    public PodConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
        priority = priority == null ? PriorityClassConfig.defaults() : priority;
    }

    public boolean isSourceEnabled(String source) {
        return sources.contains(source);
    }

    /**
     * All sources enabled, Kubernetes priority classes.
     */
    public static PodConfig defaults() {
        return new PodConfig(PodSources.all(), PriorityClassConfig.defaults());
    }
}
