package com.podconfig.policy;

import java.util.Objects;

/**
 * System priority classes the criticality policy relies on.
 *
 * @param systemCriticalPriority        Priority at and above which a pod is critical
 * @param systemNodeCriticalClassName   Name of the node-critical priority class
 * @param systemClusterCriticalClassName Name of the cluster-critical priority class
 */
public record PriorityClassConfig(
        int systemCriticalPriority,
        String systemNodeCriticalClassName,
        String systemClusterCriticalClassName
) {
    public static final int SYSTEM_CRITICAL_PRIORITY = 2_000_000_000;
    public static final String SYSTEM_NODE_CRITICAL = "system-node-critical";
    public static final String SYSTEM_CLUSTER_CRITICAL = "system-cluster-critical";

    public PriorityClassConfig {
        Objects.requireNonNull(systemNodeCriticalClassName, "systemNodeCriticalClassName cannot be null");
        Objects.requireNonNull(systemClusterCriticalClassName, "systemClusterCriticalClassName cannot be null");
    }

    /**
     * Values used by Kubernetes for its built-in priority classes.
     */
    public static PriorityClassConfig defaults() {
        return new PriorityClassConfig(SYSTEM_CRITICAL_PRIORITY, SYSTEM_NODE_CRITICAL, SYSTEM_CLUSTER_CRITICAL);
    }

    /**
     * Defaults with another threshold, for testing.
     */
    public static PriorityClassConfig withThreshold(int systemCriticalPriority) {
        return new PriorityClassConfig(systemCriticalPriority, SYSTEM_NODE_CRITICAL, SYSTEM_CLUSTER_CRITICAL);
    }
}
