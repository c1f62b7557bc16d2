package com.podconfig.policy;

import com.podconfig.model.Pod;

/**
 * Decides which pods are protected from preemption and eviction, and which pod may
 * preempt which. Called by the eviction manager and the scheduler as a pure query.
 */
public interface CriticalityPolicy {

    /**
     * @param priority Priority resolved from the pod spec
     * @return true if the priority reaches the system critical threshold
     */
    boolean isCriticalPodBasedOnPriority(int priority);

    /**
     * A pod is critical when it is static, a mirror pod, or declares a critical priority.
     */
    boolean isCriticalPod(Pod pod);

    /**
     * A critical pod using the system-node-critical priority class.
     */
    boolean isNodeCriticalPod(Pod pod);

    /**
     * Whether the preemptor may preempt the preemptee.
     * <p>
     * A critical pod always preempts a non-critical one. Otherwise both pods need a
     * declared priority and the preemptor's must be strictly greater. Anything else is denied.
     *
     * @param preemptor Pod needing resources
     * @param preemptee Pod that would be terminated
     * @return true if preemption is allowed
     */
    boolean preemptable(Pod preemptor, Pod preemptee);

    /**
     * An init container is restartable (a sidecar) when its restart policy is Always.
     */
    boolean isRestartableInitContainer(Pod.Container initContainer);
}
