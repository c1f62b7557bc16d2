package com.podconfig.policy;

import com.podconfig.model.Pod;
import com.podconfig.provenance.PodProvenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Default implementation of CriticalityPolicy, driven by a {@link PriorityClassConfig}.
 * Stateless apart from its configuration, safe to share between threads.
 */
public class DefaultCriticalityPolicy implements CriticalityPolicy {

    private static final Logger log = LoggerFactory.getLogger(DefaultCriticalityPolicy.class);

    private final PriorityClassConfig config;
    private final PodProvenance provenance;

    public DefaultCriticalityPolicy(PriorityClassConfig config) {
        this(config, new PodProvenance());
    }

    public DefaultCriticalityPolicy(PriorityClassConfig config, PodProvenance provenance) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.provenance = Objects.requireNonNull(provenance, "provenance cannot be null");

        log.info("CriticalityPolicy initialized: critical threshold={}, node critical class={}",
                config.systemCriticalPriority(), config.systemNodeCriticalClassName());
    }

    public PriorityClassConfig getConfig() {
        return config;
    }

    @Override
    public boolean isCriticalPodBasedOnPriority(int priority) {
        return priority >= config.systemCriticalPriority();
    }

    @Override
    public boolean isCriticalPod(Pod pod) {
        Objects.requireNonNull(pod, "pod cannot be null");
        // cheapest checks first
        if (provenance.isStatic(pod)) {
            return true;
        }
        if (provenance.isMirror(pod)) {
            return true;
        }
        Integer priority = pod.priority();
        return priority != null && isCriticalPodBasedOnPriority(priority);
    }

    @Override
    public boolean isNodeCriticalPod(Pod pod) {
        return isCriticalPod(pod) && Objects.equals(config.systemNodeCriticalClassName(), pod.priorityClassName());
    }

    @Override
    public boolean preemptable(Pod preemptor, Pod preemptee) {
        Objects.requireNonNull(preemptor, "preemptor cannot be null");
        Objects.requireNonNull(preemptee, "preemptee cannot be null");

        if (isCriticalPod(preemptor) && !isCriticalPod(preemptee)) {
            log.debug("Pod {} is critical, may preempt non critical pod {}", preemptor.uid(), preemptee.uid());
            return true;
        }

        Integer preemptorPriority = preemptor.priority();
        Integer preempteePriority = preemptee.priority();
        if (preemptorPriority != null && preempteePriority != null) {
            return preemptorPriority > preempteePriority;
        }

        log.debug("No comparable priority between pods {} and {}, preemption denied",
                preemptor.uid(), preemptee.uid());
        return false;
    }

    @Override
    public boolean isRestartableInitContainer(Pod.Container initContainer) {
        Objects.requireNonNull(initContainer, "initContainer cannot be null");
        return Pod.Container.RESTART_POLICY_ALWAYS.equals(initContainer.restartPolicy());
    }
}
