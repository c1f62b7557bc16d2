package com.podconfig.policy;

import com.podconfig.model.Pod;
import com.podconfig.model.PodAnnotations;
import com.podconfig.source.PodSources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultCriticalityPolicy.
 */
class DefaultCriticalityPolicyTest {

    private static final int THRESHOLD = PriorityClassConfig.SYSTEM_CRITICAL_PRIORITY;

    private CriticalityPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new DefaultCriticalityPolicy(PriorityClassConfig.defaults());
    }

    // =====================================================================
    // Priority threshold
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Critical when priority reaches the threshold")
    @CsvSource({
            "2000000000, true",
            "2000001000, true",
            "2147483647, true",
            "1999999999, false",
            "0, false",
            "-10, false"
    })
    void criticalBasedOnPriority(int priority, boolean expected) {
        assertEquals(expected, policy.isCriticalPodBasedOnPriority(priority));
    }

    @Test
    @DisplayName("Threshold is taken from configuration")
    void configurableThreshold() {
        CriticalityPolicy lowThreshold = new DefaultCriticalityPolicy(PriorityClassConfig.withThreshold(100));

        assertTrue(lowThreshold.isCriticalPodBasedOnPriority(100));
        assertFalse(lowThreshold.isCriticalPodBasedOnPriority(99));
        assertTrue(lowThreshold.isCriticalPod(apiPod("p", 150)));
        assertFalse(policy.isCriticalPod(apiPod("p", 150)));
    }

    // =====================================================================
    // Critical pods
    // =====================================================================

    @Test
    @DisplayName("Static pods are critical whatever their priority")
    void staticPodIsCritical() {
        Pod pod = Pod.builder().uid("static")
                .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.FILE)
                .priority(0)
                .build();

        assertTrue(policy.isCriticalPod(pod));
    }

    @Test
    @DisplayName("Mirror pod with priority 0 is critical")
    void mirrorPodIsCritical() {
        Pod pod = Pod.builder().uid("mirror")
                .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.API_SERVER)
                .annotation(PodAnnotations.CONFIG_MIRROR, "anything")
                .priority(0)
                .build();

        assertTrue(policy.isCriticalPod(pod));
    }

    @Test
    @DisplayName("API pod is critical only through its priority")
    void apiPodCriticalByPriority() {
        assertTrue(policy.isCriticalPod(apiPod("high", THRESHOLD)));
        assertFalse(policy.isCriticalPod(apiPod("low", THRESHOLD - 1)));
        assertFalse(policy.isCriticalPod(apiPod("none", null)));
    }

    @Test
    @DisplayName("Pod without source nor priority is not critical")
    void podWithoutSourceIsNotCritical() {
        assertFalse(policy.isCriticalPod(Pod.builder().uid("bare").build()));
    }

    @ParameterizedTest
    @DisplayName("Criticality is monotonic in priority")
    @ValueSource(ints = {2_000_000_000, 2_000_000_001, 2_100_000_000, Integer.MAX_VALUE})
    void monotonicInPriority(int priority) {
        for (long higher = priority; higher <= Integer.MAX_VALUE; higher += 10_000_000L) {
            assertTrue(policy.isCriticalPod(apiPod("p", (int) higher)), "priority " + higher);
        }
    }

    // =====================================================================
    // Node critical pods
    // =====================================================================

    @Test
    @DisplayName("Node critical needs both criticality and the class name")
    void nodeCritical() {
        Pod nodeCritical = Pod.builder().uid("a")
                .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.API_SERVER)
                .priority(THRESHOLD + 1000)
                .priorityClassName(PriorityClassConfig.SYSTEM_NODE_CRITICAL)
                .build();
        Pod clusterCritical = Pod.builder().uid("b")
                .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.API_SERVER)
                .priority(THRESHOLD)
                .priorityClassName(PriorityClassConfig.SYSTEM_CLUSTER_CRITICAL)
                .build();
        Pod classOnly = Pod.builder().uid("c")
                .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.API_SERVER)
                .priority(10)
                .priorityClassName(PriorityClassConfig.SYSTEM_NODE_CRITICAL)
                .build();

        assertTrue(policy.isNodeCriticalPod(nodeCritical));
        assertFalse(policy.isNodeCriticalPod(clusterCritical));
        assertFalse(policy.isNodeCriticalPod(classOnly));
    }

    @Test
    @DisplayName("Node critical implies critical")
    void nodeCriticalImpliesCritical() {
        for (Pod pod : samplePods()) {
            if (policy.isNodeCriticalPod(pod)) {
                assertTrue(policy.isCriticalPod(pod), pod.uid());
            }
        }
    }

    @Test
    @DisplayName("Node critical class name is configurable")
    void nodeCriticalClassConfigurable() {
        CriticalityPolicy custom = new DefaultCriticalityPolicy(
                new PriorityClassConfig(THRESHOLD, "node-vital", "cluster-vital"));
        Pod pod = Pod.builder().uid("a")
                .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.FILE)
                .priorityClassName("node-vital")
                .build();

        assertTrue(custom.isNodeCriticalPod(pod));
        assertFalse(policy.isNodeCriticalPod(pod));
    }

    // =====================================================================
    // Preemption
    // =====================================================================

    @Test
    @DisplayName("Critical pod preempts non critical pod regardless of priority")
    void criticalPreemptsNonCritical() {
        Pod staticLow = Pod.builder().uid("static")
                .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.FILE)
                .priority(-100)
                .build();
        Pod regularHigh = apiPod("regular", THRESHOLD - 1);

        assertTrue(policy.preemptable(staticLow, regularHigh));
    }

    @Test
    @DisplayName("Non critical pod falls back to priorities against a critical pod")
    void nonCriticalAgainstCriticalComparesPriorities() {
        Pod staticPod = Pod.builder().uid("static")
                .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.FILE)
                .priority(10)
                .build();

        assertFalse(policy.preemptable(apiPod("lower", 5), staticPod));
        assertFalse(policy.preemptable(apiPod("equal", 10), staticPod));
        // no criticality guard on the preemptee side
        assertTrue(policy.preemptable(apiPod("higher", 20), staticPod));
    }

    @Test
    @DisplayName("Critical pod above the preemptee priority is never preempted back")
    void criticalAbovePreempteePriority() {
        for (Pod critical : samplePods()) {
            for (Pod regular : samplePods()) {
                if (policy.isCriticalPod(critical) && !policy.isCriticalPod(regular)
                        && critical.priority() != null && regular.priority() != null
                        && critical.priority() >= regular.priority()) {
                    assertTrue(policy.preemptable(critical, regular));
                    assertFalse(policy.preemptable(regular, critical));
                }
            }
        }
    }

    @Test
    @DisplayName("Critical pod without priority preempts non critical pod without priority")
    void criticalWithoutPriority() {
        Pod mirror = Pod.builder().uid("mirror").annotation(PodAnnotations.CONFIG_MIRROR, "").build();
        Pod regular = apiPod("regular", null);

        assertTrue(policy.preemptable(mirror, regular));
        assertFalse(policy.preemptable(regular, mirror));
    }

    @ParameterizedTest
    @DisplayName("Non critical pods compare priorities strictly")
    @CsvSource({
            "100, 10, true",
            "10, 100, false",
            "50, 50, false",
            "-1, -2, true"
    })
    void priorityComparison(int preemptor, int preemptee, boolean expected) {
        assertEquals(expected, policy.preemptable(apiPod("a", preemptor), apiPod("b", preemptee)));
    }

    @Test
    @DisplayName("Both critical pods compare priorities")
    void bothCritical() {
        Pod higher = apiPod("higher", THRESHOLD + 10);
        Pod lower = apiPod("lower", THRESHOLD);

        assertTrue(policy.preemptable(higher, lower));
        assertFalse(policy.preemptable(lower, higher));
    }

    @Test
    @DisplayName("Missing priority denies preemption")
    void missingPriorityDenies() {
        Pod withPriority = apiPod("with", 1000);
        Pod without = apiPod("without", null);

        assertFalse(policy.preemptable(withPriority, without));
        assertFalse(policy.preemptable(without, withPriority));
        assertFalse(policy.preemptable(without, apiPod("other", null)));
    }

    @Test
    @DisplayName("Both static pods without priority cannot preempt each other")
    void bothStaticWithoutPriority() {
        Pod a = Pod.builder().uid("a").annotation(PodAnnotations.CONFIG_SOURCE, PodSources.FILE).build();
        Pod b = Pod.builder().uid("b").annotation(PodAnnotations.CONFIG_SOURCE, PodSources.HTTP).build();

        assertFalse(policy.preemptable(a, b));
        assertFalse(policy.preemptable(b, a));
    }

    @Test
    @DisplayName("Preemption is never allowed both ways between pods of the same criticality")
    void antisymmetric() {
        List<Pod> pods = samplePods();
        for (Pod a : pods) {
            for (Pod b : pods) {
                if (a != b && policy.isCriticalPod(a) == policy.isCriticalPod(b)) {
                    assertFalse(policy.preemptable(a, b) && policy.preemptable(b, a),
                            a.uid() + " <-> " + b.uid());
                }
            }
        }
    }

    @Test
    @DisplayName("Null pods are rejected")
    void nullPodsRejected() {
        Pod pod = apiPod("a", 1);
        assertThrows(NullPointerException.class, () -> policy.preemptable(null, pod));
        assertThrows(NullPointerException.class, () -> policy.preemptable(pod, null));
        assertThrows(NullPointerException.class, () -> policy.isCriticalPod(null));
    }

    // =====================================================================
    // Init containers
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Only the Always restart policy makes an init container restartable")
    @CsvSource(value = {
            "Always, true",
            "OnFailure, false",
            "always, false",
            "NULL, false"
    }, nullValues = "NULL")
    void restartableInitContainer(String restartPolicy, boolean expected) {
        Pod.Container container = new Pod.Container("sidecar", "img", restartPolicy);
        assertEquals(expected, policy.isRestartableInitContainer(container));
    }

    // =====================================================================
    // Helper Methods
    // =====================================================================

    private Pod apiPod(String uid, Integer priority) {
        return Pod.builder()
                .uid(uid)
                .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.API_SERVER)
                .priority(priority)
                .build();
    }

    private List<Pod> samplePods() {
        List<Pod> pods = new ArrayList<>();
        Integer[] priorities = {null, -5, 0, 1000, THRESHOLD - 1, THRESHOLD, THRESHOLD + 1};
        String[] classes = {null, PriorityClassConfig.SYSTEM_NODE_CRITICAL, PriorityClassConfig.SYSTEM_CLUSTER_CRITICAL};
        int i = 0;
        for (Integer priority : priorities) {
            for (String priorityClass : classes) {
                pods.add(Pod.builder().uid("api-" + i++)
                        .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.API_SERVER)
                        .priority(priority).priorityClassName(priorityClass).build());
                pods.add(Pod.builder().uid("file-" + i++)
                        .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.FILE)
                        .priority(priority).priorityClassName(priorityClass).build());
                pods.add(Pod.builder().uid("mirror-" + i++)
                        .annotation(PodAnnotations.CONFIG_SOURCE, PodSources.API_SERVER)
                        .annotation(PodAnnotations.CONFIG_MIRROR, "hash")
                        .priority(priority).priorityClassName(priorityClass).build());
                pods.add(Pod.builder().uid("unknown-" + i++)
                        .priority(priority).priorityClassName(priorityClass).build());
            }
        }
        return pods;
    }
}
