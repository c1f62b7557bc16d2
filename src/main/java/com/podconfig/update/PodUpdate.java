package com.podconfig.update;

import com.podconfig.model.Pod;

import java.util.List;
import java.util.Objects;

/**
 * Operation sent by a configuration source to the reconciliation loop.
 * <p>
 * Single pods are added or removed by sending a list of one with {@link PodOperation#ADD}
 * or {@link PodOperation#REMOVE} (for REMOVE only the UID matters). To reset the state of a
 * source, send the desired pods with {@link PodOperation#SET}; to remove all its pods send
 * an empty list with SET.
 * <p>
 * {@code pods} is never null, always a possibly empty list, so that consumers comparing
 * updates structurally see "no pods" the same way every time.
 *
 * @param pods   Pods concerned by the operation, never null
 * @param op     Operation kind
 * @param source Name of the emitting source, empty when not attributed
 */
public record PodUpdate(
        List<Pod> pods,
        PodOperation op,
        String source
) {
    public PodUpdate {
        Objects.requireNonNull(pods, "pods cannot be null, use an empty list");
        Objects.requireNonNull(op, "op cannot be null");
        Objects.requireNonNull(source, "source cannot be null, use an empty string");
        pods = List.copyOf(pods);
    }

    public static PodUpdate set(String source, List<Pod> pods) {
        return new PodUpdate(pods, PodOperation.SET, source);
    }

    /**
     * SET with no pods: removes every pod attributed to the source.
     */
    public static PodUpdate clearAll(String source) {
        return new PodUpdate(List.of(), PodOperation.SET, source);
    }

    public static PodUpdate add(String source, List<Pod> pods) {
        return new PodUpdate(pods, PodOperation.ADD, source);
    }

    public static PodUpdate update(String source, List<Pod> pods) {
        return new PodUpdate(pods, PodOperation.UPDATE, source);
    }

    public static PodUpdate delete(String source, List<Pod> pods) {
        return new PodUpdate(pods, PodOperation.DELETE, source);
    }

    public static PodUpdate remove(String source, List<Pod> pods) {
        return new PodUpdate(pods, PodOperation.REMOVE, source);
    }

    public static PodUpdate reconcile(String source, List<Pod> pods) {
        return new PodUpdate(pods, PodOperation.RECONCILE, source);
    }

    public boolean isEmpty() {
        return pods.isEmpty();
    }
}
