package com.podconfig.provenance;

import com.podconfig.exception.SourceUnknownException;
import com.podconfig.model.Pod;
import com.podconfig.model.PodAnnotations;
import com.podconfig.source.PodSources;

import java.util.Optional;

/**
 * Derives the origin of a pod from its annotations. Nothing is cached: every call reads
 * the snapshot it is given.
 */
public class PodProvenance {

    /**
     * Get the source of a pod.
     *
     * @param pod Pod to inspect
     * @return value of the config.source annotation
     * @throws SourceUnknownException if the annotation is absent
     */
    public String sourceOf(Pod pod) {
        return findSource(pod).orElseThrow(() -> new SourceUnknownException(pod.uid()));
    }

    /**
     * Same lookup as {@link #sourceOf(Pod)}, reporting absence as an empty Optional.
     */
    public Optional<String> findSource(Pod pod) {
        return annotation(pod, PodAnnotations.CONFIG_SOURCE);
    }

    /**
     * A mirror pod is recognized by the presence of the mirror annotation, whatever its value.
     */
    public boolean isMirror(Pod pod) {
        return pod.annotations().containsKey(PodAnnotations.CONFIG_MIRROR);
    }

    /**
     * A static pod has a known source which is not the API server.
     * A pod without source is not static.
     */
    public boolean isStatic(Pod pod) {
        return findSource(pod)
                .map(source -> !PodSources.API_SERVER.equals(source))
                .orElse(false);
    }

    public Optional<String> configHash(Pod pod) {
        return annotation(pod, PodAnnotations.CONFIG_HASH);
    }

    public Optional<String> firstSeen(Pod pod) {
        return annotation(pod, PodAnnotations.CONFIG_FIRST_SEEN);
    }

    private Optional<String> annotation(Pod pod, String key) {
        return Optional.ofNullable(pod.annotations().get(key));
    }
}
