package com.podconfig.model;

/**
 * Annotation keys stamped on pods by the node agent.
 * Writers (mirror pod creation, provenance stamping) must use these values verbatim.
 */
public final class PodAnnotations {

    /**
     * Name of the source the pod configuration came from (file, http or api).
     */
    public static final String CONFIG_SOURCE = "kubernetes.io/config.source";

    /**
     * Present on mirror pods; the value is not interpreted.
     */
    public static final String CONFIG_MIRROR = "kubernetes.io/config.mirror";

    public static final String CONFIG_FIRST_SEEN = "kubernetes.io/config.seen";

    public static final String CONFIG_HASH = "kubernetes.io/config.hash";

    private PodAnnotations() {
    }
}
