package com.podconfig.policy;

import com.podconfig.config.PodConfig;
import com.podconfig.provenance.PodProvenance;

/**
 * Factory for creating CriticalityPolicy implementations based on config.
 */
public final class CriticalityPolicyFactory {

    private CriticalityPolicyFactory() {
    }

    public static CriticalityPolicy create(PodConfig config) {
        return new DefaultCriticalityPolicy(config.priority());
    }

    public static CriticalityPolicy create(PodConfig config, PodProvenance provenance) {
        return new DefaultCriticalityPolicy(config.priority(), provenance);
    }
}
