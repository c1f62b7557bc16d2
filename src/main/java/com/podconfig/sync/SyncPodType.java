package com.podconfig.sync;

import java.util.Optional;

/**
 * Why a reconciliation pass is run for a pod. Purely descriptive, used for logging.
 */
public enum SyncPodType {
    /**
     * Periodic sync ensuring desired state.
     */
    SYNC("sync"),

    /**
     * The pod was updated by its source.
     */
    UPDATE("update"),

    /**
     * The pod was created by its source.
     */
    CREATE("create"),

    /**
     * The pod should have no running containers. It may be restarted later
     * if its configuration changes.
     */
    KILL("kill");

    public static final String UNKNOWN = "unknown";

    private static final SyncPodType[] VALUES = values();

    private final String label;

    SyncPodType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public int code() {
        return ordinal();
    }

    @Override
    public String toString() {
        return label;
    }

    public static Optional<SyncPodType> fromCode(int code) {
        if (code < 0 || code >= VALUES.length) {
            return Optional.empty();
        }
        return Optional.of(VALUES[code]);
    }

    /**
     * Render a numeric sync type, keeping readers working when writers know more types.
     *
     * @param code Numeric code, SYNC being 0
     * @return the label, or "unknown" if the code is not recognized
     */
    public static String describe(int code) {
        return fromCode(code).map(SyncPodType::getLabel).orElse(UNKNOWN);
    }
}
