package com.podconfig.update;

/**
 * Kind of change carried by a {@link PodUpdate}. A message carries exactly one kind.
 */
public enum PodOperation {
    /**
     * The complete pod configuration of the source; replaces everything previously
     * attributed to it.
     */
    SET,

    /**
     * Pods new to this source.
     */
    ADD,

    /**
     * Pods gracefully deleted from this source.
     */
    DELETE,

    /**
     * Pods removed from this source, dropped from desired state immediately.
     */
    REMOVE,

    /**
     * Pods updated in this source.
     */
    UPDATE,

    /**
     * Pods whose status diverges from what the source expects; the consumer should
     * reconcile status, not spec.
     */
    RECONCILE;

    private static final PodOperation[] VALUES = values();

    public int code() {
        return ordinal();
    }

    /**
     * @param code Numeric code, SET being 0
     * @return the matching operation
     * @throws IllegalArgumentException if the code is out of range
     */
    public static PodOperation fromCode(int code) {
        if (code < 0 || code >= VALUES.length) {
            throw new IllegalArgumentException("Unknown pod operation code: " + code);
        }
        return VALUES[code];
    }
}
