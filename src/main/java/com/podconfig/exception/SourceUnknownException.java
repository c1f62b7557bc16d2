package com.podconfig.exception;

/**
 * Exception thrown when a pod carries no provenance annotation.
 * Usually non-fatal: callers treat such a pod as neither static nor source specific.
 */
public class SourceUnknownException extends PodConfigException {

    private final String podUid;

    public SourceUnknownException(String podUid) {
        super("cannot get source of pod \"" + podUid + "\"");
        this.podUid = podUid;
    }

    public String getPodUid() {
        return podUid;
    }
}
