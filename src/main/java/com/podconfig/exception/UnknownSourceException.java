package com.podconfig.exception;

/**
 * Exception thrown when a declared source name is not one of file, http, api or the wildcard.
 */
public class UnknownSourceException extends PodConfigException {

    private final String source;

    public UnknownSourceException(String source) {
        super("unknown pod source \"" + source + "\"");
        this.source = source;
    }

    /**
     * @return the rejected source name, may be null
     */
    public String getSource() {
        return source;
    }
}
