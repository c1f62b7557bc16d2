package com.podconfig.source;

import com.podconfig.exception.UnknownSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Names of the configuration sources a node agent can read pods from, and validation of
 * the source list a deployment declares.
 */
public final class PodSources {

    private static final Logger log = LoggerFactory.getLogger(PodSources.class);

    /**
     * Updates read from a file or directory of manifests.
     */
    public static final String FILE = "file";

    /**
     * Updates obtained by querying a web page.
     */
    public static final String HTTP = "http";

    /**
     * Updates streamed from the cluster API server.
     */
    public static final String API_SERVER = "api";

    /**
     * Wildcard expanding to every concrete source.
     */
    public static final String ALL = "*";

    private static final List<String> ALL_SOURCES = List.of(FILE, HTTP, API_SERVER);

    private PodSources() {
    }

    /**
     * @return file, http and api, in that order
     */
    public static List<String> all() {
        return ALL_SOURCES;
    }

    public static boolean isKnown(String source) {
        return FILE.equals(source) || HTTP.equals(source) || API_SERVER.equals(source);
    }

    /**
     * Validate the declared sources.
     * <p>
     * The first wildcard short-circuits the scan and yields all sources, whatever follows it.
     * Empty names are skipped. Concrete names are kept in input order, duplicates included.
     *
     * @param sources Declared source names
     * @return unmodifiable list of concrete sources
     * @throws UnknownSourceException on the first name that is not recognized
     */
    public static List<String> validate(List<String> sources) {
        if (sources == null || sources.isEmpty()) {
            return List.of();
        }
        List<String> validated = new ArrayList<>(sources.size());
        for (String source : sources) {
            if (ALL.equals(source)) {
                log.debug("Wildcard source declared, using {}", ALL_SOURCES);
                return ALL_SOURCES;
            }
            if (isKnown(source)) {
                validated.add(source);
            } else if (source == null || !source.isEmpty()) {
                throw new UnknownSourceException(source);
            }
        }
        log.debug("Validated pod sources: {}", validated);
        return Collections.unmodifiableList(validated);
    }
}
