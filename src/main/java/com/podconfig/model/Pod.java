package com.podconfig.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a pod as handed over by the cluster API layer.
 * Only the fields needed for provenance and priority classification are modelled.
 *
 * @param metadata Identity and annotations
 * @param spec     Scheduling related part of the pod spec
 */
public record Pod(
        Metadata metadata,
        Spec spec
) {
    public static final String NAMESPACE_DEFAULT = "default";

    public Pod {
        metadata = metadata == null ? Metadata.EMPTY : metadata;
        spec = spec == null ? Spec.EMPTY : spec;
    }

    public String uid() {
        return metadata.uid();
    }

    public Map<String, String> annotations() {
        return metadata.annotations();
    }

    /**
     * @return declared priority, null when the pod has none
     */
    public Integer priority() {
        return spec.priority();
    }

    public String priorityClassName() {
        return spec.priorityClassName();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Pod metadata. A null annotation map becomes an empty one, a missing key stays missing.
     * Annotation values must not be null.
     */
    public record Metadata(
            String name,
            String namespace,
            String uid,
            Map<String, String> annotations
    ) {
        public static final Metadata EMPTY = new Metadata(null, NAMESPACE_DEFAULT, null, Map.of());

        public Metadata {
            annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        }
    }

    /**
     * @param priority          Declared priority (larger = more important), null when absent
     * @param priorityClassName Priority class name, may be null
     * @param initContainers    Init containers, never null
     * @param containers        Regular containers, never null
     */
    public record Spec(
            Integer priority,
            String priorityClassName,
            List<Container> initContainers,
            List<Container> containers
    ) {
        public static final Spec EMPTY = new Spec(null, null, List.of(), List.of());

        public Spec {
            initContainers = initContainers == null ? List.of() : List.copyOf(initContainers);
            containers = containers == null ? List.of() : List.copyOf(containers);
        }
    }

    /**
     * @param restartPolicy Container level restart policy, null when not declared
     */
    public record Container(
            String name,
            String image,
            String restartPolicy
    ) {
        public static final String RESTART_POLICY_ALWAYS = "Always";

        public static Container of(String name) {
            return new Container(name, null, null);
        }
    }

    /**
     * Builder for Pod, mostly used by sources and tests.
     */
    public static class Builder {
        private String name;
        private String namespace = NAMESPACE_DEFAULT;
        private String uid;
        private final Map<String, String> annotations = new LinkedHashMap<>();
        private Integer priority;
        private String priorityClassName;
        private final List<Container> initContainers = new ArrayList<>();
        private final List<Container> containers = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder uid(String uid) {
            this.uid = uid;
            return this;
        }

        public Builder annotation(String key, String value) {
            this.annotations.put(key, value == null ? "" : value);
            return this;
        }

        public Builder annotations(Map<String, String> annotations) {
            if (annotations != null) {
                annotations.forEach(this::annotation);
            }
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder priorityClassName(String priorityClassName) {
            this.priorityClassName = priorityClassName;
            return this;
        }

        public Builder initContainer(Container container) {
            this.initContainers.add(container);
            return this;
        }

        public Builder container(Container container) {
            this.containers.add(container);
            return this;
        }

        public Pod build() {
            return new Pod(
                    new Metadata(name, namespace, uid, annotations),
                    new Spec(priority, priorityClassName, initContainers, containers));
        }
    }
}
