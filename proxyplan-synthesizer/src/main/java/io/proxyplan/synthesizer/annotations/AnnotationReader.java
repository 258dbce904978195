/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;

/**
 * Reads typed values of the annotations {@code <prefix>/<name>} of a resource.
 * A key that is absent or has a blank value reads as empty.
 */
public class AnnotationReader {

    private final String prefix;

    public AnnotationReader(String prefix) {
        this.prefix = Objects.requireNonNull(prefix);
    }

    public String prefix() {
        return prefix;
    }

    /**
     * @return the full annotation key for {@code name}
     */
    public String key(String name) {
        return prefix + "/" + name;
    }

    public Optional<String> string(HasMetadata resource, String name) {
        return Optional.ofNullable(annotations(resource).get(key(name)))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    /**
     * Reads a boolean. Besides {@code true} and {@code false}, the forms {@code 1}, {@code t}, {@code 0} and {@code f}
     * are accepted in any case.
     *
     * @throws InvalidAnnotationException if the value is not a boolean
     */
    public Optional<Boolean> bool(HasMetadata resource, String name) {
        return string(resource, name).map(value -> switch (value.toLowerCase(Locale.ROOT)) {
            case "1", "t", "true" -> true;
            case "0", "f", "false" -> false;
            default -> throw new InvalidAnnotationException(key(name) + ": '" + value + "' is not a boolean");
        });
    }

    /**
     * @throws InvalidAnnotationException if the value is not an integer
     */
    public Optional<Integer> integer(HasMetadata resource, String name) {
        return string(resource, name).map(value -> {
            try {
                return Integer.parseInt(value);
            }
            catch (NumberFormatException e) {
                throw new InvalidAnnotationException(key(name) + ": '" + value + "' is not an integer", e);
            }
        });
    }

    /**
     * @return the non-empty, trimmed elements of a comma separated value
     */
    public List<String> list(HasMetadata resource, String name) {
        return string(resource, name)
                .map(value -> Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(element -> !element.isEmpty())
                        .toList())
                .orElse(List.of());
    }

    /**
     * @return true if any annotation of the resource has the key {@code <prefix>/<name>}, whatever its value
     */
    public boolean isPresent(HasMetadata resource, String name) {
        return annotations(resource).containsKey(key(name));
    }

    static Map<String, String> annotations(HasMetadata resource) {
        return Optional.ofNullable(resource.getMetadata())
                .map(ObjectMeta::getAnnotations)
                .orElse(Map.of());
    }
}
