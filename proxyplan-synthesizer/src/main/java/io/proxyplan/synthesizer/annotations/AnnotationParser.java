/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Extracts one typed policy from the annotations of a resource.
 *
 * @param <T> the policy type
 */
@FunctionalInterface
public interface AnnotationParser<T> {

    /**
     * @param resource the annotated resource
     * @return the policy, or its default when the resource does not set any of the policy's annotations
     * @throws InvalidAnnotationException if an annotation of the policy has an unusable value
     */
    T parse(HasMetadata resource);
}
