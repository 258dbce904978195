/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.proxyplan.api.policy.OpentracingPolicy;

/**
 * Reads the per-resource opentracing override. A policy that is not {@link OpentracingPolicy#set() set}
 * leaves the cluster-wide setting in force.
 */
public class OpentracingParser implements AnnotationParser<OpentracingPolicy> {

    private final AnnotationReader reader;

    public OpentracingParser(AnnotationReader reader) {
        this.reader = Objects.requireNonNull(reader);
    }

    @Override
    public OpentracingPolicy parse(HasMetadata resource) {
        Optional<Boolean> enabled = readQuietly(resource, "enable-opentracing");
        if (enabled.isEmpty()) {
            return OpentracingPolicy.UNSET;
        }
        Optional<Boolean> trustIncomingSpan = readQuietly(resource, "opentracing-trust-incoming-span");
        return new OpentracingPolicy(true, enabled.get(), trustIncomingSpan.isPresent(), trustIncomingSpan.orElse(false));
    }

    // an unreadable value counts as unset
    private Optional<Boolean> readQuietly(HasMetadata resource, String name) {
        try {
            return reader.bool(resource, name);
        }
        catch (InvalidAnnotationException e) {
            return Optional.empty();
        }
    }
}
