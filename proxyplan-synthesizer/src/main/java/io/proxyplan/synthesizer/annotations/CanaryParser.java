/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Objects;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.proxyplan.api.policy.CanaryPolicy;

/**
 * Reads the {@code canary} annotation and the traffic split annotations accompanying it.
 */
public class CanaryParser implements AnnotationParser<CanaryPolicy> {

    static final String CANARY = "canary";

    private final AnnotationReader reader;

    public CanaryParser(AnnotationReader reader) {
        this.reader = Objects.requireNonNull(reader);
    }

    @Override
    public CanaryPolicy parse(HasMetadata resource) {
        boolean enabled = reader.bool(resource, CANARY).orElse(false);
        int weight = reader.integer(resource, "canary-weight").orElse(0);
        int weightTotal = reader.integer(resource, "canary-weight-total").orElse(CanaryPolicy.DEFAULT_WEIGHT_TOTAL);
        String header = reader.string(resource, "canary-by-header").orElse(null);
        String headerValue = reader.string(resource, "canary-by-header-value").orElse(null);
        String headerPattern = reader.string(resource, "canary-by-header-pattern").orElse(null);
        String cookie = reader.string(resource, "canary-by-cookie").orElse(null);

        if (!enabled) {
            if (weight > 0 || header != null || headerValue != null || headerPattern != null || cookie != null) {
                throw new InvalidAnnotationException("canary traffic split annotations require " + reader.key(CANARY) + " to be true");
            }
            return CanaryPolicy.DISABLED;
        }
        if (weight < 0 || weightTotal <= 0 || weight > weightTotal) {
            throw new InvalidAnnotationException("canary weight " + weight + " must be between 0 and the weight total " + weightTotal);
        }
        return new CanaryPolicy(true, weight, weightTotal, header, headerValue, headerPattern, cookie);
    }
}
