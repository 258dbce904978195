/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.proxyplan.api.policy.UpstreamHashByPolicy;

public class UpstreamHashByParser implements AnnotationParser<UpstreamHashByPolicy> {

    private final AnnotationReader reader;

    public UpstreamHashByParser(AnnotationReader reader) {
        this.reader = Objects.requireNonNull(reader);
    }

    @Override
    public UpstreamHashByPolicy parse(HasMetadata resource) {
        Optional<String> hashBy = reader.string(resource, "upstream-hash-by");
        if (hashBy.isEmpty()) {
            return UpstreamHashByPolicy.NONE;
        }
        int subsetSize = reader.integer(resource, "upstream-hash-by-subset-size")
                .filter(size -> size > 0)
                .orElse(UpstreamHashByPolicy.DEFAULT_SUBSET_SIZE);
        return new UpstreamHashByPolicy(hashBy.get(), reader.bool(resource, "upstream-hash-by-subset").orElse(false), subsetSize);
    }
}
