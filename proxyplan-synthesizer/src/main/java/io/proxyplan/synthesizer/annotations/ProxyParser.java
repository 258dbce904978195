/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Objects;
import java.util.function.Supplier;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.proxyplan.api.policy.ProxyPolicy;

/**
 * Reads the {@code proxy-*} annotations. Settings a resource does not annotate keep the cluster-wide defaults.
 */
public class ProxyParser implements AnnotationParser<ProxyPolicy> {

    private final AnnotationReader reader;
    private final Supplier<ProxyPolicy> defaults;

    public ProxyParser(AnnotationReader reader, Supplier<ProxyPolicy> defaults) {
        this.reader = Objects.requireNonNull(reader);
        this.defaults = Objects.requireNonNull(defaults);
    }

    @Override
    public ProxyPolicy parse(HasMetadata resource) {
        ProxyPolicy cluster = defaults.get();
        return new ProxyPolicy(
                reader.string(resource, "proxy-body-size").orElse(cluster.bodySize()),
                reader.integer(resource, "proxy-connect-timeout").orElse(cluster.connectTimeout()),
                reader.integer(resource, "proxy-send-timeout").orElse(cluster.sendTimeout()),
                reader.integer(resource, "proxy-read-timeout").orElse(cluster.readTimeout()),
                reader.string(resource, "proxy-buffer-size").orElse(cluster.bufferSize()),
                reader.string(resource, "proxy-next-upstream").orElse(cluster.nextUpstream()),
                reader.string(resource, "proxy-request-buffering").orElse(cluster.requestBuffering()));
    }
}
