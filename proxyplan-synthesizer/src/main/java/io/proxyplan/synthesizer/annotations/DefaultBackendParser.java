/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Service;

import io.proxyplan.synthesizer.spi.ResourceStore;

/**
 * Reads the {@code default-backend} annotation naming a service, in the resource's namespace, that serves
 * requests when the backend of a location has no endpoints.
 */
public class DefaultBackendParser implements AnnotationParser<Optional<Service>> {

    private final AnnotationReader reader;
    private final ResourceStore store;

    public DefaultBackendParser(AnnotationReader reader, ResourceStore store) {
        this.reader = Objects.requireNonNull(reader);
        this.store = Objects.requireNonNull(store);
    }

    @Override
    public Optional<Service> parse(HasMetadata resource) {
        Optional<String> serviceName = reader.string(resource, "default-backend");
        if (serviceName.isEmpty()) {
            return Optional.empty();
        }
        String key = resource.getMetadata().getNamespace() + "/" + serviceName.get();
        return Optional.of(store.getService(key)
                .orElseThrow(() -> new InvalidAnnotationException("unexpected error reading service " + key)));
    }
}
