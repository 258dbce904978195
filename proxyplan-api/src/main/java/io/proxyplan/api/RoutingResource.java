/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBackend;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRule;
import io.fabric8.kubernetes.api.model.networking.v1.IngressSpec;
import io.fabric8.kubernetes.api.model.networking.v1.IngressTLS;

import io.proxyplan.api.policy.AnnotationBundle;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A declarative routing resource, paired with the policies already extracted from its annotations.
 * The resource is treated as immutable for the duration of a synthesis pass.
 *
 * @param ingress the resource
 * @param parsedAnnotations the typed policies of the resource
 */
public record RoutingResource(Ingress ingress, AnnotationBundle parsedAnnotations) {

    public RoutingResource {
        Objects.requireNonNull(ingress);
        Objects.requireNonNull(ingress.getMetadata(), "routing resource must have metadata");
        Objects.requireNonNull(parsedAnnotations);
    }

    /**
     * @return the identity of a resource, {@code namespace/name}
     */
    public static String keyOf(HasMetadata resource) {
        ObjectMeta metadata = resource.getMetadata();
        return metadata.getNamespace() + "/" + metadata.getName();
    }

    public String key() {
        return keyOf(ingress);
    }

    public String namespace() {
        return ingress.getMetadata().getNamespace();
    }

    public String name() {
        return ingress.getMetadata().getName();
    }

    public Map<String, String> annotations() {
        return Optional.ofNullable(ingress.getMetadata().getAnnotations()).orElse(Map.of());
    }

    public List<IngressRule> rules() {
        return spec().map(IngressSpec::getRules).orElse(List.of());
    }

    public List<IngressTLS> tls() {
        return spec().map(IngressSpec::getTls).orElse(List.of());
    }

    /**
     * @return the resource's default backend when it references a service
     */
    public Optional<IngressBackend> defaultBackend() {
        return spec().map(IngressSpec::getDefaultBackend).filter(backend -> backend.getService() != null);
    }

    public boolean isMarkedForDeletion() {
        String deletionTimestamp = ingress.getMetadata().getDeletionTimestamp();
        return deletionTimestamp != null && !deletionTimestamp.isEmpty();
    }

    public boolean isCanary() {
        return parsedAnnotations.canary().enabled();
    }

    /**
     * @return true if this resource and {@code other} have the same identity
     */
    public boolean isSameResourceAs(@Nullable HasMetadata other) {
        return other != null
                && Objects.equals(namespace(), other.getMetadata().getNamespace())
                && Objects.equals(name(), other.getMetadata().getName());
    }

    private Optional<IngressSpec> spec() {
        return Optional.ofNullable(ingress.getSpec());
    }
}
