/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;

import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.SSLCert;
import io.proxyplan.synthesizer.config.BackendConfiguration;
import io.proxyplan.synthesizer.spi.AuthCertificate;
import io.proxyplan.synthesizer.spi.ResourceStore;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A resource store backed by maps, populated directly by tests.
 */
public class InMemoryResourceStore implements ResourceStore {

    private final List<RoutingResource> resources = new ArrayList<>();
    private final Map<String, Service> services = new HashMap<>();
    private final Map<String, Secret> secrets = new HashMap<>();
    private final Map<String, SSLCert> certificates = new HashMap<>();
    private final Map<String, AuthCertificate> authCertificates = new HashMap<>();
    private BackendConfiguration backendConfiguration = BackendConfiguration.DEFAULT;
    private @Nullable SSLCert defaultCertificate;

    public InMemoryResourceStore withResources(RoutingResource... added) {
        resources.addAll(List.of(added));
        return this;
    }

    public InMemoryResourceStore withServices(Service... added) {
        for (Service service : added) {
            services.put(service.getMetadata().getNamespace() + "/" + service.getMetadata().getName(), service);
        }
        return this;
    }

    public InMemoryResourceStore withSecret(String key, Secret secret) {
        secrets.put(key, secret);
        return this;
    }

    public InMemoryResourceStore withCertificate(String key, SSLCert certificate) {
        certificates.put(key, certificate);
        return this;
    }

    public InMemoryResourceStore withAuthCertificate(String key, AuthCertificate certificate) {
        authCertificates.put(key, certificate);
        return this;
    }

    public InMemoryResourceStore withBackendConfiguration(BackendConfiguration configuration) {
        this.backendConfiguration = configuration;
        return this;
    }

    public InMemoryResourceStore withDefaultCertificate(@Nullable SSLCert certificate) {
        this.defaultCertificate = certificate;
        return this;
    }

    @Override
    public List<RoutingResource> listRoutingResources() {
        return List.copyOf(resources);
    }

    @Override
    public Optional<Service> getService(String key) {
        return Optional.ofNullable(services.get(key));
    }

    @Override
    public Optional<Secret> getSecret(String key) {
        return Optional.ofNullable(secrets.get(key));
    }

    @Override
    public Optional<SSLCert> getLocalSSLCert(String key) {
        return Optional.ofNullable(certificates.get(key));
    }

    @Override
    public Optional<AuthCertificate> getAuthCertificate(String key) {
        return Optional.ofNullable(authCertificates.get(key));
    }

    @Override
    public BackendConfiguration getBackendConfiguration() {
        return backendConfiguration;
    }

    @Override
    public @Nullable SSLCert getDefaultSSLCertificate() {
        return defaultCertificate;
    }
}
