/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.spi;

import java.util.List;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;

import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.SSLCert;
import io.proxyplan.synthesizer.config.BackendConfiguration;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Read access to the locally cached cluster state. Implementations are expected to answer
 * from memory; the synthesizer calls them synchronously while building a configuration.
 * Keys are of the form {@code namespace/name}.
 */
public interface ResourceStore {

    /**
     * @return every routing resource currently known, each with its extracted annotations
     */
    List<RoutingResource> listRoutingResources();

    Optional<Service> getService(String key);

    Optional<Secret> getSecret(String key);

    /**
     * @return the certificate held by the TLS secret {@code key}
     */
    Optional<SSLCert> getLocalSSLCert(String key);

    /**
     * @return the certificate authority held by the secret {@code key}, used to verify client or backend certificates
     */
    Optional<AuthCertificate> getAuthCertificate(String key);

    BackendConfiguration getBackendConfiguration();

    /**
     * @return the certificate served by hosts without a certificate of their own, if any
     */
    @Nullable
    SSLCert getDefaultSSLCertificate();
}
