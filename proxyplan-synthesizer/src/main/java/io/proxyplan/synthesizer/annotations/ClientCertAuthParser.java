/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.proxyplan.api.policy.ClientCertAuthPolicy;
import io.proxyplan.synthesizer.spi.AuthCertificate;
import io.proxyplan.synthesizer.spi.ResourceStore;

/**
 * Reads the {@code auth-tls-*} annotations configuring client certificate authentication.
 */
public class ClientCertAuthParser implements AnnotationParser<ClientCertAuthPolicy> {

    static final String DEFAULT_VERIFY_CLIENT = "on";
    static final int DEFAULT_VERIFY_DEPTH = 1;

    private static final Set<String> VERIFY_CLIENT_MODES = Set.of(DEFAULT_VERIFY_CLIENT, "off", "optional", "optional_no_ca");

    private final AnnotationReader reader;
    private final ResourceStore store;

    public ClientCertAuthParser(AnnotationReader reader, ResourceStore store) {
        this.reader = Objects.requireNonNull(reader);
        this.store = Objects.requireNonNull(store);
    }

    @Override
    public ClientCertAuthPolicy parse(HasMetadata resource) {
        Optional<String> secretName = reader.string(resource, "auth-tls-secret");
        if (secretName.isEmpty()) {
            return ClientCertAuthPolicy.NONE;
        }
        String secretKey = ResourceKeys.qualify(secretName.get(), resource);
        AuthCertificate certificate = store.getAuthCertificate(secretKey)
                .orElseThrow(() -> new LocationDeniedException("error obtaining certificate from secret " + secretKey));

        String verifyClient = reader.string(resource, "auth-tls-verify-client")
                .filter(VERIFY_CLIENT_MODES::contains)
                .orElse(DEFAULT_VERIFY_CLIENT);
        int depth = reader.integer(resource, "auth-tls-verify-depth")
                .filter(d -> d > 0)
                .orElse(DEFAULT_VERIFY_DEPTH);
        return new ClientCertAuthPolicy(secretKey, certificate.caFileName(), verifyClient, depth,
                reader.string(resource, "auth-tls-error-page").orElse(null), null);
    }
}
