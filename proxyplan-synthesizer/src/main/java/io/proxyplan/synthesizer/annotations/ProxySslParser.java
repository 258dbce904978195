/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.proxyplan.api.policy.ProxySslPolicy;
import io.proxyplan.synthesizer.spi.AuthCertificate;
import io.proxyplan.synthesizer.spi.ResourceStore;

/**
 * Reads the {@code proxy-ssl-*} annotations configuring TLS towards the backend.
 */
public class ProxySslParser implements AnnotationParser<ProxySslPolicy> {

    static final String DEFAULT_CIPHERS = "DEFAULT";
    static final String DEFAULT_PROTOCOLS = "TLSv1 TLSv1.1 TLSv1.2";

    private static final Set<String> PROTOCOLS = Set.of("SSLv2", "SSLv3", "TLSv1", "TLSv1.1", "TLSv1.2", "TLSv1.3");

    private final AnnotationReader reader;
    private final ResourceStore store;

    public ProxySslParser(AnnotationReader reader, ResourceStore store) {
        this.reader = Objects.requireNonNull(reader);
        this.store = Objects.requireNonNull(store);
    }

    @Override
    public ProxySslPolicy parse(HasMetadata resource) {
        Optional<String> secretName = reader.string(resource, "proxy-ssl-secret");
        if (secretName.isEmpty()) {
            return ProxySslPolicy.NONE;
        }
        String secretKey = ResourceKeys.qualify(secretName.get(), resource);
        AuthCertificate certificate = store.getAuthCertificate(secretKey)
                .orElseThrow(() -> new LocationDeniedException("error obtaining certificate from secret " + secretKey));

        String protocols = reader.string(resource, "proxy-ssl-protocols")
                .filter(value -> Arrays.stream(value.split("\\s+")).allMatch(PROTOCOLS::contains))
                .orElse(DEFAULT_PROTOCOLS);
        boolean verify = reader.string(resource, "proxy-ssl-verify")
                .map("on"::equals)
                .orElse(false);
        return new ProxySslPolicy(secretKey, certificate.caFileName(),
                reader.string(resource, "proxy-ssl-ciphers").orElse(DEFAULT_CIPHERS),
                protocols,
                verify);
    }
}
