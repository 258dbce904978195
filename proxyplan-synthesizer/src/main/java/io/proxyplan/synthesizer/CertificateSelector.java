/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.networking.v1.IngressTLS;

import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.SSLCert;
import io.proxyplan.synthesizer.spi.ResourceStore;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Selects the certificate a server presents for a host, using the TLS section of a routing resource.
 * <p>
 * The secret is found by an exact, case-insensitive, match of the host against the TLS hosts,
 * then by scanning every TLS secret of the resource for a certificate whose subject alternative
 * names cover the host. Whenever no usable certificate results, the default certificate is
 * substituted and the lookup is reported as degraded.
 */
class CertificateSelector {

    static final Duration EXPIRY_WARNING_WINDOW = Duration.ofDays(10);

    private final ResourceStore store;
    private final Clock clock;

    CertificateSelector(ResourceStore store, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.clock = Objects.requireNonNull(clock);
    }

    LookupResult<SSLCert> select(String host, RoutingResource resource, @Nullable SSLCert defaultCertificate) {
        String secretName = secretNameFor(host, resource);
        if (secretName == null) {
            return LookupResult.degraded(defaultCertificate,
                    "no TLS secret of " + resource.key() + " covers host " + host + ", using the default certificate");
        }
        String secretKey = resource.namespace() + "/" + secretName;
        Optional<SSLCert> certificate = store.getLocalSSLCert(secretKey);
        if (certificate.isEmpty()) {
            return LookupResult.degraded(defaultCertificate, "TLS secret " + secretKey + " could not be loaded, using the default certificate");
        }
        SSLCert cert = certificate.get();
        if (!cert.hasCertificate()) {
            return LookupResult.degraded(defaultCertificate, "TLS secret " + secretKey + " contains no certificate, using the default certificate");
        }
        if (!cert.verifyHostname(host) && !cert.verifyCommonName(host)) {
            return LookupResult.degraded(defaultCertificate,
                    "certificate of TLS secret " + secretKey + " is not valid for host " + host + ", using the default certificate");
        }
        return LookupResult.found(cert);
    }

    /**
     * @return a description of how the certificate is expiring, empty if it is not expiring soon
     */
    Optional<String> expiryWarning(SSLCert certificate, String host) {
        Instant now = clock.instant();
        if (certificate.expiresBefore(now)) {
            return Optional.of("certificate " + certificate.name() + " for host " + host + " expired at " + certificate.expireTime());
        }
        if (certificate.expiresBefore(now.plus(EXPIRY_WARNING_WINDOW))) {
            return Optional.of("certificate " + certificate.name() + " for host " + host + " expires at " + certificate.expireTime()
                    + ", in less than " + EXPIRY_WARNING_WINDOW.toDays() + " days");
        }
        return Optional.empty();
    }

    @Nullable
    private String secretNameFor(String host, RoutingResource resource) {
        String lowerCaseHost = host.toLowerCase(Locale.ROOT);
        for (IngressTLS tls : resource.tls()) {
            List<String> hosts = Optional.ofNullable(tls.getHosts()).orElse(List.of());
            for (String tlsHost : hosts) {
                if (tlsHost != null && lowerCaseHost.equals(tlsHost.toLowerCase(Locale.ROOT))) {
                    return emptyToNull(tls.getSecretName());
                }
            }
        }
        for (IngressTLS tls : resource.tls()) {
            String secretName = emptyToNull(tls.getSecretName());
            if (secretName != null && store.getLocalSSLCert(resource.namespace() + "/" + secretName)
                    .filter(cert -> cert.verifyHostname(host))
                    .isPresent()) {
                return secretName;
            }
        }
        return null;
    }

    @Nullable
    private static String emptyToNull(@Nullable String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
