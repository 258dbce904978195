/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.nio.charset.StandardCharsets;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.security.auth.x500.X500Principal;

import com.fasterxml.jackson.annotation.JsonIgnore;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A TLS certificate held in a secret, reduced to what synthesis needs to select it for a host.
 *
 * @param name namespaced key of the secret the certificate was loaded from
 * @param pemCertificate the PEM encoded certificate, absent if the secret holds no certificate
 * @param commonName the subject common name
 * @param dnsNames the DNS and IP subject alternative names
 * @param expireTime the end of the certificate's validity
 */
public record SSLCert(String name,
                      @JsonIgnore @Nullable String pemCertificate,
                      @Nullable String commonName,
                      List<String> dnsNames,
                      Instant expireTime) {

    private static final int SAN_DNS_NAME = 2;
    private static final int SAN_IP_ADDRESS = 7;

    public SSLCert {
        Objects.requireNonNull(name);
        dnsNames = List.copyOf(dnsNames);
        Objects.requireNonNull(expireTime);
    }

    /**
     * Reads the names and validity of an X.509 certificate.
     * @param name namespaced key of the secret holding the certificate
     * @param certificate the certificate
     * @return the certificate
     * @throws IllegalArgumentException if the certificate cannot be encoded or its names cannot be parsed
     */
    public static SSLCert fromX509(String name, X509Certificate certificate) {
        try {
            String pem = "-----BEGIN CERTIFICATE-----\n"
                    + Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(certificate.getEncoded())
                    + "\n-----END CERTIFICATE-----\n";
            return new SSLCert(name, pem, commonNameOf(certificate.getSubjectX500Principal()), subjectAlternativeNamesOf(certificate),
                    certificate.getNotAfter().toInstant());
        }
        catch (CertificateEncodingException | CertificateParsingException | InvalidNameException e) {
            throw new IllegalArgumentException("Failed to read certificate " + name, e);
        }
    }

    private static @Nullable String commonNameOf(X500Principal subject) throws InvalidNameException {
        for (Rdn rdn : new LdapName(subject.getName(X500Principal.RFC2253)).getRdns()) {
            if ("CN".equalsIgnoreCase(rdn.getType())) {
                return rdn.getValue().toString();
            }
        }
        return null;
    }

    private static List<String> subjectAlternativeNamesOf(X509Certificate certificate) throws CertificateParsingException {
        Collection<List<?>> alternativeNames = certificate.getSubjectAlternativeNames();
        if (alternativeNames == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (List<?> entry : alternativeNames) {
            if (entry.size() >= 2 && entry.get(0) instanceof Integer type && (type == SAN_DNS_NAME || type == SAN_IP_ADDRESS)) {
                names.add(String.valueOf(entry.get(1)));
            }
        }
        return names;
    }

    /**
     * @return true if the secret actually carried a certificate
     */
    public boolean hasCertificate() {
        return pemCertificate != null && !pemCertificate.isBlank();
    }

    /**
     * Checks the host against the subject alternative names of the certificate.
     * A wildcard is only accepted as the complete left-most label and matches exactly one label.
     * @param host host name
     * @return true if a subject alternative name covers the host
     */
    public boolean verifyHostname(String host) {
        return dnsNames.stream().anyMatch(pattern -> matchesHostname(pattern, host));
    }

    /**
     * Checks the host against the subject common name of the certificate.
     * @param host host name
     * @return true if the common name covers the host
     */
    public boolean verifyCommonName(String host) {
        return commonName != null && matchesHostname(commonName, host);
    }

    /**
     * @return true if the certificate expires before {@code instant}
     */
    public boolean expiresBefore(Instant instant) {
        return expireTime.isBefore(instant);
    }

    static boolean matchesHostname(String pattern, String host) {
        String normalizedPattern = trimTrailingDot(pattern.toLowerCase(Locale.ROOT));
        String normalizedHost = trimTrailingDot(host.toLowerCase(Locale.ROOT));
        if (normalizedPattern.isEmpty() || normalizedHost.isEmpty()) {
            return false;
        }
        String[] patternLabels = normalizedPattern.split("\\.", -1);
        String[] hostLabels = normalizedHost.split("\\.", -1);
        if (patternLabels.length != hostLabels.length) {
            return false;
        }
        for (int i = 0; i < patternLabels.length; i++) {
            if (i == 0 && "*".equals(patternLabels[i])) {
                continue;
            }
            if (!patternLabels[i].equals(hostLabels[i])) {
                return false;
            }
        }
        return true;
    }

    private static String trimTrailingDot(String value) {
        return value.endsWith(".") ? value.substring(0, value.length() - 1) : value;
    }
}
