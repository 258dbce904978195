/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.spi;

import java.util.Objects;

/**
 * A certificate authority written to disk for the proxy to verify peers with.
 *
 * @param secret {@code namespace/name} of the secret holding the authority
 * @param caFileName path of the PEM file holding the authority
 */
public record AuthCertificate(String secret, String caFileName) {
    public AuthCertificate {
        Objects.requireNonNull(secret);
        Objects.requireNonNull(caFileName);
    }
}
