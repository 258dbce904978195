/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * TLS used by the proxy when connecting to a backend.
 *
 * @param secret namespaced key of the secret holding the client certificate and trusted CA
 * @param caFileName file the CA bundle is written to, absent when the secret has no {@code ca.crt}
 * @param ciphers enabled ciphers
 * @param protocols enabled protocols
 * @param verify true to verify the backend certificate
 */
public record ProxySslPolicy(@Nullable String secret,
                             @Nullable String caFileName,
                             @Nullable String ciphers,
                             @Nullable String protocols,
                             boolean verify) {

    public static final ProxySslPolicy NONE = new ProxySslPolicy(null, null, null, null, false);

    public boolean isConfigured() {
        return caFileName != null && !caFileName.isEmpty();
    }
}
