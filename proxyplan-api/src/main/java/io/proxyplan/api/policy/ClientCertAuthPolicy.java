/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Mutual TLS authentication of clients connecting to a server.
 *
 * @param secret namespaced key of the secret holding the trusted CA
 * @param caFileName file the CA bundle is written to, absent when the secret has no {@code ca.crt}
 * @param verifyClient the verification mode ({@code on}, {@code off}, {@code optional}, {@code optional_no_ca})
 * @param validationDepth maximum depth of the client certificate chain
 * @param errorPage URL clients are redirected to when verification fails
 * @param authTlsError why the authentication could not be configured, absent when it could
 */
public record ClientCertAuthPolicy(@Nullable String secret,
                                   @Nullable String caFileName,
                                   @Nullable String verifyClient,
                                   int validationDepth,
                                   @Nullable String errorPage,
                                   @Nullable String authTlsError) {

    public static final ClientCertAuthPolicy NONE = new ClientCertAuthPolicy(null, null, null, 0, null, null);

    /**
     * @return a policy recording that client authentication was requested but could not be configured
     */
    public static ClientCertAuthPolicy failed(String authTlsError) {
        return new ClientCertAuthPolicy(null, null, null, 0, null, authTlsError);
    }

    public boolean isConfigured() {
        return caFileName != null && !caFileName.isEmpty();
    }
}
