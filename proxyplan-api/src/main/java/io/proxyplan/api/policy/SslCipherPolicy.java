/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param ciphers enabled TLS ciphers of a server
 * @param preferServerCiphers {@code on} or {@code off}
 */
public record SslCipherPolicy(@Nullable String ciphers,
                              @Nullable String preferServerCiphers) {

    public static final SslCipherPolicy NONE = new SslCipherPolicy(null, null);
}
