/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A host whose TLS connections are forwarded to a backend without being terminated by the proxy.
 *
 * @param backend name of the backend receiving the connections
 * @param hostname the server name (SNI) of the connections
 * @param service name of the service behind the backend
 * @param port service port
 */
public record SSLPassthroughBackend(String backend,
                                   String hostname,
                                   @Nullable String service,
                                   @Nullable String port) {

    public SSLPassthroughBackend {
        Objects.requireNonNull(backend);
        Objects.requireNonNull(hostname);
    }
}
