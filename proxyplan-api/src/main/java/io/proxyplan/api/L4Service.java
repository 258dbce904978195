/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.util.List;
import java.util.Objects;

/**
 * A TCP or UDP port exposed by the proxy and forwarded to a service.
 *
 * @param port port the proxy listens on
 * @param backend the service traffic is forwarded to
 * @param endpoints resolved endpoints of the service
 */
public record L4Service(int port, L4Backend backend, List<Endpoint> endpoints) {

    public L4Service {
        Objects.requireNonNull(backend);
        endpoints = List.copyOf(endpoints);
    }

    /**
     * @param namespace namespace of the service
     * @param name name of the service
     * @param port service port, by number or name
     * @param protocol stream protocol
     * @param proxyProtocolDecode true to decode the PROXY protocol on inbound connections
     * @param proxyProtocolEncode true to send the PROXY protocol to the service
     */
    public record L4Backend(String namespace,
                            String name,
                            String port,
                            StreamProtocol protocol,
                            boolean proxyProtocolDecode,
                            boolean proxyProtocolEncode) {
        public L4Backend {
            Objects.requireNonNull(namespace);
            Objects.requireNonNull(name);
            Objects.requireNonNull(port);
            Objects.requireNonNull(protocol);
        }
    }
}
