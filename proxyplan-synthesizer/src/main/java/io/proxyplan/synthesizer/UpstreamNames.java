/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.networking.v1.IngressServiceBackend;
import io.fabric8.kubernetes.api.model.networking.v1.ServiceBackendPort;

import io.proxyplan.api.Names;

/**
 * Deterministic names of backends and the services behind them.
 */
public final class UpstreamNames {

    private UpstreamNames() {
    }

    /**
     * @return the identity key of the backend for {@code service} in {@code namespace}, {@code <namespace>-<service>-<port>}
     */
    public static String of(String namespace, IngressServiceBackend service) {
        return namespace + "-" + service.getName() + "-" + port(service);
    }

    /**
     * @return the port number of the reference when it has one, otherwise the port name
     */
    public static String port(IngressServiceBackend service) {
        ServiceBackendPort port = service.getPort();
        if (port == null) {
            return "";
        }
        if (port.getNumber() != null && port.getNumber() > 0) {
            return String.valueOf(port.getNumber());
        }
        return port.getName() == null ? "" : port.getName();
    }

    public static String serviceKey(String namespace, String name) {
        return namespace + "/" + name;
    }

    /**
     * @return the name of the backend synthesised from a location's custom default backend service
     */
    public static String customDefaultBackend(HasMetadata service) {
        return Names.CUSTOM_DEFAULT_BACKEND_PREFIX + service.getMetadata().getNamespace() + "-" + service.getMetadata().getName();
    }
}
