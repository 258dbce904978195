/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.List;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;

import io.proxyplan.api.Endpoint;
import io.proxyplan.synthesizer.spi.EndpointResolutionException;
import io.proxyplan.synthesizer.spi.EndpointResolver;

/**
 * Resolves the endpoints behind the first port of a service, as used for the default backend
 * and for custom default backends.
 */
class ServiceEndpoints {

    private final EndpointResolver resolver;

    ServiceEndpoints(EndpointResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver);
    }

    LookupResult<List<Endpoint>> ofFirstPort(Service service) {
        String serviceKey = UpstreamNames.serviceKey(service.getMetadata().getNamespace(), service.getMetadata().getName());
        List<ServicePort> ports = service.getSpec() == null ? null : service.getSpec().getPorts();
        if (ports == null || ports.isEmpty()) {
            return LookupResult.degraded(List.of(), "service " + serviceKey + " does not expose any port");
        }
        String port = String.valueOf(ports.get(0).getPort());
        try {
            List<Endpoint> endpoints = resolver.resolveEndpoints(serviceKey, port);
            if (endpoints.isEmpty()) {
                return LookupResult.degraded(List.of(), "service " + serviceKey + " does not have any active endpoints");
            }
            return LookupResult.found(List.copyOf(endpoints));
        }
        catch (EndpointResolutionException e) {
            return LookupResult.degraded(List.of(), "endpoints of service " + serviceKey + " could not be resolved: " + e.getMessage());
        }
    }
}
