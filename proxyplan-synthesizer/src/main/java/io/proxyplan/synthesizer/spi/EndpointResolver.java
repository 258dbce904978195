/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.spi;

import java.util.List;

import io.fabric8.kubernetes.api.model.networking.v1.IngressServiceBackend;

import io.proxyplan.api.Endpoint;

/**
 * Resolves the network endpoints behind a service.
 */
public interface EndpointResolver {

    /**
     * @param serviceKey {@code namespace/name} of the service
     * @param port number or name of the service port
     * @return the ready endpoints of the service for that port, possibly empty
     * @throws EndpointResolutionException if the service or its port is unknown
     */
    List<Endpoint> resolveEndpoints(String serviceKey, String port) throws EndpointResolutionException;

    /**
     * @param serviceKey {@code namespace/name} of the service
     * @param backend the reference to the service from a routing resource
     * @return the single endpoint at the service's cluster address
     * @throws EndpointResolutionException if the service has no cluster address
     */
    Endpoint resolveClusterEndpoint(String serviceKey, IngressServiceBackend backend) throws EndpointResolutionException;
}
