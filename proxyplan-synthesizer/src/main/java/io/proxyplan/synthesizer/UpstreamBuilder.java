/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPath;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRule;
import io.fabric8.kubernetes.api.model.networking.v1.IngressServiceBackend;

import io.proxyplan.api.Backend;
import io.proxyplan.api.Endpoint;
import io.proxyplan.api.Names;
import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.TrafficShapingPolicy;
import io.proxyplan.api.policy.AnnotationBundle;
import io.proxyplan.synthesizer.SynthesisDiagnostic.Kind;
import io.proxyplan.synthesizer.config.BackendConfiguration;
import io.proxyplan.synthesizer.spi.EndpointResolutionException;
import io.proxyplan.synthesizer.spi.EndpointResolver;
import io.proxyplan.synthesizer.spi.ResourceStore;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Builds one backend per distinct service reference of the routing resources.
 * The first resource to reference a service determines how its backend is populated.
 */
class UpstreamBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(UpstreamBuilder.class);

    static final Endpoint LOCAL_DEFAULT_ENDPOINT = new Endpoint("127.0.0.1", 8181);

    private final ResourceStore store;
    private final EndpointResolver endpointResolver;
    private final ServiceEndpoints serviceEndpoints;

    UpstreamBuilder(ResourceStore store, EndpointResolver endpointResolver) {
        this.store = Objects.requireNonNull(store);
        this.endpointResolver = Objects.requireNonNull(endpointResolver);
        this.serviceEndpoints = new ServiceEndpoints(endpointResolver);
    }

    /**
     * Builds the backend serving requests that match nothing else.
     * @param defaultBackendService key of the default backend service, if one is configured
     */
    Backend buildDefaultUpstream(@Nullable String defaultBackendService, Diagnostics diagnostics) {
        var upstream = new Backend(Names.DEFAULT_UPSTREAM_NAME);
        if (defaultBackendService == null || defaultBackendService.isEmpty()) {
            upstream.setEndpoints(List.of(LOCAL_DEFAULT_ENDPOINT));
            return upstream;
        }
        Optional<Service> service = store.getService(defaultBackendService);
        if (service.isEmpty()) {
            diagnostics.warn(Kind.SERVICE_NOT_FOUND, null, "Default backend service {} not found, using the local default endpoint",
                    defaultBackendService);
            upstream.setEndpoints(List.of(LOCAL_DEFAULT_ENDPOINT));
            return upstream;
        }
        upstream.setService(service.get());
        LookupResult<List<Endpoint>> endpoints = serviceEndpoints.ofFirstPort(service.get());
        if (endpoints.isDegraded()) {
            diagnostics.warn(Kind.ENDPOINTS_UNRESOLVED, null, "Default backend: {}, using the local default endpoint", endpoints.problem());
            upstream.setEndpoints(List.of(LOCAL_DEFAULT_ENDPOINT));
        }
        else {
            upstream.setEndpoints(endpoints.value());
        }
        return upstream;
    }

    /**
     * @return the backends keyed by name, the default upstream first
     */
    Map<String, Backend> build(List<RoutingResource> resources, Backend defaultUpstream, BackendConfiguration cluster, Diagnostics diagnostics) {
        Map<String, Backend> upstreams = new LinkedHashMap<>();
        upstreams.put(defaultUpstream.getName(), defaultUpstream);
        for (RoutingResource resource : resources) {
            resource.defaultBackend()
                    .map(Rules::service)
                    .ifPresent(service -> addUpstream(upstreams, resource, service, cluster, diagnostics));
            for (IngressRule rule : resource.rules()) {
                for (HTTPIngressPath path : Rules.paths(rule)) {
                    IngressServiceBackend service = Rules.service(path.getBackend());
                    if (service != null) {
                        addUpstream(upstreams, resource, service, cluster, diagnostics);
                    }
                }
            }
        }
        return upstreams;
    }

    private void addUpstream(Map<String, Backend> upstreams, RoutingResource resource, IngressServiceBackend service, BackendConfiguration cluster,
                             Diagnostics diagnostics) {
        String name = UpstreamNames.of(resource.namespace(), service);
        if (upstreams.containsKey(name)) {
            return;
        }
        LOGGER.debug("Creating upstream {} for {}", name, resource.key());
        AnnotationBundle annotations = resource.parsedAnnotations();
        String port = UpstreamNames.port(service);
        var upstream = new Backend(name);
        upstream.setPort(port);
        upstream.setUpstreamHashBy(annotations.upstreamHashBy());
        upstream.setLoadBalancing(annotations.loadBalancing() != null ? annotations.loadBalancing() : cluster.loadBalancing());
        if (annotations.canary().enabled()) {
            upstream.setNoServer(true);
            upstream.setTrafficShapingPolicy(TrafficShapingPolicy.from(annotations.canary()));
        }

        String serviceKey = UpstreamNames.serviceKey(resource.namespace(), service.getName());
        try {
            if (annotations.serviceUpstream()) {
                upstream.setEndpoints(List.of(endpointResolver.resolveClusterEndpoint(serviceKey, service)));
            }
            else {
                upstream.setEndpoints(endpointResolver.resolveEndpoints(serviceKey, port));
            }
        }
        catch (EndpointResolutionException e) {
            diagnostics.warn(Kind.ENDPOINTS_UNRESOLVED, resource.key(), "Endpoints of upstream {} could not be resolved: {}", name, e.getMessage());
        }

        Optional<Service> backingService = store.getService(serviceKey);
        if (backingService.isPresent()) {
            upstream.setService(backingService.get());
        }
        else {
            diagnostics.warn(Kind.SERVICE_NOT_FOUND, resource.key(), "Service {} of upstream {} not found", serviceKey, name);
        }
        upstreams.put(name, upstream);
    }
}
