/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Service;

import io.proxyplan.api.Backend;
import io.proxyplan.api.Configuration;
import io.proxyplan.api.Endpoint;
import io.proxyplan.api.L4Service;
import io.proxyplan.api.Location;
import io.proxyplan.api.Names;
import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.SSLCert;
import io.proxyplan.api.SSLPassthroughBackend;
import io.proxyplan.api.Server;
import io.proxyplan.api.StreamProtocol;
import io.proxyplan.synthesizer.SynthesisDiagnostic.Kind;
import io.proxyplan.synthesizer.config.ControllerConfig;
import io.proxyplan.synthesizer.spi.StreamServiceResolver;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Turns the merged upstreams and servers into the final, normalised, {@link Configuration}.
 */
class ConfigurationAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationAssembler.class);

    private final ServiceEndpoints serviceEndpoints;
    private final StreamServiceResolver streamServices;

    ConfigurationAssembler(ServiceEndpoints serviceEndpoints, StreamServiceResolver streamServices) {
        this.serviceEndpoints = Objects.requireNonNull(serviceEndpoints);
        this.streamServices = Objects.requireNonNull(streamServices);
    }

    Configuration assemble(List<RoutingResource> resources,
                           Map<String, Backend> upstreams,
                           Map<String, Server> servers,
                           ControllerConfig controller,
                           String backendConfigChecksum,
                           @Nullable SSLCert defaultCertificate,
                           Diagnostics diagnostics) {
        Map<String, Backend> customDefaultBackends = customDefaultBackends(upstreams, servers, diagnostics);
        flagSslPassthrough(upstreams, customDefaultBackends, servers, diagnostics);

        List<Backend> backends = new ArrayList<>(upstreams.values());
        backends.addAll(customDefaultBackends.values());
        backends.sort(Comparator.comparing(Backend::getName));

        List<Server> sortedServers = new ArrayList<>(servers.values());
        sortedServers.sort(Comparator.comparing(Server::getHostname));
        sortedServers.forEach(server -> LocationOrdering.sort(server.getLocations()));

        return new Configuration(backends,
                sortedServers,
                streamServices(controller.tcpServicesConfigMap(), StreamProtocol.TCP),
                streamServices(controller.udpServicesConfigMap(), StreamProtocol.UDP),
                passthroughBackends(sortedServers, diagnostics),
                backendConfigChecksum,
                defaultCertificate,
                streamSnippets(resources));
    }

    /**
     * Creates a backend for every custom default backend service that has endpoints, and points
     * locations whose own backend has no endpoint at it.
     *
     * @return the created backends keyed by name
     */
    private Map<String, Backend> customDefaultBackends(Map<String, Backend> upstreams, Map<String, Server> servers, Diagnostics diagnostics) {
        Map<String, Backend> created = new LinkedHashMap<>();
        for (Server server : servers.values()) {
            for (Location location : server.getLocations()) {
                Service custom = location.getDefaultBackend();
                if (custom == null || Names.DEFAULT_UPSTREAM_NAME.equals(location.getBackend())) {
                    continue;
                }
                Backend upstream = upstreams.get(location.getBackend());
                if (upstream == null) {
                    continue;
                }
                String name = UpstreamNames.customDefaultBackend(custom);
                Backend customBackend = created.get(name);
                if (customBackend == null) {
                    LookupResult<List<Endpoint>> endpoints = serviceEndpoints.ofFirstPort(custom);
                    if (endpoints.isDegraded()) {
                        diagnostics.warn(Kind.CUSTOM_DEFAULT_BACKEND_INVALID, location.getResourceKey(),
                                "Custom default backend of location {} of server {}: {}",
                                location.getPath(), server.getHostname(), endpoints.problem());
                        continue;
                    }
                    customBackend = upstream.copyAs(name);
                    customBackend.setEndpoints(endpoints.value());
                    created.put(name, customBackend);
                }
                location.setDefaultBackendUpstreamName(name);
                if (upstream.getEndpoints().isEmpty()) {
                    LOGGER.debug("Backend {} has no endpoints, routing location {} of server {} to {}", upstream.getName(), location.getPath(),
                            server.getHostname(), name);
                    location.setBackend(name);
                }
            }
        }
        return created;
    }

    private static void flagSslPassthrough(Map<String, Backend> upstreams, Map<String, Backend> customDefaultBackends, Map<String, Server> servers,
                                           Diagnostics diagnostics) {
        for (Server server : servers.values()) {
            if (!server.isSslPassthrough()) {
                continue;
            }
            server.rootLocation().ifPresent(root -> {
                if (Names.DEFAULT_UPSTREAM_NAME.equals(root.getBackend())) {
                    diagnostics.warn(Kind.SSL_PASSTHROUGH_IGNORED, root.getResourceKey(),
                            "Server {} requests SSL passthrough but its root location has no backend",
                            server.getHostname());
                    return;
                }
                Backend backend = upstreams.getOrDefault(root.getBackend(), customDefaultBackends.get(root.getBackend()));
                if (backend != null) {
                    backend.setSslPassthrough(true);
                }
            });
        }
    }

    private static List<SSLPassthroughBackend> passthroughBackends(List<Server> servers, Diagnostics diagnostics) {
        List<SSLPassthroughBackend> passthrough = new ArrayList<>();
        for (Server server : servers) {
            if (!server.isSslPassthrough()) {
                continue;
            }
            for (Location location : server.getLocations()) {
                if (!Names.ROOT_LOCATION.equals(location.getPath())) {
                    diagnostics.warn(Kind.SSL_PASSTHROUGH_IGNORED, location.getResourceKey(),
                            "Ignoring SSL passthrough for location {} of server {}, only the root location is passed through",
                            location.getPath(), server.getHostname());
                    continue;
                }
                if (!Names.DEFAULT_UPSTREAM_NAME.equals(location.getBackend())) {
                    Service service = location.getService();
                    passthrough.add(new SSLPassthroughBackend(location.getBackend(),
                            server.getHostname(),
                            service == null ? null : service.getMetadata().getName(),
                            location.getPort()));
                }
                break;
            }
        }
        return passthrough;
    }

    private List<L4Service> streamServices(@Nullable String configMap, StreamProtocol protocol) {
        if (configMap == null || configMap.isEmpty()) {
            return List.of();
        }
        return streamServices.resolve(configMap, protocol);
    }

    private static List<String> streamSnippets(List<RoutingResource> resources) {
        return resources.stream()
                .map(resource -> resource.parsedAnnotations().streamSnippet())
                .filter(snippet -> snippet != null && !snippet.isEmpty())
                .toList();
    }
}
