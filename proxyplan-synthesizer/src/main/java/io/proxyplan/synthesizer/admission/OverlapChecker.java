/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.admission;

import java.util.LinkedHashSet;
import java.util.Set;

import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPath;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRule;

import io.proxyplan.api.Configuration;
import io.proxyplan.api.Location;
import io.proxyplan.api.Names;
import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.Server;

/**
 * Detects host and path pairs of a candidate resource that a synthesised configuration already
 * serves from another resource. Only primary resources own locations, so a host and path may be
 * shared with a canary candidate and conflicts for any other candidate.
 */
class OverlapChecker {

    void check(RoutingResource candidate, Configuration configuration) throws OverlapConflictException {
        for (IngressRule rule : candidate.rules()) {
            String host = rule.getHost() == null || rule.getHost().isEmpty() ? Names.CATCH_ALL_SERVER_NAME : rule.getHost();
            if (rule.getHttp() == null || rule.getHttp().getPaths() == null) {
                continue;
            }
            for (HTTPIngressPath path : rule.getHttp().getPaths()) {
                if (path.getBackend() == null || path.getBackend().getService() == null) {
                    continue;
                }
                String nginxPath = path.getPath() == null || path.getPath().isEmpty() ? Names.ROOT_LOCATION : path.getPath();
                Set<RoutingResource> existing = resourcesServing(configuration, host, nginxPath);
                if (existing.stream().anyMatch(resource -> resource.isSameResourceAs(candidate.ingress()))) {
                    continue;
                }
                if (!existing.isEmpty() && !candidate.isCanary()) {
                    RoutingResource other = existing.iterator().next();
                    throw new OverlapConflictException(
                            "host \"" + host + "\" and path \"" + nginxPath + "\" is already defined in resource " + other.key(), other.key());
                }
            }
        }
    }

    private static Set<RoutingResource> resourcesServing(Configuration configuration, String host, String path) {
        Set<RoutingResource> resources = new LinkedHashSet<>();
        for (Server server : configuration.servers()) {
            if (!server.getHostname().equals(host)) {
                continue;
            }
            for (Location location : server.getLocations()) {
                if (location.getPath().equals(path) && !location.isDefBackend() && location.getResource() != null) {
                    resources.add(location.getResource());
                }
            }
        }
        return resources;
    }
}
