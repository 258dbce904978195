/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPath;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRule;
import io.fabric8.kubernetes.api.model.networking.v1.IngressServiceBackend;

import io.proxyplan.api.Backend;
import io.proxyplan.api.Location;
import io.proxyplan.api.Names;
import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.Server;
import io.proxyplan.synthesizer.SynthesisDiagnostic.Kind;
import io.proxyplan.tag.VisibleForTesting;

/**
 * Folds the backends of canary resources into the alternative backends of the primary backends
 * serving the same location. A canary backend that found no primary anywhere in the pass is
 * removed from the upstreams.
 */
class CanaryMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(CanaryMerger.class);

    private enum Outcome {
        MERGED,
        SELF_REFERENCE,
        NO_MATCH
    }

    void merge(List<RoutingResource> resources, Map<String, Backend> upstreams, Map<String, Server> servers, Diagnostics diagnostics) {
        List<RoutingResource> canaries = resources.stream().filter(RoutingResource::isCanary).toList();
        if (canaries.isEmpty()) {
            return;
        }
        Set<String> candidates = new LinkedHashSet<>();
        Set<String> retained = new HashSet<>();
        boolean primariesExist = canaries.size() < resources.size();

        for (RoutingResource canary : canaries) {
            IngressServiceBackend defaultService = canary.defaultBackend().map(Rules::service).orElse(null);
            if (defaultService != null) {
                Server catchAll = servers.get(Names.CATCH_ALL_SERVER_NAME);
                mergeOne(canary, UpstreamNames.of(canary.namespace(), defaultService), catchAll, location -> true, primariesExist, upstreams, candidates,
                        retained, diagnostics);
            }
            for (IngressRule rule : canary.rules()) {
                String host = Rules.host(rule);
                for (HTTPIngressPath path : Rules.paths(rule)) {
                    IngressServiceBackend service = Rules.service(path.getBackend());
                    if (service == null) {
                        continue;
                    }
                    String altName = UpstreamNames.of(canary.namespace(), service);
                    Server server = servers.get(host);
                    if (server == null) {
                        diagnostics.warn(Kind.SERVER_NOT_FOUND, canary.key(), "Server {} of canary backend {} does not exist", host, altName);
                        candidates.add(altName);
                        continue;
                    }
                    String nginxPath = Rules.path(path);
                    String pathType = path.getPathType();
                    mergeOne(canary, altName, server, location -> location.hasKey(nginxPath, pathType), primariesExist, upstreams, candidates, retained,
                            diagnostics);
                }
            }
        }

        candidates.removeAll(retained);
        for (String orphan : candidates) {
            Backend backend = upstreams.get(orphan);
            if (backend != null && backend.isNoServer()) {
                upstreams.remove(orphan);
                diagnostics.warn(Kind.CANARY_ORPHANED, null, "Canary backend {} has no primary backend to merge into, removing it", orphan);
            }
        }
    }

    private void mergeOne(RoutingResource canary,
                          String altName,
                          Server server,
                          Predicate<Location> locationMatches,
                          boolean primariesExist,
                          Map<String, Backend> upstreams,
                          Set<String> candidates,
                          Set<String> retained,
                          Diagnostics diagnostics) {
        Backend alternative = upstreams.get(altName);
        if (alternative == null) {
            LOGGER.debug("Canary backend {} of {} does not exist, skipping", altName, canary.key());
            return;
        }
        if (!primariesExist) {
            candidates.add(altName);
            return;
        }
        switch (mergeIntoServer(canary, alternative, server, locationMatches, upstreams)) {
            case MERGED -> retained.add(altName);
            case SELF_REFERENCE -> {
                retained.add(altName);
                diagnostics.warn(Kind.CANARY_SELF_REFERENCE, canary.key(),
                        "Canary backend {} is the primary backend of a location of server {}, not merging",
                        altName, server.getHostname());
            }
            case NO_MATCH -> candidates.add(altName);
        }
    }

    private static Outcome mergeIntoServer(RoutingResource canary, Backend alternative, Server server, Predicate<Location> locationMatches,
                                           Map<String, Backend> upstreams) {
        boolean merged = false;
        for (Location location : server.getLocations()) {
            Backend primary = upstreams.get(location.getBackend());
            if (primary == null) {
                continue;
            }
            if (primary.getName().equals(alternative.getName())) {
                return Outcome.SELF_REFERENCE;
            }
            if (canMerge(primary, alternative) && locationMatches.test(location)) {
                merged = mergeAlternativeBackend(canary, primary, alternative) || merged;
            }
        }
        return merged ? Outcome.MERGED : Outcome.NO_MATCH;
    }

    private static boolean canMerge(Backend primary, Backend alternative) {
        return !primary.isNoServer() && alternative.isNoServer() && !primary.getName().equals(alternative.getName());
    }

    /**
     * Adds {@code alternative} to the alternative backends of {@code primary}.
     * Merging an alternative already present is a successful no-op.
     *
     * @return true if the alternative is an alternative of the primary on return
     */
    @VisibleForTesting
    static boolean mergeAlternativeBackend(RoutingResource canary, Backend primary, Backend alternative) {
        if (primary.isNoServer()) {
            return false;
        }
        if (primary.getAlternativeBackends().contains(alternative.getName())) {
            return true;
        }
        if (!canary.parsedAnnotations().sessionAffinity().isLegacyCanaryBehavior()) {
            alternative.setSessionAffinity(primary.getSessionAffinity().copy());
        }
        primary.getAlternativeBackends().add(alternative.getName());
        return true;
    }
}
