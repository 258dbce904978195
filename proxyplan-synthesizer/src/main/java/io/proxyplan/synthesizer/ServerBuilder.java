/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPath;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRule;
import io.fabric8.kubernetes.api.model.networking.v1.IngressServiceBackend;

import io.proxyplan.api.Backend;
import io.proxyplan.api.CookieSessionAffinity;
import io.proxyplan.api.Location;
import io.proxyplan.api.Names;
import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.SSLCert;
import io.proxyplan.api.Server;
import io.proxyplan.api.SessionAffinity;
import io.proxyplan.api.policy.AnnotationBundle;
import io.proxyplan.api.policy.LogPolicy;
import io.proxyplan.api.policy.SessionAffinityPolicy;
import io.proxyplan.api.policy.SslCipherPolicy;
import io.proxyplan.synthesizer.SynthesisDiagnostic.Kind;
import io.proxyplan.synthesizer.config.BackendConfiguration;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Builds the servers (virtual hosts) of a configuration and wires their locations to backends.
 * <p>
 * Canary resources take no part: their backends only reach a server through the {@link CanaryMerger}.
 * Server level fields offered by several resources for the same host are resolved according to
 * {@link ServerFieldPolicy}.
 */
class ServerBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerBuilder.class);

    private final CertificateSelector certificates;

    ServerBuilder(CertificateSelector certificates) {
        this.certificates = Objects.requireNonNull(certificates);
    }

    /**
     * @return the servers keyed by host name, the catch-all server first
     */
    Map<String, Server> build(List<RoutingResource> resources,
                              Map<String, Backend> upstreams,
                              Backend defaultUpstream,
                              BackendConfiguration cluster,
                              @Nullable SSLCert defaultCertificate,
                              Diagnostics diagnostics) {
        Map<String, Server> servers = new LinkedHashMap<>();
        servers.put(Names.CATCH_ALL_SERVER_NAME, catchAllServer(defaultUpstream, cluster, defaultCertificate));
        List<RoutingResource> primaries = resources.stream().filter(resource -> !resource.isCanary()).toList();

        createServers(primaries, upstreams, servers, defaultUpstream, cluster);
        mergeServerFields(primaries, servers, defaultCertificate, diagnostics);
        dedupeAliases(servers);
        wireLocations(primaries, upstreams, servers, cluster, diagnostics);
        return servers;
    }

    private static Server catchAllServer(Backend defaultUpstream, BackendConfiguration cluster, @Nullable SSLCert defaultCertificate) {
        var server = new Server(Names.CATCH_ALL_SERVER_NAME);
        server.setSslCert(defaultCertificate);
        var root = new Location(Names.ROOT_LOCATION, Names.PATH_TYPE_PREFIX, defaultUpstream.getName(), true);
        root.setService(defaultUpstream.getService());
        root.setProxy(cluster.proxy());
        root.setLogs(new LogPolicy(cluster.enableAccessLogForDefaultBackend(), false));
        server.getLocations().add(root);
        return server;
    }

    private static void createServers(List<RoutingResource> resources,
                                      Map<String, Backend> upstreams,
                                      Map<String, Server> servers,
                                      Backend defaultUpstream,
                                      BackendConfiguration cluster) {
        for (RoutingResource resource : resources) {
            AnnotationBundle annotations = resource.parsedAnnotations();
            Backend fallback = defaultUpstream;
            IngressServiceBackend defaultService = resource.defaultBackend().map(Rules::service).orElse(null);
            if (defaultService != null) {
                Backend upstream = upstreams.get(UpstreamNames.of(resource.namespace(), defaultService));
                if (upstream != null && upstream.isNoServer()) {
                    LOGGER.debug("Default backend {} of {} is a canary backend, using {} instead", upstream.getName(), resource.key(),
                            defaultUpstream.getName());
                }
                else if (upstream != null) {
                    fallback = upstream;
                    if (resource.rules().isEmpty()) {
                        overrideCatchAll(servers.get(Names.CATCH_ALL_SERVER_NAME), resource, upstream, cluster);
                    }
                }
            }

            for (IngressRule rule : resource.rules()) {
                String host = Rules.host(rule);
                if (servers.containsKey(host)) {
                    continue;
                }
                LOGGER.debug("Creating server {} for {}", host, resource.key());
                var server = new Server(host);
                var root = new Location(Names.ROOT_LOCATION, Names.PATH_TYPE_PREFIX, fallback.getName(), true);
                root.setService(fallback.getService());
                root.setResource(resource);
                LocationPolicies.apply(root, annotations, cluster.proxy());
                server.getLocations().add(root);
                server.setSslPassthrough(annotations.sslPassthrough());
                server.setSslCiphers(annotations.sslCipher().ciphers());
                server.setSslPreferServerCiphers(annotations.sslCipher().preferServerCiphers());
                servers.put(host, server);
            }
        }
    }

    /**
     * A resource without rules takes over the catch-all root location. The last such resource supplies the backend,
     * the first one supplies the location policies.
     */
    private static void overrideCatchAll(Server catchAll, RoutingResource resource, Backend upstream, BackendConfiguration cluster) {
        Location root = catchAll.rootLocation().orElseThrow();
        root.setBackend(upstream.getName());
        root.setService(upstream.getService());
        root.setResource(resource);
        if (!root.isDefBackend()) {
            LOGGER.debug("Catch-all server already overridden, {} replaces its backend only", resource.key());
            return;
        }
        root.setDefBackend(false);
        LocationPolicies.applyToCatchAll(root, resource.parsedAnnotations(), cluster.proxy());
    }

    private void mergeServerFields(List<RoutingResource> resources, Map<String, Server> servers, @Nullable SSLCert defaultCertificate,
                                   Diagnostics diagnostics) {
        for (RoutingResource resource : resources) {
            AnnotationBundle annotations = resource.parsedAnnotations();
            SslCipherPolicy sslCipher = annotations.sslCipher();
            for (IngressRule rule : resource.rules()) {
                Server server = servers.get(Rules.host(rule));
                offer(ServerFieldPolicy.ALIASES, server, resource, server.getAliases(), annotations.aliases(), server::setAliases, diagnostics);
                offer(ServerFieldPolicy.SERVER_SNIPPET, server, resource, server.getServerSnippet(), annotations.serverSnippet(), server::setServerSnippet,
                        diagnostics);
                offer(ServerFieldPolicy.SSL_CIPHERS, server, resource, server.getSslCiphers(), sslCipher.ciphers(), server::setSslCiphers, diagnostics);
                offer(ServerFieldPolicy.SSL_PREFER_SERVER_CIPHERS, server, resource, server.getSslPreferServerCiphers(), sslCipher.preferServerCiphers(),
                        server::setSslPreferServerCiphers, diagnostics);
                selectCertificate(server, resource, defaultCertificate, diagnostics);
            }
        }
    }

    private void selectCertificate(Server server, RoutingResource resource, @Nullable SSLCert defaultCertificate, Diagnostics diagnostics) {
        if (!ServerFieldPolicy.CERTIFICATE.accepts(server.getSslCert() != null) || resource.tls().isEmpty()) {
            return;
        }
        String host = server.getHostname();
        LookupResult<SSLCert> certificate = certificates.select(host, resource, defaultCertificate);
        if (certificate.isDegraded()) {
            diagnostics.warn(Kind.CERTIFICATE_FALLBACK, resource.key(), "Server {}: {}", host, certificate.problem());
        }
        else {
            certificates.expiryWarning(certificate.value(), host)
                    .ifPresent(warning -> diagnostics.warn(Kind.CERTIFICATE_EXPIRING, resource.key(), "Server {}: {}", host, warning));
        }
        server.setSslCert(certificate.value());
    }

    /**
     * Drops aliases equal to their own host, aliases naming another server and repeated aliases.
     */
    private static void dedupeAliases(Map<String, Server> servers) {
        for (Server server : servers.values()) {
            List<String> aliases = server.getAliases().stream()
                    .filter(alias -> !alias.equals(server.getHostname()))
                    .filter(alias -> !servers.containsKey(alias))
                    .distinct()
                    .sorted()
                    .toList();
            server.setAliases(aliases);
        }
    }

    private static void wireLocations(List<RoutingResource> resources,
                                      Map<String, Backend> upstreams,
                                      Map<String, Server> servers,
                                      BackendConfiguration cluster,
                                      Diagnostics diagnostics) {
        for (RoutingResource resource : resources) {
            AnnotationBundle annotations = resource.parsedAnnotations();
            for (IngressRule rule : resource.rules()) {
                String host = Rules.host(rule);
                Server server = servers.getOrDefault(host, servers.get(Names.CATCH_ALL_SERVER_NAME));
                if (!Rules.hasHttp(rule) && !Names.CATCH_ALL_SERVER_NAME.equals(host)) {
                    continue;
                }
                mergeServerAuthentication(server, resource, cluster, diagnostics);

                for (HTTPIngressPath path : Rules.paths(rule)) {
                    IngressServiceBackend service = Rules.service(path.getBackend());
                    if (service == null) {
                        continue;
                    }
                    Backend upstream = upstreams.get(UpstreamNames.of(resource.namespace(), service));
                    if (upstream == null || upstream.isNoServer()) {
                        continue;
                    }
                    String nginxPath = Rules.path(path);
                    Location location = locationFor(server, resource, nginxPath, path.getPathType(), upstream, diagnostics);
                    applySessionAffinity(upstream, resource, server, nginxPath);
                    if (location == null) {
                        continue;
                    }
                    location.setPort(upstream.getPort());
                    location.setService(upstream.getService());
                    location.setResource(resource);
                    LocationPolicies.apply(location, annotations, cluster.proxy());
                    if (location.getRedirect().fromToWww()) {
                        server.setRedirectFromToWWW(true);
                    }
                }
            }
        }
    }

    /**
     * @return the location to wire, or null if a location with the same path and path type is already wired by another rule
     */
    @Nullable
    private static Location locationFor(Server server, RoutingResource resource, String path, @Nullable String pathType, Backend upstream,
                                        Diagnostics diagnostics) {
        Optional<Location> existing = server.getLocations().stream()
                .filter(location -> location.hasKey(path, pathType))
                .findFirst();
        if (existing.isEmpty()) {
            var location = new Location(path, pathType, upstream.getName(), false);
            server.getLocations().add(location);
            return location;
        }
        Location location = existing.get();
        if (!location.isDefBackend()) {
            diagnostics.warn(Kind.DUPLICATE_LOCATION, resource.key(),
                    "Location {} ({}) of server {} is already defined by {}, ignoring the definition from {}",
                    path, pathType, server.getHostname(), location.getResourceKey(), resource.key());
            return null;
        }
        location.setBackend(upstream.getName());
        location.setDefBackend(false);
        return location;
    }

    private static void mergeServerAuthentication(Server server, RoutingResource resource, BackendConfiguration cluster, Diagnostics diagnostics) {
        AnnotationBundle annotations = resource.parsedAnnotations();
        offer(ServerFieldPolicy.AUTH_TLS_ERROR, server, resource, server.getAuthTlsError(), annotations.certificateAuth().authTlsError(),
                server::setAuthTlsError, diagnostics);
        if (annotations.certificateAuth().isConfigured()) {
            offer(ServerFieldPolicy.CERTIFICATE_AUTH, server, resource, server.getCertificateAuth().isConfigured() ? server.getCertificateAuth() : null,
                    annotations.certificateAuth(), server::setCertificateAuth, diagnostics);
        }
        if (!cluster.proxySslLocationOnly() && annotations.proxySsl().isConfigured()) {
            offer(ServerFieldPolicy.PROXY_SSL, server, resource, server.getProxySsl().isConfigured() ? server.getProxySsl() : null,
                    annotations.proxySsl(), server::setProxySsl, diagnostics);
        }
    }

    private static void applySessionAffinity(Backend upstream, RoutingResource resource, Server server, String path) {
        SessionAffinityPolicy policy = resource.parsedAnnotations().sessionAffinity();
        SessionAffinity affinity = upstream.getSessionAffinity();
        if (affinity.getAffinityType() == null) {
            affinity.setAffinityType(policy.type());
        }
        if (affinity.getAffinityMode() == null) {
            affinity.setAffinityMode(policy.mode());
        }
        if (!policy.isCookieBased()) {
            return;
        }
        String cookiePath = policy.cookie().path();
        if (cookiePath == null && resource.parsedAnnotations().rewrite().useRegex()) {
            LOGGER.atWarn()
                    .addKeyValue("namespace", resource.namespace())
                    .addKeyValue("name", resource.name())
                    .log("session-cookie-path should be set when use-regex is true, the cookie may not be sent for every matched path");
        }
        CookieSessionAffinity cookie = affinity.getCookieSessionAffinity();
        if (cookie.getName() == null) {
            cookie.apply(policy.cookie(), cookiePath);
        }
        cookie.addLocation(server.getHostname(), path);
        for (String alias : server.getAliases()) {
            cookie.addLocation(alias, path);
        }
    }

    private static <T> void offer(ServerFieldPolicy field,
                                  Server server,
                                  RoutingResource resource,
                                  @Nullable T current,
                                  @Nullable T offered,
                                  Consumer<T> setter,
                                  Diagnostics diagnostics) {
        if (isEmpty(offered)) {
            return;
        }
        if (field.accepts(!isEmpty(current))) {
            setter.accept(offered);
        }
        else if (!offered.equals(current)) {
            diagnostics.warn(Kind.FIELD_CONFLICT, resource.key(), "{} of server {} is already set by another resource, ignoring the value from {}",
                    field, server.getHostname(), resource.key());
        }
    }

    private static boolean isEmpty(@Nullable Object value) {
        return value == null
                || (value instanceof String string && string.isEmpty())
                || (value instanceof Collection<?> collection && collection.isEmpty());
    }
}
