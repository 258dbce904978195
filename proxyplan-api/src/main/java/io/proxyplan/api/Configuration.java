/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The root of a synthesised proxy configuration.
 * <br>
 * A configuration is built from scratch by every synthesis pass and is never updated incrementally.
 *
 * @param backends backends, in ascending name order
 * @param servers servers, in ascending host name order, each with its locations longest path first
 * @param tcpEndpoints TCP ports forwarded to services
 * @param udpEndpoints UDP ports forwarded to services
 * @param passthroughBackends hosts whose TLS connections are passed through
 * @param backendConfigChecksum checksum of the cluster wide backend configuration
 * @param defaultSSLCertificate the certificate used when no other certificate applies
 * @param streamSnippets free-form stream level snippets contributed by routing resources
 */
@JsonPropertyOrder({ "backends", "servers", "tcpEndpoints", "udpEndpoints", "passthroughBackends", "backendConfigChecksum", "defaultSSLCertificate",
        "streamSnippets" })
public record Configuration(List<Backend> backends,
                            List<Server> servers,
                            List<L4Service> tcpEndpoints,
                            List<L4Service> udpEndpoints,
                            List<SSLPassthroughBackend> passthroughBackends,
                            String backendConfigChecksum,
                            @Nullable SSLCert defaultSSLCertificate,
                            List<String> streamSnippets) {

    public Configuration {
        backends = List.copyOf(backends);
        servers = List.copyOf(servers);
        tcpEndpoints = List.copyOf(tcpEndpoints);
        udpEndpoints = List.copyOf(udpEndpoints);
        passthroughBackends = List.copyOf(passthroughBackends);
        Objects.requireNonNull(backendConfigChecksum);
        streamSnippets = List.copyOf(streamSnippets);
    }

    /**
     * @return every host name served, primary host names and aliases alike, in ascending order
     */
    public Set<String> hosts() {
        Set<String> hosts = new TreeSet<>();
        for (Server server : servers) {
            hosts.add(server.getHostname());
            hosts.addAll(server.getAliases());
        }
        return Collections.unmodifiableSet(hosts);
    }
}
