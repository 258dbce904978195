/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.proxyplan.api.Backend;
import io.proxyplan.api.Configuration;
import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.SSLCert;
import io.proxyplan.api.Server;
import io.proxyplan.synthesizer.SynthesisDiagnostic.Kind;
import io.proxyplan.synthesizer.checksum.Crc32ChecksumGenerator;
import io.proxyplan.synthesizer.config.BackendConfiguration;
import io.proxyplan.synthesizer.config.ControllerConfig;
import io.proxyplan.synthesizer.spi.EndpointResolver;
import io.proxyplan.synthesizer.spi.ResourceStore;
import io.proxyplan.synthesizer.spi.StreamServiceResolver;

/**
 * Synthesises a complete {@link Configuration} from a set of routing resources.
 * <p>
 * Each call is an independent pass: every backend, server and location is created afresh and
 * owned by the returned result. Degraded lookups never fail a pass, they are reported as
 * {@link SynthesisDiagnostic}s on the result.
 */
public class ConfigurationSynthesizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationSynthesizer.class);

    private final ControllerConfig controller;
    private final ResourceStore store;
    private final UpstreamBuilder upstreamBuilder;
    private final ServerBuilder serverBuilder;
    private final CanaryMerger canaryMerger;
    private final ConfigurationAssembler assembler;

    public ConfigurationSynthesizer(ControllerConfig controller, ResourceStore store, EndpointResolver endpointResolver,
                                    StreamServiceResolver streamServices) {
        this(controller, store, endpointResolver, streamServices, Clock.systemUTC());
    }

    public ConfigurationSynthesizer(ControllerConfig controller, ResourceStore store, EndpointResolver endpointResolver,
                                    StreamServiceResolver streamServices, Clock clock) {
        this.controller = Objects.requireNonNull(controller);
        this.store = Objects.requireNonNull(store);
        this.upstreamBuilder = new UpstreamBuilder(store, endpointResolver);
        this.serverBuilder = new ServerBuilder(new CertificateSelector(store, clock));
        this.canaryMerger = new CanaryMerger();
        this.assembler = new ConfigurationAssembler(new ServiceEndpoints(endpointResolver), streamServices);
    }

    /**
     * Synthesises the configuration of every routing resource currently in the store.
     */
    public SynthesisResult synthesize() {
        return synthesize(store.listRoutingResources());
    }

    public SynthesisResult synthesize(List<RoutingResource> resources) {
        var diagnostics = new Diagnostics();
        BackendConfiguration cluster = store.getBackendConfiguration();
        List<RoutingResource> effective = cluster.allowSnippetAnnotations() ? resources : withoutSnippets(resources, diagnostics);
        LOGGER.debug("Synthesising configuration from {} routing resources", effective.size());

        Backend defaultUpstream = upstreamBuilder.buildDefaultUpstream(controller.defaultBackendService(), diagnostics);
        Map<String, Backend> upstreams = upstreamBuilder.build(effective, defaultUpstream, cluster, diagnostics);
        SSLCert defaultCertificate = store.getDefaultSSLCertificate();
        Map<String, Server> servers = serverBuilder.build(effective, upstreams, defaultUpstream, cluster, defaultCertificate, diagnostics);
        canaryMerger.merge(effective, upstreams, servers, diagnostics);
        Configuration configuration = assembler.assemble(effective, upstreams, servers, controller, Crc32ChecksumGenerator.checksumOf(cluster),
                defaultCertificate, diagnostics);

        return new SynthesisResult(configuration, configuration.hosts(), diagnostics.toList());
    }

    private static List<RoutingResource> withoutSnippets(List<RoutingResource> resources, Diagnostics diagnostics) {
        return resources.stream()
                .map(resource -> {
                    if (!resource.parsedAnnotations().hasSnippets()) {
                        return resource;
                    }
                    diagnostics.warn(Kind.SNIPPETS_DROPPED, resource.key(), "Snippet annotations are disabled, ignoring the snippets of {}", resource.key());
                    return new RoutingResource(resource.ingress(), resource.parsedAnnotations().withoutSnippets());
                })
                .toList();
    }
}
