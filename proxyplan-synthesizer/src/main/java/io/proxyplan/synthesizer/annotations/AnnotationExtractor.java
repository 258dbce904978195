/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Service;

import io.proxyplan.api.policy.AnnotationBundle;
import io.proxyplan.api.policy.AuthPolicy;
import io.proxyplan.api.policy.CanaryPolicy;
import io.proxyplan.api.policy.ClientCertAuthPolicy;
import io.proxyplan.api.policy.LogPolicy;
import io.proxyplan.api.policy.OpentracingPolicy;
import io.proxyplan.api.policy.ProxySslPolicy;
import io.proxyplan.api.policy.RedirectPolicy;
import io.proxyplan.api.policy.RewritePolicy;
import io.proxyplan.api.policy.SessionAffinityPolicy;
import io.proxyplan.api.policy.SslCipherPolicy;
import io.proxyplan.api.policy.UpstreamHashByPolicy;
import io.proxyplan.synthesizer.spi.ResourceStore;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Extracts the {@link AnnotationBundle} of a resource.
 * <p>
 * A policy whose annotations carry an unusable value falls back to its default. A policy that
 * requests a protection which cannot be configured records the reason on the bundle's
 * {@link AnnotationBundle#denied() denied} field instead, so that the resource's locations
 * refuse traffic. Only the first such reason is kept.
 */
public class AnnotationExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationExtractor.class);

    private final ResourceStore store;
    private final AnnotationReader reader;
    private final CanaryParser canary;
    private final SessionAffinityParser sessionAffinity;
    private final RewriteParser rewrite;
    private final RedirectParser redirect;
    private final AuthParser auth;
    private final ClientCertAuthParser certificateAuth;
    private final ProxySslParser proxySsl;
    private final DefaultBackendParser defaultBackend;
    private final BackendProtocolParser backendProtocol;
    private final OpentracingParser opentracing;
    private final ProxyParser proxy;
    private final UpstreamHashByParser upstreamHashBy;

    public AnnotationExtractor(String annotationsPrefix, ResourceStore store) {
        this.store = Objects.requireNonNull(store);
        this.reader = new AnnotationReader(annotationsPrefix);
        this.canary = new CanaryParser(reader);
        this.sessionAffinity = new SessionAffinityParser(reader);
        this.rewrite = new RewriteParser(reader);
        this.redirect = new RedirectParser(reader);
        this.auth = new AuthParser(reader, store);
        this.certificateAuth = new ClientCertAuthParser(reader, store);
        this.proxySsl = new ProxySslParser(reader, store);
        this.defaultBackend = new DefaultBackendParser(reader, store);
        this.backendProtocol = new BackendProtocolParser(reader);
        this.opentracing = new OpentracingParser(reader);
        this.proxy = new ProxyParser(reader, () -> store.getBackendConfiguration().proxy());
        this.upstreamHashBy = new UpstreamHashByParser(reader);
    }

    public AnnotationReader reader() {
        return reader;
    }

    public AnnotationBundle extract(HasMetadata resource) {
        var extraction = new Extraction(resource);
        return AnnotationBundle.builder()
                .aliases(extraction.parse("server-alias", this::aliases, List.of()))
                .serverSnippet(extraction.optionalString("server-snippet"))
                .configurationSnippet(extraction.optionalString("configuration-snippet"))
                .streamSnippet(extraction.optionalString("stream-snippet"))
                .sslCipher(extraction.parse("ssl-ciphers", this::sslCipher, SslCipherPolicy.NONE))
                .sslPassthrough(extraction.parse("ssl-passthrough", r -> reader.bool(r, "ssl-passthrough").orElse(false), false))
                .serviceUpstream(extraction.parse("service-upstream", r -> reader.bool(r, "service-upstream").orElse(false), false))
                .loadBalancing(extraction.optionalString("load-balance"))
                .upstreamHashBy(extraction.parse("upstream-hash-by", upstreamHashBy, UpstreamHashByPolicy.NONE))
                .canary(extraction.parse("canary", canary, CanaryPolicy.DISABLED))
                .sessionAffinity(extraction.parse("affinity", sessionAffinity, SessionAffinityPolicy.NONE))
                .rewrite(extraction.parse("rewrite", rewrite, RewritePolicy.NONE))
                .redirect(extraction.parse("redirect", redirect, RedirectPolicy.NONE))
                .auth(extraction.parse("auth", auth, AuthPolicy.NONE))
                .certificateAuth(extraction.parse("auth-tls", certificateAuth, denied -> ClientCertAuthPolicy.failed(denied.getMessage()),
                        ClientCertAuthPolicy.NONE))
                .proxySsl(extraction.parse("proxy-ssl", proxySsl, ProxySslPolicy.NONE))
                .defaultBackend(extraction.parse("default-backend", defaultBackend, Optional.<Service> empty()).orElse(null))
                .backendProtocol(extraction.parse("backend-protocol", backendProtocol, AnnotationBundle.DEFAULT_BACKEND_PROTOCOL))
                .http2PushPreload(extraction.parse("http2-push-preload", r -> reader.bool(r, "http2-push-preload").orElse(false), false))
                .opentracing(extraction.parse("opentracing", opentracing, OpentracingPolicy.UNSET))
                .proxy(extraction.parse("proxy", proxy, store.getBackendConfiguration().proxy()))
                .logs(extraction.parse("logs", this::logs, LogPolicy.DEFAULT))
                .denied(extraction.denied)
                .build();
    }

    private List<String> aliases(HasMetadata resource) {
        return reader.list(resource, "server-alias").stream().distinct().sorted().toList();
    }

    private SslCipherPolicy sslCipher(HasMetadata resource) {
        String ciphers = reader.string(resource, "ssl-ciphers").orElse(null);
        String preferServerCiphers = reader.bool(resource, "ssl-prefer-server-ciphers")
                .map(prefer -> prefer ? "on" : "off")
                .orElse(null);
        if (ciphers == null && preferServerCiphers == null) {
            return SslCipherPolicy.NONE;
        }
        return new SslCipherPolicy(ciphers, preferServerCiphers);
    }

    private LogPolicy logs(HasMetadata resource) {
        return new LogPolicy(
                reader.bool(resource, "enable-access-log").orElse(LogPolicy.DEFAULT.access()),
                reader.bool(resource, "enable-rewrite-log").orElse(LogPolicy.DEFAULT.rewrite()));
    }

    private class Extraction {
        private final HasMetadata resource;
        private @Nullable String denied;

        Extraction(HasMetadata resource) {
            this.resource = resource;
        }

        @Nullable
        String optionalString(String name) {
            return parse(name, r -> reader.string(r, name), Optional.<String> empty()).orElse(null);
        }

        <T> T parse(String policy, AnnotationParser<T> parser, T fallback) {
            return parse(policy, parser, e -> fallback, fallback);
        }

        <T> T parse(String policy, AnnotationParser<T> parser, Function<LocationDeniedException, T> onDenied, T fallback) {
            try {
                return parser.parse(resource);
            }
            catch (LocationDeniedException e) {
                if (denied == null) {
                    denied = e.getMessage();
                    LOGGER.atWarn()
                            .addKeyValue("namespace", resource.getMetadata().getNamespace())
                            .addKeyValue("name", resource.getMetadata().getName())
                            .log("Denying access to the locations of the resource, {} annotations are unusable: {}", policy, e.getMessage());
                }
                return onDenied.apply(e);
            }
            catch (InvalidAnnotationException e) {
                LOGGER.atWarn()
                        .addKeyValue("namespace", resource.getMetadata().getNamespace())
                        .addKeyValue("name", resource.getMetadata().getName())
                        .log("Ignoring {} annotations: {}", policy, e.getMessage());
                return fallback;
            }
        }
    }
}
