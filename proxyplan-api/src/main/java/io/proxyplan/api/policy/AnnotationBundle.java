/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import java.util.List;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.Service;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The complete set of typed policies extracted from the annotations of one routing resource.
 * Instances are immutable; use {@link #toBuilder()} to derive a modified copy.
 *
 * @param aliases additional host names served by the resource's servers
 * @param serverSnippet free-form server level configuration
 * @param configurationSnippet free-form location level configuration
 * @param streamSnippet free-form stream level configuration
 * @param sslCipher TLS cipher policy of the resource's servers
 * @param sslPassthrough true if TLS is passed through to the backend without termination
 * @param serviceUpstream true to route to the service's cluster address instead of its individual endpoints
 * @param loadBalancing load balancing algorithm, absent to use the cluster default
 * @param upstreamHashBy consistent hashing policy
 * @param canary canary policy
 * @param sessionAffinity session affinity policy
 * @param rewrite URI rewriting policy
 * @param redirect redirect policy
 * @param auth basic/digest authentication policy
 * @param certificateAuth client certificate authentication policy
 * @param proxySsl TLS towards the backend
 * @param defaultBackend service serving requests when the location's backend has no endpoints
 * @param backendProtocol protocol spoken to the backend
 * @param http2PushPreload true to enable HTTP/2 push of preload links
 * @param opentracing opentracing override
 * @param proxy proxy connection settings, absent to use the cluster defaults
 * @param logs logging of the resource's locations
 * @param denied reason the resource's locations must deny all requests, absent when the annotations were valid
 */
public record AnnotationBundle(List<String> aliases,
                               @Nullable String serverSnippet,
                               @Nullable String configurationSnippet,
                               @Nullable String streamSnippet,
                               SslCipherPolicy sslCipher,
                               boolean sslPassthrough,
                               boolean serviceUpstream,
                               @Nullable String loadBalancing,
                               UpstreamHashByPolicy upstreamHashBy,
                               CanaryPolicy canary,
                               SessionAffinityPolicy sessionAffinity,
                               RewritePolicy rewrite,
                               RedirectPolicy redirect,
                               AuthPolicy auth,
                               ClientCertAuthPolicy certificateAuth,
                               ProxySslPolicy proxySsl,
                               @Nullable Service defaultBackend,
                               String backendProtocol,
                               boolean http2PushPreload,
                               OpentracingPolicy opentracing,
                               @Nullable ProxyPolicy proxy,
                               LogPolicy logs,
                               @Nullable String denied) {

    public static final String DEFAULT_BACKEND_PROTOCOL = "HTTP";

    private static final AnnotationBundle EMPTY = builder().build();

    public AnnotationBundle {
        aliases = List.copyOf(aliases);
        Objects.requireNonNull(sslCipher);
        Objects.requireNonNull(upstreamHashBy);
        Objects.requireNonNull(canary);
        Objects.requireNonNull(sessionAffinity);
        Objects.requireNonNull(rewrite);
        Objects.requireNonNull(redirect);
        Objects.requireNonNull(auth);
        Objects.requireNonNull(certificateAuth);
        Objects.requireNonNull(proxySsl);
        Objects.requireNonNull(backendProtocol);
        Objects.requireNonNull(opentracing);
        Objects.requireNonNull(logs);
    }

    /**
     * @return a bundle carrying no policy at all, as extracted from a resource without annotations
     */
    public static AnnotationBundle empty() {
        return EMPTY;
    }

    /**
     * @return a copy of this bundle with every free-form snippet removed
     */
    public AnnotationBundle withoutSnippets() {
        return toBuilder()
                .serverSnippet(null)
                .configurationSnippet(null)
                .streamSnippet(null)
                .build();
    }

    public boolean hasSnippets() {
        return serverSnippet != null || configurationSnippet != null || streamSnippet != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .aliases(aliases)
                .serverSnippet(serverSnippet)
                .configurationSnippet(configurationSnippet)
                .streamSnippet(streamSnippet)
                .sslCipher(sslCipher)
                .sslPassthrough(sslPassthrough)
                .serviceUpstream(serviceUpstream)
                .loadBalancing(loadBalancing)
                .upstreamHashBy(upstreamHashBy)
                .canary(canary)
                .sessionAffinity(sessionAffinity)
                .rewrite(rewrite)
                .redirect(redirect)
                .auth(auth)
                .certificateAuth(certificateAuth)
                .proxySsl(proxySsl)
                .defaultBackend(defaultBackend)
                .backendProtocol(backendProtocol)
                .http2PushPreload(http2PushPreload)
                .opentracing(opentracing)
                .proxy(proxy)
                .logs(logs)
                .denied(denied);
    }

    public static class Builder {
        private List<String> aliases = List.of();
        private @Nullable String serverSnippet;
        private @Nullable String configurationSnippet;
        private @Nullable String streamSnippet;
        private SslCipherPolicy sslCipher = SslCipherPolicy.NONE;
        private boolean sslPassthrough;
        private boolean serviceUpstream;
        private @Nullable String loadBalancing;
        private UpstreamHashByPolicy upstreamHashBy = UpstreamHashByPolicy.NONE;
        private CanaryPolicy canary = CanaryPolicy.DISABLED;
        private SessionAffinityPolicy sessionAffinity = SessionAffinityPolicy.NONE;
        private RewritePolicy rewrite = RewritePolicy.NONE;
        private RedirectPolicy redirect = RedirectPolicy.NONE;
        private AuthPolicy auth = AuthPolicy.NONE;
        private ClientCertAuthPolicy certificateAuth = ClientCertAuthPolicy.NONE;
        private ProxySslPolicy proxySsl = ProxySslPolicy.NONE;
        private @Nullable Service defaultBackend;
        private String backendProtocol = DEFAULT_BACKEND_PROTOCOL;
        private boolean http2PushPreload;
        private OpentracingPolicy opentracing = OpentracingPolicy.UNSET;
        private @Nullable ProxyPolicy proxy;
        private LogPolicy logs = LogPolicy.DEFAULT;
        private @Nullable String denied;

        private Builder() {
        }

        public Builder aliases(List<String> aliases) {
            this.aliases = aliases;
            return this;
        }

        public Builder serverSnippet(@Nullable String serverSnippet) {
            this.serverSnippet = serverSnippet;
            return this;
        }

        public Builder configurationSnippet(@Nullable String configurationSnippet) {
            this.configurationSnippet = configurationSnippet;
            return this;
        }

        public Builder streamSnippet(@Nullable String streamSnippet) {
            this.streamSnippet = streamSnippet;
            return this;
        }

        public Builder sslCipher(SslCipherPolicy sslCipher) {
            this.sslCipher = sslCipher;
            return this;
        }

        public Builder sslPassthrough(boolean sslPassthrough) {
            this.sslPassthrough = sslPassthrough;
            return this;
        }

        public Builder serviceUpstream(boolean serviceUpstream) {
            this.serviceUpstream = serviceUpstream;
            return this;
        }

        public Builder loadBalancing(@Nullable String loadBalancing) {
            this.loadBalancing = loadBalancing;
            return this;
        }

        public Builder upstreamHashBy(UpstreamHashByPolicy upstreamHashBy) {
            this.upstreamHashBy = upstreamHashBy;
            return this;
        }

        public Builder canary(CanaryPolicy canary) {
            this.canary = canary;
            return this;
        }

        public Builder sessionAffinity(SessionAffinityPolicy sessionAffinity) {
            this.sessionAffinity = sessionAffinity;
            return this;
        }

        public Builder rewrite(RewritePolicy rewrite) {
            this.rewrite = rewrite;
            return this;
        }

        public Builder redirect(RedirectPolicy redirect) {
            this.redirect = redirect;
            return this;
        }

        public Builder auth(AuthPolicy auth) {
            this.auth = auth;
            return this;
        }

        public Builder certificateAuth(ClientCertAuthPolicy certificateAuth) {
            this.certificateAuth = certificateAuth;
            return this;
        }

        public Builder proxySsl(ProxySslPolicy proxySsl) {
            this.proxySsl = proxySsl;
            return this;
        }

        public Builder defaultBackend(@Nullable Service defaultBackend) {
            this.defaultBackend = defaultBackend;
            return this;
        }

        public Builder backendProtocol(String backendProtocol) {
            this.backendProtocol = backendProtocol;
            return this;
        }

        public Builder http2PushPreload(boolean http2PushPreload) {
            this.http2PushPreload = http2PushPreload;
            return this;
        }

        public Builder opentracing(OpentracingPolicy opentracing) {
            this.opentracing = opentracing;
            return this;
        }

        public Builder proxy(@Nullable ProxyPolicy proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder logs(LogPolicy logs) {
            this.logs = logs;
            return this;
        }

        public Builder denied(@Nullable String denied) {
            this.denied = denied;
            return this;
        }

        public AnnotationBundle build() {
            return new AnnotationBundle(aliases, serverSnippet, configurationSnippet, streamSnippet, sslCipher, sslPassthrough, serviceUpstream,
                    loadBalancing, upstreamHashBy, canary, sessionAffinity, rewrite, redirect, auth, certificateAuth, proxySsl, defaultBackend,
                    backendProtocol, http2PushPreload, opentracing, proxy, logs, denied);
        }
    }
}
