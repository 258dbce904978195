/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.fabric8.kubernetes.api.model.Service;

import io.proxyplan.api.policy.AuthPolicy;
import io.proxyplan.api.policy.LogPolicy;
import io.proxyplan.api.policy.OpentracingPolicy;
import io.proxyplan.api.policy.ProxyPolicy;
import io.proxyplan.api.policy.ProxySslPolicy;
import io.proxyplan.api.policy.RedirectPolicy;
import io.proxyplan.api.policy.RewritePolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A path matching rule of a {@link Server}, bound to one backend.
 * Within a server a location is identified by its path together with its path type.
 */
public class Location {

    private final String path;
    private final @Nullable String pathType;
    private String backend;
    private boolean defBackend;
    private @Nullable Service service;
    private @Nullable String port;
    private @Nullable RoutingResource resource;

    private AuthPolicy basicDigestAuth = AuthPolicy.NONE;
    private RewritePolicy rewrite = RewritePolicy.NONE;
    private RedirectPolicy redirect = RedirectPolicy.NONE;
    private ProxyPolicy proxy = ProxyPolicy.DEFAULTS;
    private ProxySslPolicy proxySsl = ProxySslPolicy.NONE;
    private LogPolicy logs = LogPolicy.DEFAULT;
    private OpentracingPolicy opentracing = OpentracingPolicy.UNSET;
    private @Nullable Service defaultBackend;
    private @Nullable String defaultBackendUpstreamName;
    private String backendProtocol = "HTTP";
    private boolean http2PushPreload;
    private @Nullable String configurationSnippet;
    private @Nullable String denied;

    public Location(String path, @Nullable String pathType, String backend, boolean defBackend) {
        this.path = Objects.requireNonNull(path);
        this.pathType = pathType;
        this.backend = Objects.requireNonNull(backend);
        this.defBackend = defBackend;
    }

    /**
     * @return true if this location is identified by the given path and path type
     */
    public boolean hasKey(String path, @Nullable String pathType) {
        return this.path.equals(path) && Objects.equals(this.pathType, pathType);
    }

    public String getPath() {
        return path;
    }

    public @Nullable String getPathType() {
        return pathType;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = Objects.requireNonNull(backend);
    }

    /**
     * @return true while the location is a placeholder routing to the default (or resource fallback) backend
     */
    @JsonProperty("defBackend")
    public boolean isDefBackend() {
        return defBackend;
    }

    public void setDefBackend(boolean defBackend) {
        this.defBackend = defBackend;
    }

    @JsonIgnore
    public @Nullable Service getService() {
        return service;
    }

    public void setService(@Nullable Service service) {
        this.service = service;
    }

    public @Nullable String getPort() {
        return port;
    }

    public void setPort(@Nullable String port) {
        this.port = port;
    }

    /**
     * @return the routing resource that defined this location, absent for the synthesised catch-all root location
     */
    @JsonIgnore
    public @Nullable RoutingResource getResource() {
        return resource;
    }

    public void setResource(@Nullable RoutingResource resource) {
        this.resource = resource;
    }

    /**
     * @return key, {@code namespace/name}, of the routing resource that defined this location
     */
    @JsonProperty("resourceKey")
    public @Nullable String getResourceKey() {
        return resource == null ? null : resource.key();
    }

    public AuthPolicy getBasicDigestAuth() {
        return basicDigestAuth;
    }

    public void setBasicDigestAuth(AuthPolicy basicDigestAuth) {
        this.basicDigestAuth = Objects.requireNonNull(basicDigestAuth);
    }

    public RewritePolicy getRewrite() {
        return rewrite;
    }

    public void setRewrite(RewritePolicy rewrite) {
        this.rewrite = Objects.requireNonNull(rewrite);
    }

    public RedirectPolicy getRedirect() {
        return redirect;
    }

    public void setRedirect(RedirectPolicy redirect) {
        this.redirect = Objects.requireNonNull(redirect);
    }

    public ProxyPolicy getProxy() {
        return proxy;
    }

    public void setProxy(ProxyPolicy proxy) {
        this.proxy = Objects.requireNonNull(proxy);
    }

    public ProxySslPolicy getProxySsl() {
        return proxySsl;
    }

    public void setProxySsl(ProxySslPolicy proxySsl) {
        this.proxySsl = Objects.requireNonNull(proxySsl);
    }

    public LogPolicy getLogs() {
        return logs;
    }

    public void setLogs(LogPolicy logs) {
        this.logs = Objects.requireNonNull(logs);
    }

    public OpentracingPolicy getOpentracing() {
        return opentracing;
    }

    public void setOpentracing(OpentracingPolicy opentracing) {
        this.opentracing = Objects.requireNonNull(opentracing);
    }

    @JsonIgnore
    public @Nullable Service getDefaultBackend() {
        return defaultBackend;
    }

    public void setDefaultBackend(@Nullable Service defaultBackend) {
        this.defaultBackend = defaultBackend;
    }

    /**
     * @return name of the backend synthesised from this location's custom default backend, if any
     */
    public @Nullable String getDefaultBackendUpstreamName() {
        return defaultBackendUpstreamName;
    }

    public void setDefaultBackendUpstreamName(@Nullable String defaultBackendUpstreamName) {
        this.defaultBackendUpstreamName = defaultBackendUpstreamName;
    }

    public String getBackendProtocol() {
        return backendProtocol;
    }

    public void setBackendProtocol(String backendProtocol) {
        this.backendProtocol = Objects.requireNonNull(backendProtocol);
    }

    public boolean isHttp2PushPreload() {
        return http2PushPreload;
    }

    public void setHttp2PushPreload(boolean http2PushPreload) {
        this.http2PushPreload = http2PushPreload;
    }

    public @Nullable String getConfigurationSnippet() {
        return configurationSnippet;
    }

    public void setConfigurationSnippet(@Nullable String configurationSnippet) {
        this.configurationSnippet = configurationSnippet;
    }

    public @Nullable String getDenied() {
        return denied;
    }

    public void setDenied(@Nullable String denied) {
        this.denied = denied;
    }

    @Override
    public String toString() {
        return "Location[path=" + path + ", pathType=" + pathType + ", backend=" + backend + ", defBackend=" + defBackend + "]";
    }
}
