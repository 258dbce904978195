/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;

import io.fabric8.kubernetes.api.model.Service;

import io.proxyplan.api.policy.UpstreamHashByPolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A named pool of endpoints that locations route requests to (an "upstream").
 * <br>
 * Backends are allocated, and mutated, only within a single synthesis pass.
 */
public class Backend {

    private final String name;
    private @Nullable Service service;
    private @Nullable String port;
    private List<Endpoint> endpoints = new ArrayList<>();
    private boolean noServer;
    private SessionAffinity sessionAffinity = new SessionAffinity();
    private @Nullable String loadBalancing;
    private UpstreamHashByPolicy upstreamHashBy = UpstreamHashByPolicy.NONE;
    private TrafficShapingPolicy trafficShapingPolicy = TrafficShapingPolicy.NONE;
    private final List<String> alternativeBackends = new ArrayList<>();
    private boolean sslPassthrough;

    public Backend(String name) {
        this.name = Objects.requireNonNull(name);
    }

    /**
     * Creates a deep copy of this backend under a different name.
     * @param newName name of the copy
     * @return the copy
     */
    public Backend copyAs(String newName) {
        var copy = new Backend(newName);
        copy.service = service;
        copy.port = port;
        copy.endpoints = new ArrayList<>(endpoints);
        copy.noServer = noServer;
        copy.sessionAffinity = sessionAffinity.copy();
        copy.loadBalancing = loadBalancing;
        copy.upstreamHashBy = upstreamHashBy;
        copy.trafficShapingPolicy = trafficShapingPolicy;
        copy.alternativeBackends.addAll(alternativeBackends);
        copy.sslPassthrough = sslPassthrough;
        return copy;
    }

    public String getName() {
        return name;
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

    public List<Endpoint> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(List<Endpoint> endpoints) {
        this.endpoints = new ArrayList<>(endpoints);
    }

    /**
     * @return true if the backend is a canary alternative that must never be routed to directly by a location
     */
    public boolean isNoServer() {
        return noServer;
    }

    public void setNoServer(boolean noServer) {
        this.noServer = noServer;
    }

    public SessionAffinity getSessionAffinity() {
        return sessionAffinity;
    }

    public void setSessionAffinity(SessionAffinity sessionAffinity) {
        this.sessionAffinity = Objects.requireNonNull(sessionAffinity);
    }

    public @Nullable String getLoadBalancing() {
        return loadBalancing;
    }

    public void setLoadBalancing(@Nullable String loadBalancing) {
        this.loadBalancing = loadBalancing;
    }

    public UpstreamHashByPolicy getUpstreamHashBy() {
        return upstreamHashBy;
    }

    public void setUpstreamHashBy(UpstreamHashByPolicy upstreamHashBy) {
        this.upstreamHashBy = Objects.requireNonNull(upstreamHashBy);
    }

    public TrafficShapingPolicy getTrafficShapingPolicy() {
        return trafficShapingPolicy;
    }

    public void setTrafficShapingPolicy(TrafficShapingPolicy trafficShapingPolicy) {
        this.trafficShapingPolicy = Objects.requireNonNull(trafficShapingPolicy);
    }

    /**
     * @return names of the canary backends that receive a share of this backend's traffic, in merge order
     */
    public List<String> getAlternativeBackends() {
        return alternativeBackends;
    }

    public boolean isSslPassthrough() {
        return sslPassthrough;
    }

    public void setSslPassthrough(boolean sslPassthrough) {
        this.sslPassthrough = sslPassthrough;
    }

    @Override
    public String toString() {
        return "Backend[name=" + name + ", endpoints=" + endpoints + ", noServer=" + noServer + ", alternativeBackends=" + alternativeBackends + "]";
    }
}
