/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServicePortBuilder;
import io.fabric8.kubernetes.api.model.TypedLocalObjectReferenceBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPath;
import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPathBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBackend;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBackendBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRule;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRuleBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressTLS;
import io.fabric8.kubernetes.api.model.networking.v1.IngressTLSBuilder;

import io.proxyplan.api.Names;
import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.SSLCert;
import io.proxyplan.api.policy.AnnotationBundle;
import io.proxyplan.api.policy.CanaryPolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Builders for the routing resources, services and certificates used across the synthesis tests.
 */
public final class Fixtures {

    public static final String NAMESPACE = "ns1";

    private Fixtures() {
    }

    public static IngressBuilder ingressBuilder(String name) {
        return new IngressBuilder()
                .withNewMetadata()
                .withNamespace(NAMESPACE)
                .withName(name)
                .endMetadata()
                .withNewSpec()
                .endSpec();
    }

    public static Ingress ingress(String name, IngressRule... rules) {
        return ingressBuilder(name)
                .editSpec()
                .withRules(rules)
                .endSpec()
                .build();
    }

    public static Ingress ingressWithAnnotations(String name, Map<String, String> annotations, IngressRule... rules) {
        return ingressBuilder(name)
                .editMetadata()
                .withAnnotations(annotations)
                .endMetadata()
                .editSpec()
                .withRules(rules)
                .endSpec()
                .build();
    }

    /**
     * @return a resource with only a default backend, and no rules
     */
    public static Ingress catchAllIngress(String name, String service, int port) {
        return ingressBuilder(name)
                .editSpec()
                .withDefaultBackend(backend(service, port))
                .endSpec()
                .build();
    }

    public static IngressRule rule(@Nullable String host, HTTPIngressPath... paths) {
        return new IngressRuleBuilder()
                .withHost(host)
                .withNewHttp()
                .withPaths(paths)
                .endHttp()
                .build();
    }

    public static HTTPIngressPath path(String path, String service, int port) {
        return path(path, Names.PATH_TYPE_PREFIX, service, port);
    }

    public static HTTPIngressPath path(String path, @Nullable String pathType, String service, int port) {
        return new HTTPIngressPathBuilder()
                .withPath(path)
                .withPathType(pathType)
                .withBackend(backend(service, port))
                .build();
    }

    public static HTTPIngressPath resourcePath(String path, String kind, String name) {
        return new HTTPIngressPathBuilder()
                .withPath(path)
                .withPathType(Names.PATH_TYPE_PREFIX)
                .withNewBackend()
                .withResource(new TypedLocalObjectReferenceBuilder()
                        .withKind(kind)
                        .withName(name)
                        .build())
                .endBackend()
                .build();
    }

    public static IngressBackend backend(String service, int port) {
        return new IngressBackendBuilder()
                .withNewService()
                .withName(service)
                .withNewPort()
                .withNumber(port)
                .endPort()
                .endService()
                .build();
    }

    public static IngressTLS tls(String secretName, String... hosts) {
        return new IngressTLSBuilder()
                .withSecretName(secretName)
                .withHosts(hosts)
                .build();
    }

    public static Service service(String name, int... ports) {
        return service(NAMESPACE, name, ports);
    }

    public static Service service(String namespace, String name, int... ports) {
        List<ServicePort> servicePorts = Arrays.stream(ports)
                .mapToObj(port -> new ServicePortBuilder().withPort(port).withTargetPort(new IntOrString(port)).build())
                .toList();
        return new ServiceBuilder()
                .withNewMetadata()
                .withNamespace(namespace)
                .withName(name)
                .endMetadata()
                .withNewSpec()
                .withClusterIP("10.96.0.10")
                .withPorts(servicePorts)
                .endSpec()
                .build();
    }

    public static RoutingResource resource(Ingress ingress) {
        return new RoutingResource(ingress, AnnotationBundle.empty());
    }

    public static RoutingResource resource(Ingress ingress, AnnotationBundle annotations) {
        return new RoutingResource(ingress, annotations);
    }

    public static RoutingResource canary(Ingress ingress) {
        return new RoutingResource(ingress, canaryAnnotations());
    }

    public static AnnotationBundle canaryAnnotations() {
        return AnnotationBundle.builder()
                .canary(new CanaryPolicy(true, 20, CanaryPolicy.DEFAULT_WEIGHT_TOTAL, "x-canary", null, null, null))
                .build();
    }

    public static SSLCert certificate(String name, Instant expireTime, String... dnsNames) {
        return new SSLCert(name, "-----BEGIN CERTIFICATE-----\nMIIB\n-----END CERTIFICATE-----\n", null, List.of(dnsNames), expireTime);
    }
}
