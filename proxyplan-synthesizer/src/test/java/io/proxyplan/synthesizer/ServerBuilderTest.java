/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.proxyplan.api.Backend;
import io.proxyplan.api.CookieSessionAffinity;
import io.proxyplan.api.Location;
import io.proxyplan.api.Names;
import io.proxyplan.api.RoutingResource;
import io.proxyplan.api.SSLCert;
import io.proxyplan.api.Server;
import io.proxyplan.api.policy.AnnotationBundle;
import io.proxyplan.api.policy.ClientCertAuthPolicy;
import io.proxyplan.api.policy.CookiePolicy;
import io.proxyplan.api.policy.ProxySslPolicy;
import io.proxyplan.api.policy.RedirectPolicy;
import io.proxyplan.api.policy.SessionAffinityPolicy;
import io.proxyplan.api.policy.SslCipherPolicy;
import io.proxyplan.synthesizer.SynthesisDiagnostic.Kind;
import io.proxyplan.synthesizer.config.BackendConfiguration;

import static io.proxyplan.synthesizer.Fixtures.canary;
import static io.proxyplan.synthesizer.Fixtures.catchAllIngress;
import static io.proxyplan.synthesizer.Fixtures.certificate;
import static io.proxyplan.synthesizer.Fixtures.ingress;
import static io.proxyplan.synthesizer.Fixtures.ingressBuilder;
import static io.proxyplan.synthesizer.Fixtures.path;
import static io.proxyplan.synthesizer.Fixtures.resource;
import static io.proxyplan.synthesizer.Fixtures.rule;
import static io.proxyplan.synthesizer.Fixtures.service;
import static io.proxyplan.synthesizer.Fixtures.tls;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ServerBuilderTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final SSLCert DEFAULT_CERTIFICATE = certificate("default/fake", NOW.plus(Duration.ofDays(365)), "ingress.local");

    private InMemoryResourceStore store;
    private UpstreamBuilder upstreamBuilder;
    private ServerBuilder serverBuilder;
    private Diagnostics diagnostics;
    private BackendConfiguration cluster;
    private Map<String, Backend> upstreams;

    @BeforeEach
    void setUp() {
        store = new InMemoryResourceStore().withServices(service("s1", 80), service("s2", 80), service("s3", 80));
        upstreamBuilder = new UpstreamBuilder(store, new StaticEndpointResolver());
        serverBuilder = new ServerBuilder(new CertificateSelector(store, Clock.fixed(NOW, ZoneOffset.UTC)));
        diagnostics = new Diagnostics();
        cluster = BackendConfiguration.DEFAULT;
    }

    @Test
    void shouldCreateCatchAllServerRoutingToDefaultBackend() {
        // Given
        cluster = new BackendConfiguration(false, null, null, null, false, true, null);

        // When
        Map<String, Server> servers = build();

        // Then
        assertThat(servers).containsOnlyKeys(Names.CATCH_ALL_SERVER_NAME);
        Server catchAll = servers.get(Names.CATCH_ALL_SERVER_NAME);
        assertThat(catchAll.getSslCert()).isEqualTo(DEFAULT_CERTIFICATE);
        assertThat(catchAll.getLocations())
                .singleElement()
                .satisfies(root -> {
                    assertThat(root.getPath()).isEqualTo(Names.ROOT_LOCATION);
                    assertThat(root.getPathType()).isEqualTo(Names.PATH_TYPE_PREFIX);
                    assertThat(root.getBackend()).isEqualTo(Names.DEFAULT_UPSTREAM_NAME);
                    assertThat(root.isDefBackend()).isTrue();
                    assertThat(root.getLogs().access()).isTrue();
                    assertThat(root.getLogs().rewrite()).isFalse();
                });
    }

    @Test
    void shouldReplacePlaceholderRootLocation() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))));

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").getLocations())
                .singleElement()
                .satisfies(location -> {
                    assertThat(location.getBackend()).isEqualTo("ns1-s1-80");
                    assertThat(location.isDefBackend()).isFalse();
                    assertThat(location.getResourceKey()).isEqualTo("ns1/foo");
                    assertThat(location.getPort()).isEqualTo("80");
                });
    }

    @Test
    void shouldKeepPlaceholderWhenNoRootPath() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/api", "s1", 80))));

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").getLocations())
                .extracting(Location::getPath, Location::getBackend, Location::isDefBackend)
                .containsExactly(
                        tuple("/", Names.DEFAULT_UPSTREAM_NAME, true),
                        tuple("/api", "ns1-s1-80", false));
    }

    @Test
    void ruleWithoutHostShouldBeServedByCatchAll() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule(null, path("/api", "s1", 80))));

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers).containsOnlyKeys(Names.CATCH_ALL_SERVER_NAME);
        assertThat(servers.get(Names.CATCH_ALL_SERVER_NAME).getLocations()).extracting(Location::getPath).containsExactly("/", "/api");
    }

    @Test
    void ruleLessDefaultBackendShouldOverrideCatchAllButKeepRedirect() {
        // Given
        RoutingResource catchAll = resource(catchAllIngress("catch-all", "s2", 80),
                AnnotationBundle.builder().redirect(new RedirectPolicy("https://example.com", 301, false)).backendProtocol("HTTPS").build());

        // When
        Map<String, Server> servers = build(catchAll);

        // Then
        Location root = servers.get(Names.CATCH_ALL_SERVER_NAME).rootLocation().orElseThrow();
        assertThat(root.getBackend()).isEqualTo("ns1-s2-80");
        assertThat(root.isDefBackend()).isFalse();
        assertThat(root.getResourceKey()).isEqualTo("ns1/catch-all");
        assertThat(root.getBackendProtocol()).isEqualTo("HTTPS");
        assertThat(root.getRedirect()).isEqualTo(RedirectPolicy.NONE);
    }

    @Test
    void lastRuleLessDefaultBackendShouldWin() {
        // Given
        RoutingResource first = resource(catchAllIngress("first", "s2", 80),
                AnnotationBundle.builder().backendProtocol("HTTPS").build());
        RoutingResource second = resource(catchAllIngress("second", "s3", 80),
                AnnotationBundle.builder().backendProtocol("GRPC").build());

        // When
        Map<String, Server> servers = build(first, second);

        // Then
        Location root = servers.get(Names.CATCH_ALL_SERVER_NAME).rootLocation().orElseThrow();
        assertThat(root.getBackend()).isEqualTo("ns1-s3-80");
        assertThat(root.getResourceKey()).isEqualTo("ns1/second");
        assertThat(root.getBackendProtocol()).isEqualTo("HTTPS");
    }

    @Test
    void canaryDefaultBackendShouldNotBecomePlaceholder() {
        // Given
        RoutingResource fooCanary = canary(ingress("foo-canary", rule("a.com", path("/", "s1", 80))));
        RoutingResource foo = resource(ingressBuilder("foo")
                .editSpec()
                .withDefaultBackend(Fixtures.backend("s1", 80))
                .withRules(rule("b.com", path("/y", "s2", 80)))
                .endSpec()
                .build());

        // When
        Map<String, Server> servers = build(fooCanary, foo);

        // Then
        assertThat(upstreams.get("ns1-s1-80").isNoServer()).isTrue();
        assertThat(servers.get("b.com").rootLocation()).get().extracting(Location::getBackend).isEqualTo(Names.DEFAULT_UPSTREAM_NAME);
        assertThat(servers.get(Names.CATCH_ALL_SERVER_NAME).rootLocation()).get().extracting(Location::getBackend).isEqualTo(Names.DEFAULT_UPSTREAM_NAME);
    }

    @Test
    void canaryDefaultBackendShouldNotOverrideCatchAll() {
        // Given
        RoutingResource fooCanary = canary(ingress("foo-canary", rule("a.com", path("/", "s1", 80))));
        RoutingResource catchAll = resource(catchAllIngress("catch-all", "s1", 80));

        // When
        Map<String, Server> servers = build(fooCanary, catchAll);

        // Then
        Location root = servers.get(Names.CATCH_ALL_SERVER_NAME).rootLocation().orElseThrow();
        assertThat(root.getBackend()).isEqualTo(Names.DEFAULT_UPSTREAM_NAME);
        assertThat(root.isDefBackend()).isTrue();
    }

    @Test
    void defaultBackendShouldBecomePlaceholderOfResourceServers() {
        // Given
        RoutingResource foo = resource(ingressBuilder("foo")
                .editSpec()
                .withDefaultBackend(Fixtures.backend("s2", 80))
                .withRules(rule("a.com", path("/api", "s1", 80)))
                .endSpec()
                .build());

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").rootLocation()).get().extracting(Location::getBackend).isEqualTo("ns1-s2-80");
        assertThat(servers.get(Names.CATCH_ALL_SERVER_NAME).rootLocation()).get().extracting(Location::getBackend).isEqualTo(Names.DEFAULT_UPSTREAM_NAME);
    }

    @Test
    void duplicateLocationShouldKeepFirstDefinition() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))));
        RoutingResource bar = resource(ingress("bar", rule("a.com", path("/", "s2", 80))));

        // When
        Map<String, Server> servers = build(foo, bar);

        // Then
        assertThat(servers.get("a.com").getLocations())
                .singleElement()
                .extracting(Location::getBackend)
                .isEqualTo("ns1-s1-80");
        assertThat(diagnostics.toList())
                .filteredOn(diagnostic -> diagnostic.kind() == Kind.DUPLICATE_LOCATION)
                .singleElement()
                .extracting(SynthesisDiagnostic::resource)
                .isEqualTo("ns1/bar");
    }

    @Test
    void samePathWithDifferentPathTypeShouldCreateTwoLocations() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com",
                path("/api", Names.PATH_TYPE_PREFIX, "s1", 80),
                path("/api", Names.PATH_TYPE_EXACT, "s2", 80))));

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").getLocations())
                .filteredOn(location -> location.getPath().equals("/api"))
                .extracting(Location::getPathType)
                .containsExactly(Names.PATH_TYPE_PREFIX, Names.PATH_TYPE_EXACT);
    }

    @Test
    void canaryResourcesShouldNotCreateServersOrLocations() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))));
        RoutingResource fooCanary = canary(ingress("foo-canary", rule("a.com", path("/", "s2", 80)), rule("b.com", path("/", "s2", 80))));

        // When
        Map<String, Server> servers = build(foo, fooCanary);

        // Then
        assertThat(servers).containsOnlyKeys(Names.CATCH_ALL_SERVER_NAME, "a.com");
        assertThat(servers.get("a.com").getLocations()).extracting(Location::getBackend).containsExactly("ns1-s1-80");
    }

    @Test
    void firstAliasesShouldWin() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))),
                AnnotationBundle.builder().aliases(List.of("www.a.com")).build());
        RoutingResource bar = resource(ingress("bar", rule("a.com", path("/bar", "s2", 80))),
                AnnotationBundle.builder().aliases(List.of("alt.a.com")).build());

        // When
        Map<String, Server> servers = build(foo, bar);

        // Then
        assertThat(servers.get("a.com").getAliases()).containsExactly("www.a.com");
        assertThat(diagnostics.toList())
                .filteredOn(diagnostic -> diagnostic.kind() == Kind.FIELD_CONFLICT)
                .singleElement()
                .satisfies(diagnostic -> assertThat(diagnostic.message()).contains("ALIASES", "a.com", "ns1/bar"));
    }

    @Test
    void aliasesShouldExcludeOwnHostAndOtherServers() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))),
                AnnotationBundle.builder().aliases(List.of("a.com", "b.com", "www.a.com")).build());
        RoutingResource bar = resource(ingress("bar", rule("b.com", path("/", "s2", 80))));

        // When
        Map<String, Server> servers = build(foo, bar);

        // Then
        assertThat(servers.get("a.com").getAliases()).containsExactly("www.a.com");
    }

    @Test
    void firstServerSnippetAndCiphersShouldWin() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))),
                AnnotationBundle.builder().serverSnippet("return 418;").sslCipher(new SslCipherPolicy("HIGH", null)).build());
        RoutingResource bar = resource(ingress("bar", rule("a.com", path("/bar", "s2", 80))),
                AnnotationBundle.builder().serverSnippet("return 503;").sslCipher(new SslCipherPolicy("LOW", "on")).build());

        // When
        Map<String, Server> servers = build(foo, bar);

        // Then
        Server server = servers.get("a.com");
        assertThat(server.getServerSnippet()).isEqualTo("return 418;");
        assertThat(server.getSslCiphers()).isEqualTo("HIGH");
        assertThat(server.getSslPreferServerCiphers()).isEqualTo("on");
    }

    @Test
    void fromToWwwRedirectShouldBeFlaggedOnServer() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))),
                AnnotationBundle.builder().redirect(new RedirectPolicy(null, 0, true)).build());

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").isRedirectFromToWWW()).isTrue();
    }

    @Test
    void cookieAffinityShouldRecordPathsForHostAndAliases() {
        // Given
        var cookie = new CookiePolicy("route", null, "3600", null, null, null, false, false);
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80), path("/app", "s1", 80))),
                AnnotationBundle.builder()
                        .aliases(List.of("www.a.com"))
                        .sessionAffinity(new SessionAffinityPolicy(SessionAffinityPolicy.COOKIE, "balanced", null, cookie))
                        .build());
        RoutingResource bar = resource(ingress("bar", rule("b.com", path("/", "s1", 80))),
                AnnotationBundle.builder()
                        .sessionAffinity(new SessionAffinityPolicy(SessionAffinityPolicy.COOKIE, "persistent", null,
                                new CookiePolicy("other", null, null, null, null, null, false, false)))
                        .build());

        // When
        build(foo, bar);

        // Then
        Backend backend = upstreams.get("ns1-s1-80");
        assertThat(backend.getSessionAffinity().getAffinityType()).isEqualTo(SessionAffinityPolicy.COOKIE);
        assertThat(backend.getSessionAffinity().getAffinityMode()).isEqualTo("balanced");
        CookieSessionAffinity affinity = backend.getSessionAffinity().getCookieSessionAffinity();
        assertThat(affinity.getName()).isEqualTo("route");
        assertThat(affinity.getMaxAge()).isEqualTo("3600");
        assertThat(affinity.getLocations())
                .containsEntry("a.com", List.of("/", "/app"))
                .containsEntry("www.a.com", List.of("/", "/app"))
                .containsEntry("b.com", List.of("/"));
    }

    @Test
    void cookieAffinityShouldRecordPathOfDuplicateLocation() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))));
        RoutingResource bar = resource(ingress("bar", rule("a.com", path("/", "s1", 80))),
                AnnotationBundle.builder()
                        .sessionAffinity(new SessionAffinityPolicy(SessionAffinityPolicy.COOKIE, "balanced", null,
                                new CookiePolicy("route", null, null, null, null, null, false, false)))
                        .build());

        // When
        Map<String, Server> servers = build(foo, bar);

        // Then
        assertThat(servers.get("a.com").getLocations()).singleElement().extracting(Location::getResourceKey).isEqualTo("ns1/foo");
        CookieSessionAffinity affinity = upstreams.get("ns1-s1-80").getSessionAffinity().getCookieSessionAffinity();
        assertThat(affinity.getName()).isEqualTo("route");
        assertThat(affinity.getLocations()).containsEntry("a.com", List.of("/"));
    }

    @Test
    void shouldSelectCertificateByExactHost() {
        // Given
        SSLCert cert = certificate("ns1/cert1", NOW.plus(Duration.ofDays(90)), "a.com");
        store.withCertificate("ns1/cert1", cert);
        RoutingResource foo = resource(ingressBuilder("foo")
                .editSpec()
                .withRules(rule("A.com", path("/", "s1", 80)))
                .withTls(tls("cert1", "a.com"))
                .endSpec()
                .build());

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("A.com").getSslCert()).isEqualTo(cert);
        assertThat(diagnostics.toList()).isEmpty();
    }

    @Test
    void shouldSelectCertificateBySubjectAlternativeName() {
        // Given
        SSLCert wildcard = certificate("ns1/wildcard", NOW.plus(Duration.ofDays(90)), "*.a.com");
        store.withCertificate("ns1/wildcard", wildcard);
        RoutingResource foo = resource(ingressBuilder("foo")
                .editSpec()
                .withRules(rule("api.a.com", path("/", "s1", 80)))
                .withTls(tls("wildcard"))
                .endSpec()
                .build());

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("api.a.com").getSslCert()).isEqualTo(wildcard);
    }

    @Test
    void certificateFailingHostnameValidationShouldFallBackToDefault() {
        // Given
        store.withCertificate("ns1/cert1", certificate("ns1/cert1", NOW.plus(Duration.ofDays(90)), "b.com"));
        RoutingResource foo = resource(ingressBuilder("foo")
                .editSpec()
                .withRules(rule("a.com", path("/", "s1", 80)))
                .withTls(tls("cert1", "a.com"))
                .endSpec()
                .build());

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").getSslCert()).isEqualTo(DEFAULT_CERTIFICATE);
        assertThat(diagnostics.toList()).extracting(SynthesisDiagnostic::kind).containsExactly(Kind.CERTIFICATE_FALLBACK);
    }

    @Test
    void expiringCertificateShouldBeReported() {
        // Given
        SSLCert expiring = certificate("ns1/cert1", NOW.plus(Duration.ofDays(5)), "a.com");
        store.withCertificate("ns1/cert1", expiring);
        RoutingResource foo = resource(ingressBuilder("foo")
                .editSpec()
                .withRules(rule("a.com", path("/", "s1", 80)))
                .withTls(tls("cert1", "a.com"))
                .endSpec()
                .build());

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").getSslCert()).isEqualTo(expiring);
        assertThat(diagnostics.toList()).extracting(SynthesisDiagnostic::kind).containsExactly(Kind.CERTIFICATE_EXPIRING);
    }

    @Test
    void resourceWithoutTlsShouldNotSelectCertificate() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))));

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").getSslCert()).isNull();
    }

    @Test
    void firstClientCertificateAuthShouldWin() {
        // Given
        var first = new ClientCertAuthPolicy("ns1/ca", "/etc/ingress/ns1-ca.pem", "on", 1, null, null);
        var second = new ClientCertAuthPolicy("ns1/other-ca", "/etc/ingress/ns1-other-ca.pem", "optional", 2, null, null);
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))), AnnotationBundle.builder().certificateAuth(first).build());
        RoutingResource bar = resource(ingress("bar", rule("a.com", path("/bar", "s2", 80))), AnnotationBundle.builder().certificateAuth(second).build());

        // When
        Map<String, Server> servers = build(foo, bar);

        // Then
        assertThat(servers.get("a.com").getCertificateAuth()).isEqualTo(first);
    }

    @Test
    void failedClientCertificateAuthShouldBeRecordedOnServer() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))),
                AnnotationBundle.builder().certificateAuth(ClientCertAuthPolicy.failed("secret ns1/ca not found")).build());

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").getAuthTlsError()).isEqualTo("secret ns1/ca not found");
        assertThat(servers.get("a.com").getCertificateAuth().isConfigured()).isFalse();
    }

    @Test
    void proxySslShouldStayOnLocationsWhenLocationOnly() {
        // Given
        cluster = new BackendConfiguration(false, null, null, null, true, false, null);
        var proxySsl = new ProxySslPolicy("ns1/backend-ca", "/etc/ingress/ns1-backend-ca.pem", "DEFAULT", "TLSv1.2", true);
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))), AnnotationBundle.builder().proxySsl(proxySsl).build());

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").getProxySsl()).isEqualTo(ProxySslPolicy.NONE);
        assertThat(servers.get("a.com").rootLocation()).get().extracting(Location::getProxySsl).isEqualTo(proxySsl);
    }

    @Test
    void proxySslShouldBeCopiedToServer() {
        // Given
        var proxySsl = new ProxySslPolicy("ns1/backend-ca", "/etc/ingress/ns1-backend-ca.pem", "DEFAULT", "TLSv1.2", true);
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))), AnnotationBundle.builder().proxySsl(proxySsl).build());

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").getProxySsl()).isEqualTo(proxySsl);
    }

    @Test
    void deniedResourceShouldDenyItsLocations() {
        // Given
        RoutingResource foo = resource(ingress("foo", rule("a.com", path("/", "s1", 80))),
                AnnotationBundle.builder().denied("auth secret ns1/htpasswd not found").build());

        // When
        Map<String, Server> servers = build(foo);

        // Then
        assertThat(servers.get("a.com").rootLocation()).get().extracting(Location::getDenied).isEqualTo("auth secret ns1/htpasswd not found");
    }

    private Map<String, Server> build(RoutingResource... resources) {
        List<RoutingResource> list = List.of(resources);
        Backend defaultUpstream = upstreamBuilder.buildDefaultUpstream(null, diagnostics);
        upstreams = upstreamBuilder.build(list, defaultUpstream, cluster, diagnostics);
        return serverBuilder.build(list, upstreams, defaultUpstream, cluster, DEFAULT_CERTIFICATE, diagnostics);
    }
}
