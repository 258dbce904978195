/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.proxyplan.api.policy.CookiePolicy;
import io.proxyplan.api.policy.SessionAffinityPolicy;

import static io.proxyplan.synthesizer.Fixtures.ingressWithAnnotations;
import static org.assertj.core.api.Assertions.assertThat;

class SessionAffinityParserTest {

    private final SessionAffinityParser parser = new SessionAffinityParser(new AnnotationReader("nginx.ingress.kubernetes.io"));

    @Test
    void noAffinityAnnotationShouldMeanNoAffinity() {
        assertThat(parser.parse(ingressWithAnnotations("foo", Map.of()))).isEqualTo(SessionAffinityPolicy.NONE);
    }

    @Test
    void cookieAffinityShouldApplyDefaults() {
        // Given
        var foo = ingressWithAnnotations("foo", Map.of("nginx.ingress.kubernetes.io/affinity", "cookie"));

        // When
        SessionAffinityPolicy affinity = parser.parse(foo);

        // Then
        assertThat(affinity.isCookieBased()).isTrue();
        assertThat(affinity.mode()).isEqualTo(SessionAffinityParser.DEFAULT_MODE);
        assertThat(affinity.canaryBehavior()).isEqualTo(SessionAffinityParser.DEFAULT_CANARY_BEHAVIOR);
        assertThat(affinity.cookie().name()).isEqualTo(SessionAffinityParser.DEFAULT_COOKIE_NAME);
    }

    @Test
    void shouldReadCookieAttributes() {
        // Given
        var foo = ingressWithAnnotations("foo", Map.of(
                "nginx.ingress.kubernetes.io/affinity", "cookie",
                "nginx.ingress.kubernetes.io/affinity-mode", "persistent",
                "nginx.ingress.kubernetes.io/affinity-canary-behavior", "legacy",
                "nginx.ingress.kubernetes.io/session-cookie-name", "route",
                "nginx.ingress.kubernetes.io/session-cookie-max-age", "172800",
                "nginx.ingress.kubernetes.io/session-cookie-path", "/app",
                "nginx.ingress.kubernetes.io/session-cookie-samesite", "None",
                "nginx.ingress.kubernetes.io/session-cookie-conditional-samesite-none", "true"));

        // When
        SessionAffinityPolicy affinity = parser.parse(foo);

        // Then
        assertThat(affinity.mode()).isEqualTo("persistent");
        assertThat(affinity.isLegacyCanaryBehavior()).isTrue();
        assertThat(affinity.cookie()).isEqualTo(new CookiePolicy("route", null, "172800", null, "/app", "None", true, false));
    }

    @Test
    void unknownModeAndNonNumericExpiryShouldBeIgnored() {
        // Given
        var foo = ingressWithAnnotations("foo", Map.of(
                "nginx.ingress.kubernetes.io/affinity", "cookie",
                "nginx.ingress.kubernetes.io/affinity-mode", "sticky",
                "nginx.ingress.kubernetes.io/session-cookie-expires", "1h"));

        // When
        SessionAffinityPolicy affinity = parser.parse(foo);

        // Then
        assertThat(affinity.mode()).isEqualTo(SessionAffinityParser.DEFAULT_MODE);
        assertThat(affinity.cookie().expires()).isNull();
    }

    @Test
    void unsupportedTypeShouldCarryNoCookie() {
        // Given
        var foo = ingressWithAnnotations("foo", Map.of("nginx.ingress.kubernetes.io/affinity", "ip"));

        // When
        SessionAffinityPolicy affinity = parser.parse(foo);

        // Then
        assertThat(affinity.isCookieBased()).isFalse();
        assertThat(affinity.cookie()).isEqualTo(CookiePolicy.NONE);
    }
}
