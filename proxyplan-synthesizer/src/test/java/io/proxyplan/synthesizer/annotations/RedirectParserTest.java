/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.proxyplan.api.policy.RedirectPolicy;

import static io.proxyplan.synthesizer.Fixtures.ingressWithAnnotations;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedirectParserTest {

    private final RedirectParser parser = new RedirectParser(new AnnotationReader("nginx.ingress.kubernetes.io"));

    @Test
    void noAnnotationShouldMeanNoRedirect() {
        assertThat(parser.parse(ingressWithAnnotations("foo", Map.of()))).isEqualTo(RedirectPolicy.NONE);
    }

    @Test
    void temporalRedirectShouldTakePrecedence() {
        // Given
        var foo = ingressWithAnnotations("foo", Map.of(
                "nginx.ingress.kubernetes.io/temporal-redirect", "https://example.com/maintenance",
                "nginx.ingress.kubernetes.io/permanent-redirect", "https://example.com"));

        // When
        RedirectPolicy redirect = parser.parse(foo);

        // Then
        assertThat(redirect).isEqualTo(new RedirectPolicy("https://example.com/maintenance", RedirectPolicy.DEFAULT_TEMPORAL_CODE, false));
    }

    @Test
    void permanentRedirectShouldUseConfiguredCode() {
        // Given
        var foo = ingressWithAnnotations("foo", Map.of(
                "nginx.ingress.kubernetes.io/permanent-redirect", "https://example.com",
                "nginx.ingress.kubernetes.io/permanent-redirect-code", "308"));

        // When / Then
        assertThat(parser.parse(foo).code()).isEqualTo(308);
    }

    @Test
    void outOfRangeCodeShouldFallBackToDefault() {
        // Given
        var foo = ingressWithAnnotations("foo", Map.of(
                "nginx.ingress.kubernetes.io/permanent-redirect", "https://example.com",
                "nginx.ingress.kubernetes.io/permanent-redirect-code", "200"));

        // When / Then
        assertThat(parser.parse(foo).code()).isEqualTo(RedirectPolicy.DEFAULT_PERMANENT_CODE);
    }

    @Test
    void nonHttpUrlShouldBeRejected() {
        // Given
        var foo = ingressWithAnnotations("foo", Map.of("nginx.ingress.kubernetes.io/permanent-redirect", "ftp://example.com"));

        // When / Then
        assertThatThrownBy(() -> parser.parse(foo))
                .isInstanceOf(InvalidAnnotationException.class)
                .hasMessageContaining("only http and https URLs are valid");
    }

    @Test
    void fromToWwwAloneShouldOnlyFlagRedirect() {
        // Given
        var foo = ingressWithAnnotations("foo", Map.of("nginx.ingress.kubernetes.io/from-to-www-redirect", "true"));

        // When
        RedirectPolicy redirect = parser.parse(foo);

        // Then
        assertThat(redirect.fromToWww()).isTrue();
        assertThat(redirect.url()).isNull();
    }
}
