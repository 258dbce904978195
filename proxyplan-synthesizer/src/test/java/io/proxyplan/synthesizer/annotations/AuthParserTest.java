/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;

import io.proxyplan.api.policy.AuthPolicy;
import io.proxyplan.synthesizer.InMemoryResourceStore;

import static io.proxyplan.synthesizer.Fixtures.ingressWithAnnotations;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthParserTest {

    private static final String PREFIX = "nginx.ingress.kubernetes.io/";

    private final InMemoryResourceStore store = new InMemoryResourceStore();
    private final AuthParser parser = new AuthParser(new AnnotationReader("nginx.ingress.kubernetes.io"), store);

    @Test
    void noAuthTypeShouldMeanNoAuth() {
        assertThat(parser.parse(ingressWithAnnotations("foo", Map.of()))).isEqualTo(AuthPolicy.NONE);
    }

    @Test
    void shouldReferenceAuthFileSecret() {
        // Given
        store.withSecret("ns1/basic-auth", secret("auth", "Zm9vOiRhcHIx"));
        Ingress foo = annotated(Map.of("auth-type", "basic", "auth-secret", "basic-auth", "auth-realm", "Authentication Required"));

        // When
        AuthPolicy auth = parser.parse(foo);

        // Then
        assertThat(auth).isEqualTo(new AuthPolicy("basic", "Authentication Required", "ns1/basic-auth", AuthParser.AUTH_FILE, true));
    }

    @Test
    void authMapSecretShouldAcceptAnyKey() {
        // Given
        store.withSecret("ns2/users", secret("alice", "c2VjcmV0"));
        Ingress foo = annotated(Map.of("auth-type", "digest", "auth-secret", "ns2/users", "auth-secret-type", "auth-map"));

        // When
        AuthPolicy auth = parser.parse(foo);

        // Then
        assertThat(auth.secret()).isEqualTo("ns2/users");
        assertThat(auth.secretType()).isEqualTo(AuthParser.AUTH_MAP);
    }

    @Test
    void unknownAuthTypeShouldDenyAccess() {
        // Given
        Ingress foo = annotated(Map.of("auth-type", "oauth", "auth-secret", "basic-auth"));

        // When / Then
        assertThatThrownBy(() -> parser.parse(foo))
                .isInstanceOf(LocationDeniedException.class)
                .hasMessage("invalid authentication type");
    }

    @Test
    void missingSecretNameShouldDenyAccess() {
        // Given
        Ingress foo = annotated(Map.of("auth-type", "basic"));

        // When / Then
        assertThatThrownBy(() -> parser.parse(foo))
                .isInstanceOf(LocationDeniedException.class)
                .hasMessage("error reading secret name from annotation nginx.ingress.kubernetes.io/auth-secret");
    }

    @Test
    void unknownSecretShouldDenyAccess() {
        // Given
        Ingress foo = annotated(Map.of("auth-type", "basic", "auth-secret", "basic-auth"));

        // When / Then
        assertThatThrownBy(() -> parser.parse(foo))
                .isInstanceOf(LocationDeniedException.class)
                .hasMessage("unexpected error reading secret ns1/basic-auth");
    }

    @Test
    void authFileSecretWithoutAuthKeyShouldDenyAccess() {
        // Given
        store.withSecret("ns1/basic-auth", secret("users", "Zm9v"));
        Ingress foo = annotated(Map.of("auth-type", "basic", "auth-secret", "basic-auth"));

        // When / Then
        assertThatThrownBy(() -> parser.parse(foo))
                .isInstanceOf(LocationDeniedException.class)
                .hasMessage("the secret ns1/basic-auth does not contain a key with value auth");
    }

    @Test
    void unknownSecretTypeShouldDenyAccess() {
        // Given
        store.withSecret("ns1/basic-auth", secret("auth", "Zm9v"));
        Ingress foo = annotated(Map.of("auth-type", "basic", "auth-secret", "basic-auth", "auth-secret-type", "htpasswd"));

        // When / Then
        assertThatThrownBy(() -> parser.parse(foo))
                .isInstanceOf(LocationDeniedException.class)
                .hasMessageStartingWith("invalid auth-secret-type in annotation");
    }

    private static Ingress annotated(Map<String, String> annotations) {
        Map<String, String> prefixed = new HashMap<>();
        annotations.forEach((name, value) -> prefixed.put(PREFIX + name, value));
        return ingressWithAnnotations("foo", prefixed);
    }

    private static Secret secret(String key, String value) {
        return new SecretBuilder()
                .withNewMetadata().endMetadata()
                .withData(Map.of(key, value))
                .build();
    }
}
