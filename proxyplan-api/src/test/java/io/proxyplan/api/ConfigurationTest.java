/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationTest {

    @Test
    void hostsShouldIncludeAliasesInOrder() {
        // Given
        var catchAll = new Server(Names.CATCH_ALL_SERVER_NAME);
        var foo = new Server("foo.com");
        foo.setAliases(List.of("www.foo.com", "bar.com"));

        // When
        var configuration = new Configuration(List.of(), List.of(foo, catchAll), List.of(), List.of(), List.of(), "12345", null, List.of());

        // Then
        assertThat(configuration.hosts()).containsExactly("_", "bar.com", "foo.com", "www.foo.com");
    }

    @Test
    void listsShouldBeCopied() {
        // Given
        var servers = new ArrayList<Server>();
        servers.add(new Server("foo.com"));
        var configuration = new Configuration(List.of(), servers, List.of(), List.of(), List.of(), "12345", null, List.of());

        // When
        servers.clear();

        // Then
        assertThat(configuration.servers()).hasSize(1);
    }
}
