/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.spi;

import java.util.List;

import io.proxyplan.api.L4Service;
import io.proxyplan.api.StreamProtocol;

/**
 * Resolves the TCP or UDP services exposed through a config map.
 */
@FunctionalInterface
public interface StreamServiceResolver {

    StreamServiceResolver NONE = (configMapKey, protocol) -> List.of();

    /**
     * @param configMapKey {@code namespace/name} of the config map mapping ports to services
     * @param protocol protocol of the services
     * @return the exposed services, ordered by port
     */
    List<L4Service> resolve(String configMapKey, StreamProtocol protocol);
}
