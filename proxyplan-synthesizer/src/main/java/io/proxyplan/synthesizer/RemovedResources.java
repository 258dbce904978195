/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import io.proxyplan.api.Configuration;
import io.proxyplan.api.Location;
import io.proxyplan.api.Server;

/**
 * Compares two configurations to find the routing resources that no longer contribute a location.
 */
public final class RemovedResources {

    private RemovedResources() {
    }

    /**
     * @return the sorted keys of the resources that own a location of {@code previous} but none of {@code next}
     */
    public static List<String> between(Configuration previous, Configuration next) {
        Set<String> removed = resourceKeys(previous);
        removed.removeAll(resourceKeys(next));
        return List.copyOf(removed);
    }

    private static Set<String> resourceKeys(Configuration configuration) {
        Set<String> keys = new TreeSet<>();
        for (Server server : configuration.servers()) {
            server.getLocations().stream()
                    .map(Location::getResourceKey)
                    .filter(Objects::nonNull)
                    .forEach(keys::add);
        }
        return keys;
    }
}
