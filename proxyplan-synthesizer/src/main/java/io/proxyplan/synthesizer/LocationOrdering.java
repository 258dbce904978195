/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.Comparator;
import java.util.List;

import io.proxyplan.api.Location;

/**
 * Orders the locations of a server so that the longest path comes first, ties broken by
 * descending path. Longest prefix matching relies on this order.
 */
final class LocationOrdering {

    static final Comparator<Location> BY_PATH_DESCENDING = Comparator.comparing(Location::getPath).reversed();

    static final Comparator<Location> BY_LENGTH_DESCENDING = Comparator.comparingInt((Location location) -> location.getPath().length()).reversed();

    private LocationOrdering() {
    }

    /**
     * Sorts in place. Both sorts are stable, so the second preserves the order of the first among paths of equal length.
     */
    static void sort(List<Location> locations) {
        locations.sort(BY_PATH_DESCENDING);
        locations.sort(BY_LENGTH_DESCENDING);
    }
}
