/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import io.fabric8.kubernetes.api.model.HasMetadata;

final class ResourceKeys {

    private ResourceKeys() {
    }

    /**
     * Qualifies a reference of the form {@code name} or {@code namespace/name} made by an annotation of
     * {@code resource}. An unqualified name refers to the resource's own namespace.
     *
     * @throws LocationDeniedException if the reference is malformed
     */
    static String qualify(String reference, HasMetadata resource) {
        String[] parts = reference.split("/", -1);
        if (parts.length == 1 && !parts[0].isEmpty()) {
            return resource.getMetadata().getNamespace() + "/" + parts[0];
        }
        if (parts.length == 2 && !parts[1].isEmpty()) {
            String namespace = parts[0].isEmpty() ? resource.getMetadata().getNamespace() : parts[0];
            return namespace + "/" + parts[1];
        }
        throw new LocationDeniedException("unexpected key format: '" + reference + "'");
    }
}
