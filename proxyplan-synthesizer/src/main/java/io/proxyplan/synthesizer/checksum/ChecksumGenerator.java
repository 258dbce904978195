/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.checksum;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.proxyplan.synthesizer.config.BackendConfiguration;
import io.proxyplan.synthesizer.config.ConfigParser;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Accumulates the inputs a configuration depends on into a short, stable checksum.
 */
public interface ChecksumGenerator {
    Logger LOGGER = LoggerFactory.getLogger(ChecksumGenerator.class);

    /**
     * Returned by {@link #encode()} when nothing has been appended.
     */
    String NO_CHECKSUM_SPECIFIED = "";

    /**
     * Appends the canonical YAML form of the cluster-wide backend policy.
     */
    default void appendBackendConfiguration(BackendConfiguration configuration) {
        String yaml = new ConfigParser().toYaml(configuration);
        LOGGER.debug("Appending backend configuration to checksum: {}", yaml);
        appendString(yaml);
    }

    /**
     * Appends a value, a null value leaves the checksum unchanged.
     */
    void appendString(@Nullable String value);

    String encode();
}
