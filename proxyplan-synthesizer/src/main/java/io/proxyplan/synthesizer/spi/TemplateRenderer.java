/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.spi;

import io.proxyplan.api.Configuration;
import io.proxyplan.synthesizer.config.BackendConfiguration;

/**
 * Renders a configuration into the artifact loaded by the proxy.
 */
@FunctionalInterface
public interface TemplateRenderer {

    byte[] render(BackendConfiguration clusterConfiguration, Configuration configuration) throws RenderException;
}
