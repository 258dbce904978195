/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.render;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import io.proxyplan.api.Configuration;
import io.proxyplan.synthesizer.config.BackendConfiguration;
import io.proxyplan.synthesizer.spi.RenderException;
import io.proxyplan.synthesizer.spi.TemplateRenderer;
import io.proxyplan.tag.VisibleForTesting;

/**
 * Renders a configuration as a YAML document with two top-level sections, {@code backend}
 * holding the cluster wide backend configuration and {@code configuration} holding the
 * synthesised configuration.
 */
public class YamlConfigurationRenderer implements TemplateRenderer {

    private final ObjectMapper mapper = createObjectMapper();

    @Override
    public byte[] render(BackendConfiguration cluster, Configuration configuration) throws RenderException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("backend", cluster);
        document.put("configuration", configuration);
        try {
            return mapper.writeValueAsBytes(document);
        }
        catch (JsonProcessingException e) {
            throw new RenderException("Failed to render configuration: " + e.getMessage(), e);
        }
    }

    @VisibleForTesting
    static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
