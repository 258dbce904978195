/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.concurrent.NotThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import io.proxyplan.synthesizer.SynthesisDiagnostic.Kind;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Collects the diagnostics of one synthesis pass, logging each one at WARN as it is recorded.
 */
@NotThreadSafe
final class Diagnostics {

    private static final Logger LOGGER = LoggerFactory.getLogger(Diagnostics.class);

    private final List<SynthesisDiagnostic> recorded = new ArrayList<>();

    void warn(Kind kind, @Nullable String resource, String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        LOGGER.atWarn()
                .addKeyValue("kind", kind)
                .addKeyValue("resource", resource)
                .log(message);
        recorded.add(new SynthesisDiagnostic(kind, resource, message));
    }

    List<SynthesisDiagnostic> toList() {
        return List.copyOf(recorded);
    }
}
