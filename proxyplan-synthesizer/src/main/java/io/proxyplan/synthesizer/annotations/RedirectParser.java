/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.proxyplan.api.policy.RedirectPolicy;

/**
 * Reads the temporal, permanent and from-to-www redirect annotations. A temporal redirect
 * takes precedence over a permanent one.
 */
public class RedirectParser implements AnnotationParser<RedirectPolicy> {

    private final AnnotationReader reader;

    public RedirectParser(AnnotationReader reader) {
        this.reader = Objects.requireNonNull(reader);
    }

    @Override
    public RedirectPolicy parse(HasMetadata resource) {
        boolean fromToWww = reader.bool(resource, "from-to-www-redirect").orElse(false);

        Optional<String> temporal = reader.string(resource, "temporal-redirect");
        if (temporal.isPresent()) {
            checkUrl("temporal-redirect", temporal.get());
            return new RedirectPolicy(temporal.get(), RedirectPolicy.DEFAULT_TEMPORAL_CODE, fromToWww);
        }

        Optional<String> permanent = reader.string(resource, "permanent-redirect");
        if (permanent.isPresent()) {
            checkUrl("permanent-redirect", permanent.get());
            int code = reader.integer(resource, "permanent-redirect-code")
                    .filter(c -> c >= 300 && c <= 308)
                    .orElse(RedirectPolicy.DEFAULT_PERMANENT_CODE);
            return new RedirectPolicy(permanent.get(), code, fromToWww);
        }

        return fromToWww ? new RedirectPolicy(null, 0, true) : RedirectPolicy.NONE;
    }

    private void checkUrl(String name, String url) {
        try {
            String scheme = new URI(url).getScheme();
            if (scheme == null || !scheme.startsWith("http")) {
                throw new InvalidAnnotationException(reader.key(name) + ": only http and https URLs are valid, was '" + url + "'");
            }
        }
        catch (URISyntaxException e) {
            throw new InvalidAnnotationException(reader.key(name) + ": '" + url + "' is not a URL", e);
        }
    }
}
