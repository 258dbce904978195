/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.checksum;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.CRC32;

import javax.annotation.concurrent.NotThreadSafe;

import io.proxyplan.synthesizer.config.BackendConfiguration;
import io.proxyplan.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * CRC32 checksum, rendered as the unpadded base64 form of its eight big-endian bytes.
 */
@NotThreadSafe
public class Crc32ChecksumGenerator implements ChecksumGenerator {

    private static final Base64.Encoder ENCODER = Base64.getEncoder().withoutPadding();

    private final CRC32 crc = new CRC32();

    /**
     * @return the checksum of the given cluster-wide backend policy
     */
    public static String checksumOf(BackendConfiguration configuration) {
        var generator = new Crc32ChecksumGenerator();
        generator.appendBackendConfiguration(configuration);
        return generator.encode();
    }

    @Override
    public void appendString(@Nullable String value) {
        if (value != null) {
            crc.update(value.getBytes(StandardCharsets.UTF_8));
        }
    }

    @Override
    public String encode() {
        long value = crc.getValue();
        if (value == 0) {
            return NO_CHECKSUM_SPECIFIED;
        }
        return ENCODER.encodeToString(ByteBuffer.allocate(Long.BYTES).putLong(value).array());
    }

    @VisibleForTesting
    long getValue() {
        return crc.getValue();
    }
}
