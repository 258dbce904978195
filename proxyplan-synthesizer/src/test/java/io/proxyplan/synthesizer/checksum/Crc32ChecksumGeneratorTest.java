/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.checksum;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.proxyplan.synthesizer.config.BackendConfiguration;

import static org.assertj.core.api.Assertions.assertThat;

class Crc32ChecksumGeneratorTest {

    private static final BackendConfiguration CLUSTER = new BackendConfiguration(false, "ewma", "load_module", null, false, true, null);

    private Crc32ChecksumGenerator checksumGenerator;

    @BeforeEach
    void setUp() {
        checksumGenerator = new Crc32ChecksumGenerator();
    }

    @Test
    void shouldBase64EncodeChecksum() {
        // Given
        checksumGenerator.appendBackendConfiguration(CLUSTER);

        // When
        String encoded = checksumGenerator.encode();

        // Then
        assertThat(encoded)
                .isBase64()
                .satisfies(value -> Assertions.assertThatThrownBy(() -> assertThat(value).asLong()));
        // A raw long is a valid base64 string, this assertion ensures we haven't just returned a long
    }

    @Test
    void emptyInputShouldResultInUnspecifiedChecksum() {
        // When
        String checksum = checksumGenerator.encode();

        // Then
        assertThat(checksum).isEqualTo(ChecksumGenerator.NO_CHECKSUM_SPECIFIED);
    }

    @Test
    void shouldGenerateSameChecksumForEqualConfigurations() {
        // Given
        String checksumA = Crc32ChecksumGenerator.checksumOf(CLUSTER);

        // When
        String checksumB = Crc32ChecksumGenerator.checksumOf(new BackendConfiguration(false, "ewma", "load_module", null, false, true, null));

        // Then
        assertThat(checksumB)
                .isNotBlank()
                .isEqualTo(checksumA);
    }

    @Test
    void shouldIncludeEveryPolicyInChecksum() {
        // Given
        String checksum = Crc32ChecksumGenerator.checksumOf(CLUSTER);

        // When
        String updated = Crc32ChecksumGenerator.checksumOf(new BackendConfiguration(false, "ewma", "load_module", null, true, true, null));

        // Then
        assertThat(updated)
                .isNotBlank()
                .isNotEqualTo(checksum);
    }

    @Test
    void orderOfAppendedValuesShouldMatter() {
        // Given
        checksumGenerator.appendString("ewma");
        checksumGenerator.appendString("round_robin");
        var reversed = new Crc32ChecksumGenerator();

        // When
        reversed.appendString("round_robin");
        reversed.appendString("ewma");

        // Then
        assertThat(reversed.getValue())
                .isNotZero()
                .isNotEqualTo(checksumGenerator.getValue());
    }

    @Test
    void nullStringShouldNotChangeChecksum() {
        // Given
        checksumGenerator.appendString("round_robin");
        long before = checksumGenerator.getValue();

        // When
        checksumGenerator.appendString(null);

        // Then
        assertThat(checksumGenerator.getValue()).isEqualTo(before);
    }
}
