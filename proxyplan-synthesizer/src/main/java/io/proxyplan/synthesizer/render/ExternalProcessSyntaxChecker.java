/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.render;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.proxyplan.synthesizer.spi.SyntaxCheckException;
import io.proxyplan.synthesizer.spi.SyntaxChecker;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Checks a rendered configuration by running an external command against it, for example
 * {@code nginx -c {} -t}. The artifact is written to a temporary file whose path replaces every
 * {@value #FILE_PLACEHOLDER} argument. A non-zero exit status fails the check with the merged
 * output of the command.
 */
public class ExternalProcessSyntaxChecker implements SyntaxChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExternalProcessSyntaxChecker.class);

    public static final String FILE_PLACEHOLDER = "{}";

    private final List<String> command;

    public ExternalProcessSyntaxChecker(List<String> command) {
        if (Objects.requireNonNull(command).isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public void check(byte[] rendered) throws SyntaxCheckException {
        Path file = null;
        try {
            file = Files.createTempFile("proxyplan-", ".conf");
            Files.write(file, rendered);
            String path = file.toString();
            List<String> arguments = command.stream().map(argument -> argument.replace(FILE_PLACEHOLDER, path)).toList();
            LOGGER.debug("Checking rendered configuration with {}", arguments);
            var processBuilder = new ProcessBuilder(arguments);
            processBuilder.redirectErrorStream(true);
            Process process = processBuilder.start();
            String output;
            try (InputStream stdout = process.getInputStream()) {
                output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new SyntaxCheckException("Configuration check exited with status " + exitCode + ": " + output.strip());
            }
        }
        catch (IOException e) {
            throw new SyntaxCheckException("Failed to run configuration check: " + e.getMessage(), e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyntaxCheckException("Interrupted while waiting for the configuration check", e);
        }
        finally {
            deleteQuietly(file);
        }
    }

    private static void deleteQuietly(@Nullable Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        }
        catch (IOException e) {
            LOGGER.atWarn()
                    .addKeyValue("file", file)
                    .setCause(e)
                    .log("Failed to delete temporary configuration file");
        }
    }
}
