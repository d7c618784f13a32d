package com.patcharbiter.selector.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * Output goes to a temp file rather than a pipe so a chatty command can never
 * block on a full pipe buffer while we wait for it with a deadline.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Duration timeout) {
        Path outputFile = null;
        Process process = null;
        try {
            outputFile = Files.createTempFile("selector-cmd-", ".out");
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new SandboxException("Command timed out after " + timeout.toSeconds()
                        + "s: " + String.join(" ", command));
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            log.debug("'{}' exited with {}", String.join(" ", command), process.exitValue());
            return new CommandResult(process.exitValue(), output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SandboxException("Interrupted while running: " + String.join(" ", command), e);
        } catch (IOException e) {
            throw new SandboxException("Could not run: " + String.join(" ", command), e);
        } finally {
            if (outputFile != null) {
                try {
                    Files.deleteIfExists(outputFile);
                } catch (IOException e) {
                    log.warn("Could not delete temp file {}: {}", outputFile, e.getMessage());
                }
            }
        }
    }
}
