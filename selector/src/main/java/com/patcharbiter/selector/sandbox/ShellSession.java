package com.patcharbiter.selector.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One live interactive shell attached to a sandbox container.
 *
 * Output framing: every command is followed by {@code printf '\n%s\n' <marker>},
 * which puts the marker on a line of its own even when the command's output
 * does not end in a newline. Reading stops at the marker line, at a shell
 * prompt, or at the deadline, and the text produced before that point is the
 * command's output. Commands run one at a time; a session is not shared
 * between threads.
 */
public class ShellSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ShellSession.class);

    private static final String MARKER_PREFIX = "__SELECTOR_DONE_";

    // Interactive bash prompts of the SWE-bench images.
    private static final Pattern PROMPT = Pattern.compile(
            "(?:swe-bench@[^\\n]*:[^\\n]*\\$ |root@[^\\n]*:[^\\n]*# )$");

    private static final Pattern BRACKETED_PASTE = Pattern.compile("\u001b\\[\\?2004[hl]");

    private static final long POLL_INTERVAL_MS = 50;

    private final Process      process;
    private final InputStream  stdout;
    private final OutputStream stdin;
    private final String       name;
    private boolean            closed;

    public ShellSession(Process process, String name) {
        this.process = process;
        this.stdout  = process.getInputStream();
        this.stdin   = process.getOutputStream();
        this.name    = name;
    }

    public boolean isAlive() {
        return !closed && process.isAlive();
    }

    /**
     * Run {@code command} and return its output.
     *
     * @throws ShellSessionException if the shell is gone, cannot be written to,
     *         or the calling thread is interrupted while waiting
     */
    public ShellOutput execute(String command, Duration timeout) {
        if (!isAlive()) {
            throw new ShellSessionException("Shell session " + name + " is not alive");
        }
        String marker = MARKER_PREFIX + UUID.randomUUID().toString().replace("-", "") + "__";
        discardPendingOutput();

        try {
            stdin.write((command + "\n" + "printf '\\n%s\\n' " + marker + "\n").getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        } catch (IOException e) {
            throw new ShellSessionException("Could not write to shell session " + name, e);
        }

        Pattern markerLine = Pattern.compile("(?:^|\\n)" + Pattern.quote(marker) + "\\r?(?:\\n|$)");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            readAvailable(buffer);
            String text = buffer.toString(StandardCharsets.UTF_8);

            // The match starts at the newline printed ahead of the marker, so the output ends before it.
            Matcher done = markerLine.matcher(text);
            if (done.find()) {
                return ShellOutput.completed(clean(text.substring(0, done.start())));
            }
            Matcher prompt = PROMPT.matcher(text);
            if (prompt.find()) {
                return ShellOutput.completed(clean(text.substring(0, prompt.start())));
            }
            if (!process.isAlive()) {
                throw new ShellSessionException("Shell session " + name + " exited with code "
                        + process.exitValue() + " while running: " + command);
            }
            if (System.nanoTime() > deadline) {
                log.warn("Command timed out after {}s in session {}: {}", timeout.toSeconds(), name, command);
                return ShellOutput.timedOut(command, timeout.toSeconds(), clean(text));
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ShellSessionException("Interrupted while waiting on session " + name, e);
            }
        }
    }

    /** Ask the shell to exit, then make sure it is gone. Safe to call twice. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (process.isAlive()) {
                stdin.write("exit\n".getBytes(StandardCharsets.UTF_8));
                stdin.flush();
                process.waitFor(5, TimeUnit.SECONDS);
            }
        } catch (IOException e) {
            log.debug("Shell session {} already closed its input: {}", name, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private void readAvailable(ByteArrayOutputStream buffer) {
        try {
            int available;
            byte[] chunk = new byte[8192];
            while ((available = stdout.available()) > 0) {
                int read = stdout.read(chunk, 0, Math.min(available, chunk.length));
                if (read < 0) {
                    return;
                }
                buffer.write(chunk, 0, read);
            }
        } catch (IOException e) {
            throw new ShellSessionException("Could not read from shell session " + name, e);
        }
    }

    // Output left over from an earlier timed-out command must not leak into the next one.
    private void discardPendingOutput() {
        ByteArrayOutputStream leftover = new ByteArrayOutputStream();
        readAvailable(leftover);
        if (leftover.size() > 0) {
            log.debug("Discarded {} stale bytes from session {}", leftover.size(), name);
        }
    }

    private static String clean(String raw) {
        String text = BRACKETED_PASTE.matcher(raw).replaceAll("").replace("\r", "");
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }
}
