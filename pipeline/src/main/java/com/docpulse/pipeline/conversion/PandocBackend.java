package com.docpulse.pipeline.conversion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@code pandoc} binary to produce GitHub-flavoured markdown. Only
 * available when the binary can be launched.
 */
public class PandocBackend implements ConversionBackend {

    private static final Logger logger = LoggerFactory.getLogger(PandocBackend.class);

    // pandoc's exit code for an input format it has no reader for, e.g. PDF
    private static final int UNKNOWN_READER_EXIT = 21;

    private final String executable;
    private final Duration timeout;

    public PandocBackend() {
        this("pandoc", Duration.ofMinutes(2));
    }

    public PandocBackend(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    @Override
    public BackendType type() {
        return BackendType.PANDOC;
    }

    @Override
    public boolean isAvailable() {
        try {
            Process process = new ProcessBuilder(executable, "--version")
                    .redirectErrorStream(true)
                    .start();
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            logger.debug("pandoc not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String convert(Path source) throws IOException, InterruptedException {
        Process process;
        try {
            process = new ProcessBuilder(List.of(executable, source.toString(), "-t", "gfm", "--wrap=none"))
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new BackendUnavailableException("pandoc could not be started", e);
        }

        String output;
        try (InputStream stdout = process.getInputStream()) {
            output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
        }

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IOException("pandoc timed out after " + timeout.toSeconds() + "s on " + source);
        }
        if (process.exitValue() == UNKNOWN_READER_EXIT) {
            throw new BackendUnavailableException("pandoc cannot read " + source.getFileName());
        }
        if (process.exitValue() != 0) {
            throw new IOException("pandoc exited with " + process.exitValue() + " on " + source);
        }
        return output;
    }
}
