package com.eainde.verifier.oracle.wolfram;

import com.eainde.verifier.oracle.OracleTransportException;
import com.eainde.verifier.oracle.OracleUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Launches {@code wolframscript -code <program>} once per request.
 *
 * <p>Dynamic-linker variables ({@code DYLD*}) are removed from the child
 * environment. A run exceeding the timeout is killed and reported as a
 * transport failure.</p>
 */
@Slf4j
public class LocalWolframTransport implements WolframTransport {

    static final List<String> WELL_KNOWN_LOCATIONS = List.of(
            "/Applications/Wolfram.app/Contents/MacOS/wolframscript",
            "/Applications/WolframScript.app/Contents/MacOS/wolframscript",
            "/Applications/Mathematica.app/Contents/MacOS/wolframscript",
            "/usr/local/bin/wolframscript",
            "/opt/homebrew/bin/wolframscript",
            "/usr/bin/wolframscript");

    private final Path executable;
    private final Duration timeout;

    public LocalWolframTransport(Path executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    /**
     * Resolves the executable from the configured path, {@code $WOLFRAMSCRIPT},
     * {@code $PATH} and the usual install locations, in that order.
     *
     * @throws OracleUnavailableException when none of them is executable
     */
    public static Path resolveExecutable(String configured, Map<String, String> environment) {
        List<String> candidates = new ArrayList<>();
        if (configured != null && !configured.isBlank()) {
            candidates.add(configured.trim());
        }
        String fromEnv = environment.get("WOLFRAMSCRIPT");
        if (fromEnv != null && !fromEnv.isBlank()) {
            candidates.add(fromEnv.trim());
        }
        String path = environment.get("PATH");
        if (path != null) {
            for (String dir : path.split(File.pathSeparator)) {
                if (!dir.isBlank()) {
                    candidates.add(Path.of(dir, "wolframscript").toString());
                }
            }
        }
        candidates.addAll(WELL_KNOWN_LOCATIONS);

        for (String candidate : candidates) {
            Path file = Path.of(candidate);
            if (Files.isRegularFile(file) && Files.isExecutable(file)) {
                return file;
            }
        }
        throw new OracleUnavailableException(
                "wolframscript not found. Set verifier.transport.executable or $WOLFRAMSCRIPT, or put it on PATH");
    }

    @Override
    public String execute(String code) throws OracleTransportException {
        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("wolfram-out", ".txt");
            stderr = Files.createTempFile("wolfram-err", ".txt");

            ProcessBuilder builder = new ProcessBuilder(executable.toString(), "-code", code)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            builder.environment().keySet().removeIf(key -> key.startsWith("DYLD"));

            log.debug("Running {} ({} chars of code)", executable, code.length());
            Process process = builder.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new OracleTransportException("wolframscript timed out after " + timeout.toSeconds() + "s");
            }
            int exit = process.exitValue();
            if (exit != 0) {
                String error = Files.readString(stderr, StandardCharsets.UTF_8).trim();
                throw new OracleTransportException("wolframscript exited with " + exit + ": " + error);
            }
            return Files.readString(stdout, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new OracleTransportException("Could not run " + executable + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleTransportException("Interrupted while waiting for wolframscript", e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    @Override
    public String describe() {
        return "local " + executable;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}", file, e);
        }
    }
}
