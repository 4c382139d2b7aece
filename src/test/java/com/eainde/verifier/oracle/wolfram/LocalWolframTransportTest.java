package com.eainde.verifier.oracle.wolfram;

import com.eainde.verifier.oracle.OracleTransportException;
import com.eainde.verifier.oracle.OracleUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LocalWolframTransportTest {

    @TempDir
    Path dir;

    private Path script(String name, String body) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, "#!/bin/sh\n" + body + "\n");
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file;
    }

    @Nested
    @DisplayName("Executable resolution")
    @EnabledOnOs({OS.LINUX, OS.MAC})
    class ExecutableResolution {

        @Test
        @DisplayName("should prefer the configured path")
        void configured() throws Exception {
            Path exe = script("my-wolfram", "echo True");

            assertThat(LocalWolframTransport.resolveExecutable(exe.toString(), Map.of())).isEqualTo(exe);
        }

        @Test
        @DisplayName("should fall back to $WOLFRAMSCRIPT and then to PATH")
        void environment() throws Exception {
            Path exe = script("wolframscript", "echo True");

            assertThat(LocalWolframTransport.resolveExecutable(null, Map.of("WOLFRAMSCRIPT", exe.toString())))
                    .isEqualTo(exe);
            assertThat(LocalWolframTransport.resolveExecutable("", Map.of("PATH", dir.toString())))
                    .isEqualTo(exe);
        }

        @Test
        @DisplayName("should fail construction when nothing is executable")
        void missing() {
            String nowhere = dir.resolve("absent").toString();

            // skipped on machines that really have wolframscript installed
            assumeTrue(
                    LocalWolframTransport.WELL_KNOWN_LOCATIONS.stream().noneMatch(p -> Files.isExecutable(Path.of(p))));
            assertThatThrownBy(() -> LocalWolframTransport.resolveExecutable(nowhere, Map.of("PATH", nowhere)))
                    .isInstanceOf(OracleUnavailableException.class);
        }
    }

    @Nested
    @DisplayName("Execution")
    @EnabledOnOs({OS.LINUX, OS.MAC})
    class Execution {

        @Test
        @DisplayName("should pass the program after -code and return trimmed stdout")
        void runs() throws Exception {
            Path exe = script("echo-code", "echo \"$1 $2\"");

            String output = new LocalWolframTransport(exe, Duration.ofSeconds(10)).execute("1+1");

            assertThat(output).isEqualTo("-code 1+1");
        }

        @Test
        @DisplayName("should report a non-zero exit with its stderr")
        void failure() throws Exception {
            Path exe = script("broken", "echo 'license expired' >&2\nexit 3");

            assertThatThrownBy(() -> new LocalWolframTransport(exe, Duration.ofSeconds(10)).execute("1+1"))
                    .isInstanceOf(OracleTransportException.class)
                    .hasMessageContaining("3")
                    .hasMessageContaining("license expired");
        }

        @Test
        @DisplayName("should kill a run exceeding the timeout")
        void timeout() throws Exception {
            Path exe = script("slow", "sleep 5");

            assertThatThrownBy(() -> new LocalWolframTransport(exe, Duration.ofMillis(200)).execute("1+1"))
                    .isInstanceOf(OracleTransportException.class)
                    .hasMessageContaining("timed out");
        }
    }
}
