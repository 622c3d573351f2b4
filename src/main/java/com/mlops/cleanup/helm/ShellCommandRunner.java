package com.mlops.cleanup.helm;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands with a deadline. Output is captured through temp files
 * so a chatty process cannot block on a full pipe.
 */
@Slf4j
public class ShellCommandRunner {

    /**
     * @throws IOException if the process cannot be started or its output cannot be read
     */
    public ShellResponse run(List<String> command, Duration timeout) throws IOException {
        log.debug("Running command: {}", String.join(" ", command));

        File stdout = File.createTempFile("kcleanup-out", ".log");
        File stderr = File.createTempFile("kcleanup-err", ".log");
        try {
            ProcessBuilder pb = new ProcessBuilder(command)
                    .redirectOutput(stdout)
                    .redirectError(stderr);
            Process process = pb.start();

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for " + command.get(0), e);
            }

            ShellResponse response = new ShellResponse();
            if (!finished) {
                log.warn("Command '{}' did not finish within {}s, killing it", command.get(0), timeout.getSeconds());
                process.destroyForcibly();
                response.setCode(ShellResponse.ERROR_CODE_TIMED_OUT);
            } else {
                response.setCode(process.exitValue());
            }
            response.setOutput(Files.readString(stdout.toPath(), StandardCharsets.UTF_8));
            response.setError(Files.readString(stderr.toPath(), StandardCharsets.UTF_8));

            log.debug("Command '{}' exited with code {}", command.get(0), response.getCode());
            return response;
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private void deleteQuietly(File file) {
        if (!file.delete()) {
            log.debug("Could not delete temp file {}", file);
        }
    }
}
