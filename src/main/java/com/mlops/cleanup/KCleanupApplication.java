package com.mlops.cleanup;

import com.mlops.cleanup.cli.CommandLineInterface;
import com.mlops.cleanup.cli.ExitCode;
import lombok.extern.slf4j.Slf4j;

/**
 * Main application entry point for KCleanup
 * Finds and removes orphaned Kubernetes resources of the data/ML platform
 */
@Slf4j
public class KCleanupApplication {

    public static void main(String[] args) {
        CommandLineInterface cli = new CommandLineInterface();
        int exitCode;
        try {
            exitCode = cli.execute(args);
        } catch (RuntimeException e) {
            log.error("Error executing KCleanup", e);
            System.err.println("\n❌ Error: " + e.getMessage());
            exitCode = ExitCode.ABORTED.getCode();
        }
        if (!cli.isShuttingDown()) {
            System.exit(exitCode);
        }
    }
}
