package com.mlops.cleanup.gate;

import com.mlops.cleanup.model.CleanupPlan;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Asks on the terminal. Only "y" or "yes" proceeds; anything else, including end of input, declines.
 */
@Slf4j
public class ConsoleConfirmationGate implements ConfirmationGate {

    static final String PROMPT = "Are you sure you want to continue? (y/N) ";

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationGate(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean confirm(CleanupPlan plan) {
        out.println();
        out.printf("⚠️  %d resources will be permanently deleted.%n", plan.size());
        out.print(PROMPT);
        out.flush();

        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            log.warn("Could not read confirmation from the terminal: {}", e.getMessage());
            return false;
        }
        if (answer == null) {
            out.println();
            return false;
        }
        String normalized = answer.trim().toLowerCase(Locale.ROOT);
        return "y".equals(normalized) || "yes".equals(normalized);
    }
}
