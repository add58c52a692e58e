package org.iceforge.pruner.cli;

import org.iceforge.pruner.run.DeletionConfirmation;
import org.iceforge.pruner.strategy.RetentionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Asks on the terminal before anything is deleted. Only an answer of {@code y} proceeds.
 */
public class ConsoleConfirmation implements DeletionConfirmation {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleConfirmation.class);

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmation() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleConfirmation(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean confirm(String prefix, RetentionDecision decision) {
        int delete = decision.delete().size();
        int total = delete + decision.keep().size();
        out.printf("This will delete %d of %d backups under '%s'. Do you want to proceed? (y)%n", delete, total, prefix);
        out.flush();

        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            logger.warn("Could not read confirmation, not deleting anything: {}", e.getMessage());
            return false;
        }
        boolean confirmed = answer != null && "y".equalsIgnoreCase(answer.trim());
        if (!confirmed) {
            logger.info("Deletion not confirmed (answer={})", answer == null ? "<end of input>" : "'" + answer + "'");
        }
        return confirmed;
    }
}
