package uk.gegc.accesssync.features.sync.infra;

import uk.gegc.accesssync.features.sync.application.ApprovalGate;
import uk.gegc.accesssync.features.sync.domain.model.ResourceKind;
import uk.gegc.accesssync.shared.exception.SyncException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Asks on the terminal. An empty answer means yes; end of input means no.
 */
public class ConsoleApprovalGate implements ApprovalGate {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleApprovalGate(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean approve(ResourceKind kind, long created, long updated) {
        while (true) {
            out.print("Are you sure you wish to synchronize " + kind.plural() + "? [Y/n] ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException ex) {
                throw new SyncException("Failed to read confirmation", ex.getMessage(), ex);
            }
            if (line == null) {
                out.println();
                return false;
            }
            switch (line.trim().toLowerCase(Locale.ROOT)) {
                case "", "y", "ye", "yes" -> {
                    return true;
                }
                case "n", "no" -> {
                    return false;
                }
                default -> out.println("Please respond with 'yes' or 'no' (or 'y' or 'n').");
            }
        }
    }
}
