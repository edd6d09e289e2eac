package uk.gegc.accesssync.features.sync.infra;

import uk.gegc.accesssync.features.role.domain.model.RemoteRole;
import uk.gegc.accesssync.features.sync.application.SyncReporter;
import uk.gegc.accesssync.features.sync.domain.model.ReconciliationAction;
import uk.gegc.accesssync.features.sync.domain.model.ResourceKind;
import uk.gegc.accesssync.features.sync.domain.model.SyncReport;
import uk.gegc.accesssync.features.user.domain.model.RemoteUser;
import uk.gegc.accesssync.features.workspace.domain.model.RemoteWorkspace;

import java.io.PrintStream;

/**
 * Writes progress to the terminal, optionally with ANSI colors.
 */
public class ConsoleSyncReporter implements SyncReporter {

    private static final String BLUE = "\033[94m";
    private static final String GREEN = "\033[92m";
    private static final String MAGENTA = "\033[95m";
    private static final String RED = "\033[91m";
    private static final String YELLOW = "\033[93m";
    private static final String RESET = "\033[00m";
    private static final String BELL = "\u0007";

    private final PrintStream out;
    private final boolean color;

    public ConsoleSyncReporter(PrintStream out, boolean color) {
        this.out = out;
        this.color = color;
    }

    @Override
    public void phase(String title) {
        println(MAGENTA, title);
    }

    @Override
    public void loaded(String what, int count) {
        println(GREEN, " Found " + count + " " + what);
    }

    @Override
    public void changesDetected(ResourceKind kind, long created, long updated) {
        println(YELLOW, String.format(" %s have changed (%d created, %d updated)", kind.title(), created, updated));
    }

    @Override
    public void progress(ResourceKind kind, ReconciliationAction action, String key, int done, int total) {
        String verb = action == ReconciliationAction.CREATE ? "Created" : "Updated";
        println(BLUE, String.format("  [%d/%d] %s %s '%s'", done, total, verb, kind.singular(), key));
    }

    @Override
    public void synchronizedKind(ResourceKind kind) {
        println(GREEN, " " + kind.title() + " successfully synchronized");
    }

    @Override
    public void upToDate(ResourceKind kind, int total) {
        println(GREEN, " All " + total + " " + kind.plural() + " are up to date");
    }

    @Override
    public void unknownResources(SyncReport report) {
        phase("Identifying Unknown Resources...");
        if (!report.unknownWorkspaces().isEmpty()) {
            println(YELLOW, " Identified " + report.unknownWorkspaces().size() + " unknown workspaces:");
            for (RemoteWorkspace workspace : report.unknownWorkspaces()) {
                out.println("  " + workspace.name() + " (" + workspace.slug() + ")");
            }
        }
        if (!report.unknownRoles().isEmpty()) {
            println(YELLOW, " Identified " + report.unknownRoles().size() + " unknown roles:");
            for (RemoteRole role : report.unknownRoles()) {
                out.println("  " + role.name());
            }
        }
        if (!report.unknownUsers().isEmpty()) {
            println(YELLOW, " Identified " + report.unknownUsers().size() + " unknown users:");
            for (RemoteUser user : report.unknownUsers()) {
                out.println("  " + user.name() + " (" + user.email() + ")");
            }
        }
    }

    @Override
    public void failure(String message, String detail) {
        println(RED, message);
        if (detail != null && !detail.isBlank()) {
            println(YELLOW, detail);
        }
        if (color) {
            out.print(BELL);
        }
        out.flush();
    }

    private void println(String ansi, String text) {
        out.println(color ? ansi + text + RESET : text);
    }
}
