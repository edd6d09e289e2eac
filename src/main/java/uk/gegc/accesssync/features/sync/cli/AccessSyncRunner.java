package uk.gegc.accesssync.features.sync.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import uk.gegc.accesssync.features.sync.application.AccessSynchronizer;
import uk.gegc.accesssync.features.sync.application.SyncReporter;
import uk.gegc.accesssync.features.sync.domain.model.SyncRequest;
import uk.gegc.accesssync.features.user.domain.model.UserColumns;
import uk.gegc.accesssync.features.workspace.domain.model.WorkspaceColumns;
import uk.gegc.accesssync.shared.config.AccessSyncProperties;
import uk.gegc.accesssync.shared.exception.SyncException;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one synchronization. The data directory is the first non-option argument, falling back to
 * {@code access-sync.data-dir}; everything else comes from {@link AccessSyncProperties}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessSyncRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_FAILURE = 1;
    static final String REMOTE_FAILURE = "Remote API request failed";

    private final AccessSynchronizer accessSynchronizer;
    private final AccessSyncProperties properties;
    private final SyncReporter reporter;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        try {
            accessSynchronizer.synchronize(toRequest(args.getNonOptionArgs()));
            exitCode = 0;
        } catch (SyncException ex) {
            log.debug("Synchronization failed", ex);
            reporter.failure(ex.getMessage(), ex.getDetail());
            exitCode = EXIT_FAILURE;
        } catch (RestClientException ex) {
            log.debug("Remote API response could not be processed", ex);
            reporter.failure(REMOTE_FAILURE, ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    SyncRequest toRequest(List<String> nonOptionArgs) {
        String dataDir = !nonOptionArgs.isEmpty() ? nonOptionArgs.get(0) : properties.getDataDir();
        if (dataDir == null || dataDir.isBlank()) {
            throw new SyncException("Missing data directory",
                    "Pass the directory containing workspace, role, and user records as the first argument");
        }
        Path data = Path.of(dataDir.trim());
        AccessSyncProperties.Columns columns = properties.getColumns();
        return new SyncRequest(
                data.resolve(properties.getWorkspacesFile()),
                data.resolve(properties.getRolesFile()),
                data.resolve(properties.getUsersDirectory()),
                new WorkspaceColumns(columns.getWorkspaceSlug(), columns.getWorkspaceName()),
                new UserColumns(columns.getUserWorkspace(), columns.getUserName(), columns.getUserEmail(),
                        columns.getUserRole(), columns.getUserActive()));
    }
}
