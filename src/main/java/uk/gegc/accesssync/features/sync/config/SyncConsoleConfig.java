package uk.gegc.accesssync.features.sync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.accesssync.features.sync.application.ApprovalGate;
import uk.gegc.accesssync.features.sync.application.SyncReporter;
import uk.gegc.accesssync.features.sync.infra.AutoApprovalGate;
import uk.gegc.accesssync.features.sync.infra.ConsoleApprovalGate;
import uk.gegc.accesssync.features.sync.infra.ConsoleSyncReporter;
import uk.gegc.accesssync.shared.config.AccessSyncProperties;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

@Configuration
public class SyncConsoleConfig {

    @Bean
    public ApprovalGate approvalGate(AccessSyncProperties properties) {
        if (properties.isAssumeYes()) {
            return new AutoApprovalGate();
        }
        return new ConsoleApprovalGate(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    @Bean
    public SyncReporter syncReporter(AccessSyncProperties properties) {
        return new ConsoleSyncReporter(System.out, properties.isColor());
    }
}
