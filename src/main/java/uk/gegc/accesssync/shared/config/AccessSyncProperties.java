package uk.gegc.accesssync.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "access-sync")
public class AccessSyncProperties {

    @Valid
    @NotNull
    private Api api = new Api();

    /**
     * Directory holding the workbooks. The first non-option command line argument wins over this.
     */
    private String dataDir;

    @NotBlank(message = "Property access-sync.workspaces-file must be configured")
    private String workspacesFile = "workspaces.xlsx";

    @NotBlank(message = "Property access-sync.roles-file must be configured")
    private String rolesFile = "roles.xlsx";

    @NotBlank(message = "Property access-sync.users-directory must be configured")
    private String usersDirectory = "users";

    @Valid
    @NotNull
    private Columns columns = new Columns();

    /**
     * Apply changes without asking for confirmation.
     */
    private boolean assumeYes = false;

    /**
     * Colored console output.
     */
    private boolean color = true;

    @Data
    public static class Api {

        @NotBlank(message = "Property access-sync.api.url must be configured")
        private String url;

        @NotBlank(message = "Property access-sync.api.credentials must be configured")
        private String credentials;
    }

    @Data
    public static class Columns {

        @NotBlank
        private String workspaceSlug = "Slug";

        @NotBlank
        private String workspaceName = "Name";

        @NotBlank
        private String userWorkspace = "Workspace";

        @NotBlank
        private String userName = "Name";

        @NotBlank
        private String userEmail = "Email";

        @NotBlank
        private String userRole = "Role";

        @NotBlank
        private String userActive = "Active";
    }
}
