package uk.gegc.accesssync.features.role.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.role.domain.model.OrganizationPermission;
import uk.gegc.accesssync.features.role.domain.model.PermissionDocument;
import uk.gegc.accesssync.features.role.domain.model.WorkspacePermission;
import uk.gegc.accesssync.features.role.domain.model.WorkspacePermissions;

import java.util.*;

/**
 * Converts between {@link PermissionDocument} and the remote JSON form:
 * <pre>
 * { "create_api_keys": false, ..., "workspaces": [ { "id": "...", "read_patients": true, ... } ],
 *   "private": false, "user": null }
 * </pre>
 * {@code private} and {@code user} are remote bookkeeping; they are dropped when reading and written
 * with their defaults on update.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PermissionDocumentMapper {

    static final String WORKSPACES = "workspaces";
    static final String ID = "id";
    static final String PRIVATE = "private";
    static final String USER = "user";

    private final ObjectMapper objectMapper;

    public ObjectNode toJson(PermissionDocument document) {
        ObjectNode node = objectMapper.createObjectNode();
        document.organization().forEach((permission, value) -> node.put(permission.key(), value));
        ArrayNode workspaces = node.putArray(WORKSPACES);
        for (WorkspacePermissions entry : document.workspaces()) {
            ObjectNode workspace = workspaces.addObject();
            workspace.put(ID, entry.workspaceId());
            entry.flags().forEach((permission, value) -> workspace.put(permission.key(), value));
        }
        return node;
    }

    /**
     * Document for an update write, with the bookkeeping fields reset.
     */
    public ObjectNode toUpdateJson(PermissionDocument document) {
        ObjectNode node = toJson(document);
        node.put(PRIVATE, false);
        node.putNull(USER);
        return node;
    }

    public PermissionDocument fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new PermissionDocument(Map.of(), List.of());
        }
        ObjectNode stripped = ((ObjectNode) node).deepCopy();
        stripped.remove(PRIVATE);
        stripped.remove(USER);

        Map<OrganizationPermission, Boolean> organization = new EnumMap<>(OrganizationPermission.class);
        List<WorkspacePermissions> workspaces = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = stripped.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (WORKSPACES.equals(field.getKey())) {
                for (JsonNode entry : field.getValue()) {
                    workspaces.add(readWorkspace(entry));
                }
                continue;
            }
            Optional<OrganizationPermission> permission = OrganizationPermission.fromKey(field.getKey());
            if (permission.isPresent() && field.getValue().isBoolean()) {
                organization.put(permission.get(), field.getValue().booleanValue());
            } else {
                log.debug("Ignoring permission field '{}' = {}", field.getKey(), field.getValue());
            }
        }
        return new PermissionDocument(organization, workspaces);
    }

    private WorkspacePermissions readWorkspace(JsonNode entry) {
        Map<WorkspacePermission, Boolean> flags = new EnumMap<>(WorkspacePermission.class);
        Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (ID.equals(field.getKey())) {
                continue;
            }
            WorkspacePermission.fromKey(field.getKey())
                    .filter(permission -> field.getValue().isBoolean())
                    .ifPresentOrElse(
                            permission -> flags.put(permission, field.getValue().booleanValue()),
                            () -> log.debug("Ignoring workspace permission field '{}'", field.getKey()));
        }
        return new WorkspacePermissions(entry.path(ID).asText(), flags);
    }
}
