package uk.gegc.accesssync.features.role.domain.model;

import java.math.BigInteger;
import java.util.*;

/**
 * Permission document of a role in canonical form. Workspace entries are kept in identifier order
 * so two documents compare equal regardless of the order their entries were added or received in.
 */
public record PermissionDocument(
        Map<OrganizationPermission, Boolean> organization,
        List<WorkspacePermissions> workspaces
) {

    /**
     * Numeric identifiers sort first, by value; all other identifiers follow in lexical order.
     */
    public static final Comparator<String> IDENTIFIER_ORDER = (left, right) -> {
        boolean leftNumeric = isNumeric(left);
        boolean rightNumeric = isNumeric(right);
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        if (leftNumeric) {
            int byValue = new BigInteger(left).compareTo(new BigInteger(right));
            if (byValue != 0) {
                return byValue;
            }
        }
        return left.compareTo(right);
    };

    public PermissionDocument {
        organization = organization.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(organization));
        List<WorkspacePermissions> sorted = new ArrayList<>(workspaces);
        sorted.sort(Comparator.comparing(WorkspacePermissions::workspaceId, IDENTIFIER_ORDER));
        workspaces = List.copyOf(sorted);
    }

    public Optional<WorkspacePermissions> findWorkspace(String workspaceId) {
        return workspaces.stream()
                .filter(entry -> entry.workspaceId().equals(workspaceId))
                .findFirst();
    }

    private static boolean isNumeric(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }
}
