package uk.gegc.accesssync.features.user.domain.model;

/**
 * Membership of a user in one workspace, with the role template it was declared with.
 *
 * @param sourceFile workbook the assignment was read from
 * @param rowNumber  row within that workbook's {@code Users} sheet
 */
public record WorkspaceAssignment(String workspaceSlug, String roleTemplateName, String sourceFile, int rowNumber) {
}
