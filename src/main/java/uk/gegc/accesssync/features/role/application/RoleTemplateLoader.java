package uk.gegc.accesssync.features.role.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.accesssync.features.role.domain.model.LabelledPermission;
import uk.gegc.accesssync.features.role.domain.model.PermissionCategory;
import uk.gegc.accesssync.features.role.domain.model.RoleTemplate;
import uk.gegc.accesssync.features.sheet.application.TabularSourceReader;
import uk.gegc.accesssync.features.sheet.domain.model.SheetData;
import uk.gegc.accesssync.features.sheet.domain.model.SheetRow;
import uk.gegc.accesssync.shared.exception.TemplateDefinitionException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads role templates, one per worksheet.
 * <p>
 * Only the first two columns are read. A row is either a {@code Name | <template>} declaration,
 * a category header (first cell only), a permission (label and value) within the current
 * category, or empty. The declared name must equal the sheet name.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoleTemplateLoader {

    static final String NAME_KEY = "Name";

    private final TabularSourceReader tabularSourceReader;

    public Map<String, RoleTemplate> load(Path workbookPath) {
        Map<String, RoleTemplate> templates = new LinkedHashMap<>();
        for (SheetData sheet : tabularSourceReader.read(workbookPath).sheets()) {
            RoleTemplate template = parseSheet(sheet);
            if (templates.containsKey(template.name())) {
                throw invalidSheet(sheet, "Role template with name '" + template.name() + "' already defined");
            }
            templates.put(template.name(), template);
            log.debug("Read role template '{}'", template.name());
        }
        return templates;
    }

    RoleTemplate parseSheet(SheetData sheet) {
        RoleTemplate.Builder builder = RoleTemplate.builder();
        PermissionCategory category = null;

        for (SheetRow row : sheet.allRows()) {
            String first = row.text(0);
            String second = row.text(1);

            if (NAME_KEY.equals(first)) {
                if (second == null) {
                    throw invalidDefinition(sheet, "Invalid 'Name' specification, value must be provided");
                }
                builder.name(second);
            } else if (first != null && second == null) {
                category = PermissionCategory.fromTitle(first)
                        .orElseThrow(() -> invalidDefinition(sheet, "Invalid permission category '" + first + "'"));
            } else if (first != null) {
                if (category == null) {
                    throw invalidDefinition(sheet, "Invalid attempt to specify permission '" + first
                            + "' (value '" + second + "') outside of a category");
                }
                PermissionCategory current = category;
                LabelledPermission permission = current.findPermission(first)
                        .orElseThrow(() -> invalidDefinition(sheet, "Invalid permission '" + first
                                + "' (value '" + second + "') in category '" + current.title() + "'"));
                builder.grant(current, permission, row.flag(1));
            } else if (second != null) {
                throw invalidSheet(sheet, "Invalid row contents at row " + row.rowNumber()
                        + " (<empty>, '" + second + "')");
            }
        }

        String name = builder.name();
        if (name == null) {
            throw invalidSheet(sheet, "Role template name must be specified");
        }
        if (!name.equals(sheet.name())) {
            throw invalidSheet(sheet, "Sheet name does not match role template name '" + name + "' specified");
        }
        return builder.build();
    }

    private static TemplateDefinitionException invalidDefinition(SheetData sheet, String detail) {
        return new TemplateDefinitionException("Failed to read '" + sheet.name() + "' role template definition", detail);
    }

    private static TemplateDefinitionException invalidSheet(SheetData sheet, String detail) {
        return new TemplateDefinitionException("Invalid role template definition in '" + sheet.name() + "' sheet", detail);
    }
}
