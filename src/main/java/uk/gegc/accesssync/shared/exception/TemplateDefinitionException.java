package uk.gegc.accesssync.shared.exception;

/**
 * A role template worksheet is malformed: bad row shape, unknown category or permission,
 * missing or mismatched name, or a name defined twice.
 */
public class TemplateDefinitionException extends SyncException {

    public TemplateDefinitionException(String message, String detail) {
        super(message, detail);
    }
}
