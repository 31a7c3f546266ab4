package io.dynaform.core.error;

/**
 * Abstract parent for load-time errors: upstream metadata failures, malformed criteria text,
 * unknown dialects and unreadable review payloads. Carries a {@code source} field identifying the
 * record, criteria owner or resource that caused the error.
 */
public abstract class FormLoadException extends FormException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected FormLoadException(String message, String formId, String source) {
        super(message, formId);
        this.source = source;
    }

    protected FormLoadException(String message, Throwable cause, String formId, String source) {
        super(message, cause, formId);
        this.source = source;
    }

    /** The resource, record or criteria owner that caused the error. */
    public String source() {
        return source;
    }
}
