package io.dynaform.core.error;

/**
 * Abstract base for all dynaform exceptions. Never thrown directly; use the concrete subclasses
 * under {@link FormLoadException}.
 *
 * <p>Visibility passes never throw: resolution and coercion failures are reported as outcomes with
 * a diagnostic detail, so every exception in this hierarchy belongs to loading, parsing or payload
 * handling.
 */
public abstract class FormException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String formId;

    protected FormException(String message, String formId) {
        super(message);
        this.formId = formId;
    }

    protected FormException(String message, Throwable cause, String formId) {
        super(message, cause);
        this.formId = formId;
    }

    /** The form that triggered the error, or {@code null} if not yet identified. */
    public String formId() {
        return formId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
