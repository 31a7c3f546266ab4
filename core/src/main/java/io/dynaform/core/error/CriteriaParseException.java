package io.dynaform.core.error;

/**
 * Thrown by a criteria dialect when a fragment does not match its grammar. The criteria parser
 * catches it, logs it and turns it into a diagnostic; it never escapes a parse call.
 */
public final class CriteriaParseException extends FormLoadException {

    private static final long serialVersionUID = 1L;

    private final String fragment;

    public CriteriaParseException(String message, String fragment, String source) {
        super(message, null, source);
        this.fragment = fragment;
    }

    /** The criteria text that failed to parse. */
    public String fragment() {
        return fragment;
    }
}
