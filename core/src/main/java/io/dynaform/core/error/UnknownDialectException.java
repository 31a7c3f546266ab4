package io.dynaform.core.error;

/** Thrown when configuration names a criteria dialect that is not registered. */
public final class UnknownDialectException extends FormLoadException {

    private static final long serialVersionUID = 1L;

    public UnknownDialectException(String message, String source) {
        super(message, null, source);
    }
}
