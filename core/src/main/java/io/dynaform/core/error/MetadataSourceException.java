package io.dynaform.core.error;

import java.util.List;

/**
 * Thrown by a {@link io.dynaform.core.spi.MetadataSource} when the upstream metadata query fails.
 * May carry several upstream error messages; {@link #detail()} joins them with {@code "; "}.
 */
public final class MetadataSourceException extends FormLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public MetadataSourceException(List<String> errors, String formId, String source) {
        super(String.join("; ", errors), formId, source);
        this.errors = List.copyOf(errors);
    }

    public MetadataSourceException(String message, Throwable cause, String formId, String source) {
        super(message, cause, formId, source);
        this.errors = List.of(message);
    }

    /** The individual upstream error messages, in the order reported. */
    public List<String> errors() {
        return errors;
    }
}
