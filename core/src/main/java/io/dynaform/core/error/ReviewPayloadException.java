package io.dynaform.core.error;

/** Thrown when a serialized review payload cannot be read or written. */
public final class ReviewPayloadException extends FormLoadException {

    private static final long serialVersionUID = 1L;

    public ReviewPayloadException(String message, Throwable cause, String formId) {
        super(message, cause, formId, "review-payload");
    }
}
