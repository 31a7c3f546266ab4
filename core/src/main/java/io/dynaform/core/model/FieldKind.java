package io.dynaform.core.model;

import java.util.Locale;

/**
 * Semantic kind of a form field. Every field carries exactly one kind; raw type tags that match
 * none of the known kinds become {@link #OTHER}.
 */
public enum FieldKind {
    TEXT,
    TEXTAREA,
    NUMBER,
    DATE,
    DATETIME,
    CHECKBOX,
    PICKLIST,
    OTHER;

    /** Lower-case identifier used in review payloads, e.g. {@code "textarea"}. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
