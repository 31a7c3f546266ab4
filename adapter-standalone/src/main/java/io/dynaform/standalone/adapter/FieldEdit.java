package io.dynaform.standalone.adapter;

import java.util.Objects;

/**
 * A value edit read from a metadata document.
 *
 * @param fieldApiName the edited field
 * @param value        a {@link String}, a {@link Boolean} for checkbox edits, or {@code null} to
 *                     clear
 */
public record FieldEdit(String fieldApiName, Object value) {

    public FieldEdit {
        Objects.requireNonNull(fieldApiName, "fieldApiName must not be null");
        if (value != null && !(value instanceof String) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Edit values must be strings or booleans: " + fieldApiName);
        }
    }
}
