package io.dynaform.core.model;

import java.util.Objects;

/**
 * One picklist choice. Options built from metadata carry identical label and value.
 *
 * @param label the text shown to the user
 * @param value the value stored when the option is chosen
 */
public record PickOption(String label, String value) {

    public PickOption {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /** Creates an option whose label and value are the same text. */
    public static PickOption of(String text) {
        return new PickOption(text, text);
    }
}
