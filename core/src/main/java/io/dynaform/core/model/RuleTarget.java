package io.dynaform.core.model;

import java.util.Objects;

/**
 * The field a criteria rule reads its value from. Two addressing schemes exist, one per criteria
 * dialect.
 */
public sealed interface RuleTarget {

    /** Short human-readable form used in diagnostics. */
    String describe();

    /**
     * Addresses a field by 1-based declaration position: the n-th section in the order sections
     * first appear in the metadata, and the m-th field declared in it.
     */
    record Positional(int sectionIndex, int fieldIndex) implements RuleTarget {
        public Positional {
            if (sectionIndex < 1 || fieldIndex < 1) {
                throw new IllegalArgumentException(
                        "Positional indices are 1-based, got: " + sectionIndex + "-" + fieldIndex);
            }
        }

        @Override
        public String describe() {
            return sectionIndex + "-" + fieldIndex;
        }
    }

    /** Addresses a field by section name and field api name (exact match). */
    record Named(String sectionName, String fieldName) implements RuleTarget {
        public Named {
            Objects.requireNonNull(sectionName, "sectionName must not be null");
            Objects.requireNonNull(fieldName, "fieldName must not be null");
        }

        @Override
        public String describe() {
            return "[" + sectionName + "].[" + fieldName + "]";
        }
    }
}
