package io.dynaform.core.engine;

import io.dynaform.core.engine.dialect.NameAddressedDialect;

/**
 * Core configuration for building and evaluating forms.
 *
 * <p>Immutable and thread-safe.
 *
 * @param dialect             id of the criteria dialect used for every criteria string of the form
 *                            (default: {@code "name"})
 * @param fallbackSectionName section assigned to records without a section name (default: {@code
 *                            "Other"})
 */
public record FormEngineOptions(String dialect, String fallbackSectionName) {

    /** Default options: name-addressed dialect, fallback section "Other". */
    public static final FormEngineOptions DEFAULT = new FormEngineOptions(NameAddressedDialect.ID, "Other");

    public FormEngineOptions {
        if (dialect == null || dialect.isBlank()) {
            throw new IllegalArgumentException("dialect must not be null or blank");
        }
        if (fallbackSectionName == null || fallbackSectionName.isBlank()) {
            throw new IllegalArgumentException("fallbackSectionName must not be null or blank");
        }
    }

    /** Returns a copy of these options using the given dialect. */
    public FormEngineOptions withDialect(String dialectId) {
        return new FormEngineOptions(dialectId, fallbackSectionName);
    }
}
