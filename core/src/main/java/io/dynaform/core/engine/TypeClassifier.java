package io.dynaform.core.engine;

import io.dynaform.core.model.FieldKind;
import java.util.Locale;
import java.util.Map;

/**
 * Maps raw metadata type tags to a {@link FieldKind}. Total: unknown, blank and {@code null} tags
 * become {@link FieldKind#OTHER}.
 *
 * <p>Thread-safe and stateless.
 */
public final class TypeClassifier {

    private static final Map<String, FieldKind> KINDS_BY_TAG = Map.ofEntries(
            Map.entry("text", FieldKind.TEXT),
            Map.entry("string", FieldKind.TEXT),
            Map.entry("textarea", FieldKind.TEXTAREA),
            Map.entry("longtext", FieldKind.TEXTAREA),
            Map.entry("number", FieldKind.NUMBER),
            Map.entry("double", FieldKind.NUMBER),
            Map.entry("currency", FieldKind.NUMBER),
            Map.entry("percent", FieldKind.NUMBER),
            Map.entry("date", FieldKind.DATE),
            Map.entry("datetime", FieldKind.DATETIME),
            Map.entry("checkbox", FieldKind.CHECKBOX),
            Map.entry("boolean", FieldKind.CHECKBOX),
            Map.entry("picklist", FieldKind.PICKLIST));

    private TypeClassifier() {}

    /**
     * Classifies a raw type tag. Matching is case-insensitive and ignores surrounding whitespace.
     *
     * @param rawType the type tag from metadata, may be {@code null}
     * @return the field kind, never {@code null}
     */
    public static FieldKind classify(String rawType) {
        if (rawType == null) {
            return FieldKind.OTHER;
        }
        return KINDS_BY_TAG.getOrDefault(rawType.trim().toLowerCase(Locale.ROOT), FieldKind.OTHER);
    }
}
