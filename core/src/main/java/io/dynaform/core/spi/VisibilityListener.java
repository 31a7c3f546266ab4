package io.dynaform.core.spi;

/**
 * Observability hooks for the form lifecycle.
 *
 * <p>All methods receive immutable event objects. Implementations MUST be non-blocking.
 * Exceptions thrown by listeners are caught by the controller and logged; they do NOT affect
 * schema state or visibility. Every method has an empty default so listeners implement only what
 * they need.
 */
public interface VisibilityListener {

    /** Called when a schema has been built and its first visibility pass has run. */
    default void onSchemaLoaded(SchemaLoadedEvent event) {}

    /** Called when the upstream source failed and the schema was cleared. */
    default void onSchemaRejected(SchemaRejectedEvent event) {}

    /** Called after an edit has been written, before its recompute. */
    default void onFieldEdited(FieldEditedEvent event) {}

    /** Called after every visibility pass. */
    default void onVisibilityRecomputed(VisibilityRecomputedEvent event) {}

    // --- Event records ---

    /** What caused a visibility pass. */
    enum Trigger {
        LOAD,
        EDIT,
        REVIEW,
        MANUAL
    }

    /** Event emitted when a schema is loaded. */
    record SchemaLoadedEvent(String formId, int sectionCount, int fieldCount, String dialect) {}

    /** Event emitted when an upstream failure cleared the schema. */
    record SchemaRejectedEvent(String formId, String errorDetail) {}

    /** Event emitted when an edit was applied. {@code matchedFields} is 0 for unknown names. */
    record FieldEditedEvent(String formId, String fieldApiName, int matchedFields) {}

    /** Event emitted when a visibility pass completes. */
    record VisibilityRecomputedEvent(
            String formId,
            Trigger trigger,
            int sectionCount,
            int visibleSections,
            int fieldCount,
            int visibleFields,
            long durationMicros) {}
}
