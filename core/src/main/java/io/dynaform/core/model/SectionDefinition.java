package io.dynaform.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, ordered group of fields. Owns its fields exclusively; the field list is fixed in display
 * order once the schema is built. Copies made with {@link #readOnlyCopy()} reject visibility
 * writes on the section and on every field.
 */
public final class SectionDefinition {

    private final String name;
    private final Integer order;
    private final int declarationIndex;
    private final String rawCriteria;
    private final List<FieldDefinition> fields;
    private final boolean readOnly;

    private boolean visible = true;
    private CriteriaOutcome criteriaOutcome = CriteriaOutcome.noCriteria();

    /**
     * @param name             section name, never null
     * @param order            merged explicit order (minimum across records), or {@code null}
     * @param declarationIndex 1-based position in which the section first appeared in the metadata
     * @param rawCriteria      unparsed visibility rule, empty when none
     * @param fields           fields in display order
     */
    public SectionDefinition(
            String name, Integer order, int declarationIndex, String rawCriteria, List<FieldDefinition> fields) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.order = order;
        this.declarationIndex = declarationIndex;
        this.rawCriteria = rawCriteria == null ? "" : rawCriteria;
        this.fields = List.copyOf(fields);
        this.readOnly = false;
    }

    private SectionDefinition(SectionDefinition source) {
        this.name = source.name;
        this.order = source.order;
        this.declarationIndex = source.declarationIndex;
        this.rawCriteria = source.rawCriteria;
        this.fields = source.fields.stream().map(FieldDefinition::readOnlyCopy).toList();
        this.readOnly = true;
        this.visible = source.visible;
        this.criteriaOutcome = source.criteriaOutcome;
    }

    public String name() {
        return name;
    }

    /** Explicit display order, or {@code null} when no record supplied one (sorts last). */
    public Integer order() {
        return order;
    }

    public int declarationIndex() {
        return declarationIndex;
    }

    public String rawCriteria() {
        return rawCriteria;
    }

    public boolean hasCriteria() {
        return !rawCriteria.isBlank();
    }

    /** Fields in display order. */
    public List<FieldDefinition> fields() {
        return fields;
    }

    /** First field with the given api name (exact match). */
    public Optional<FieldDefinition> field(String fieldApiName) {
        return fields.stream()
                .filter(f -> f.fieldApiName().equals(fieldApiName))
                .findFirst();
    }

    /** Field at the given 1-based declaration position. */
    public Optional<FieldDefinition> fieldAt(int declarationIndex) {
        return fields.stream()
                .filter(f -> f.declarationIndex() == declarationIndex)
                .findFirst();
    }

    public boolean isVisible() {
        return visible;
    }

    public CriteriaOutcome criteriaOutcome() {
        return criteriaOutcome;
    }

    /** Key that changes whenever the section flips visibility; renderers use it to redraw. */
    public String renderKey() {
        return name + "-" + visible;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /** Detached copy of the section and its fields; every mutator of the copy throws. */
    public SectionDefinition readOnlyCopy() {
        return readOnly ? this : new SectionDefinition(this);
    }

    /**
     * Records the result of a visibility pass. Only the visibility engine calls this.
     *
     * @throws IllegalStateException if this is a read-only copy
     */
    public void applyVisibility(boolean isVisible, CriteriaOutcome outcome) {
        if (readOnly) {
            throw new IllegalStateException(
                    "Section '" + name + "' is a read-only copy; recompute through the form controller");
        }
        this.visible = isVisible;
        this.criteriaOutcome = Objects.requireNonNull(outcome, "outcome must not be null");
    }

    @Override
    public String toString() {
        return "SectionDefinition[" + name + ", order=" + order + ", fields=" + fields.size() + ", visible=" + visible
                + "]";
    }
}
