package io.dynaform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One field of a {@link SectionDefinition}. Shape attributes (name, kind, order, options, criteria
 * text) are fixed at build time. The current value and the derived visibility are the only mutable
 * state and are written exclusively by the form controller and the visibility engine. Copies
 * made with {@link #readOnlyCopy()} reject both writes.
 *
 * <p>Values are {@code null}, a {@link String} or a {@link Boolean} (checkbox edits).
 */
public final class FieldDefinition {

    private final String fieldApiName;
    private final FieldKind kind;
    private final Integer order;
    private final int declarationIndex;
    private final List<PickOption> pickOptions;
    private final String rawCriteria;
    private final boolean readOnly;

    private Object value;
    private boolean visible = true;
    private CriteriaOutcome criteriaOutcome = CriteriaOutcome.noCriteria();

    /**
     * @param fieldApiName     field key, never null
     * @param kind             semantic kind
     * @param order            explicit display order, or {@code null} when absent
     * @param declarationIndex 1-based position among the fields declared for the section
     * @param pickOptions      picklist choices, empty unless {@code kind} is {@link FieldKind#PICKLIST}
     * @param rawCriteria      unparsed visibility rule, empty when none
     */
    public FieldDefinition(
            String fieldApiName,
            FieldKind kind,
            Integer order,
            int declarationIndex,
            List<PickOption> pickOptions,
            String rawCriteria) {
        this.fieldApiName = Objects.requireNonNull(fieldApiName, "fieldApiName must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.order = order;
        this.declarationIndex = declarationIndex;
        this.pickOptions = List.copyOf(pickOptions);
        this.rawCriteria = rawCriteria == null ? "" : rawCriteria;
        this.readOnly = false;
        if (kind != FieldKind.PICKLIST && !this.pickOptions.isEmpty()) {
            throw new IllegalArgumentException("Only picklist fields carry options: " + fieldApiName);
        }
    }

    private FieldDefinition(FieldDefinition source) {
        this.fieldApiName = source.fieldApiName;
        this.kind = source.kind;
        this.order = source.order;
        this.declarationIndex = source.declarationIndex;
        this.pickOptions = source.pickOptions;
        this.rawCriteria = source.rawCriteria;
        this.readOnly = true;
        this.value = source.value;
        this.visible = source.visible;
        this.criteriaOutcome = source.criteriaOutcome;
    }

    public String fieldApiName() {
        return fieldApiName;
    }

    public FieldKind kind() {
        return kind;
    }

    /** Explicit display order, or {@code null} when the metadata had none (sorts last). */
    public Integer order() {
        return order;
    }

    public int declarationIndex() {
        return declarationIndex;
    }

    public List<PickOption> pickOptions() {
        return pickOptions;
    }

    public String rawCriteria() {
        return rawCriteria;
    }

    public boolean hasCriteria() {
        return !rawCriteria.isBlank();
    }

    /** The current value: {@code null}, a {@link String} or a {@link Boolean}. */
    public Object value() {
        return value;
    }

    public boolean isVisible() {
        return visible;
    }

    /** Outcome of this field's own criteria in the last visibility pass. */
    public CriteriaOutcome criteriaOutcome() {
        return criteriaOutcome;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /** Detached copy of the current state whose mutators throw {@link IllegalStateException}. */
    public FieldDefinition readOnlyCopy() {
        return readOnly ? this : new FieldDefinition(this);
    }

    /**
     * Stores a new value. Only the form controller calls this.
     *
     * @throws IllegalArgumentException if the value is neither {@code null}, a string nor a boolean
     * @throws IllegalStateException    if this is a read-only copy
     */
    public void assignValue(Object newValue) {
        checkWritable();
        if (newValue != null && !(newValue instanceof String) && !(newValue instanceof Boolean)) {
            throw new IllegalArgumentException("Field values must be strings or booleans, got "
                    + newValue.getClass().getSimpleName() + " for " + fieldApiName);
        }
        this.value = newValue;
    }

    /** Records the result of a visibility pass. Only the visibility engine calls this. */
    public void applyVisibility(boolean isVisible, CriteriaOutcome outcome) {
        checkWritable();
        this.visible = isVisible;
        this.criteriaOutcome = Objects.requireNonNull(outcome, "outcome must not be null");
    }

    private void checkWritable() {
        if (readOnly) {
            throw new IllegalStateException(
                    "Field '" + fieldApiName + "' is a read-only copy; edit it through the form controller");
        }
    }

    @Override
    public String toString() {
        return "FieldDefinition[" + fieldApiName + ", kind=" + kind.id() + ", order=" + order + ", visible=" + visible
                + "]";
    }
}
