package io.dynaform.core.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The ordered sections produced by one schema load. Shape is immutable; a reload replaces the
 * whole schema instead of patching it.
 */
public final class FormSchema {

    private static final FormSchema EMPTY = new FormSchema(List.of());

    private final List<SectionDefinition> sections;

    /** @param sections sections in display order */
    public FormSchema(List<SectionDefinition> sections) {
        this.sections = List.copyOf(sections);
    }

    /** The schema with no sections, used before the first load and after an upstream failure. */
    public static FormSchema empty() {
        return EMPTY;
    }

    /**
     * Detached copy of the current values and visibility. Writes to the copy throw, and later
     * changes to this schema do not show through.
     */
    public FormSchema readOnlyCopy() {
        if (sections.isEmpty()) {
            return this;
        }
        return new FormSchema(sections.stream().map(SectionDefinition::readOnlyCopy).toList());
    }

    /** Sections in display order. */
    public List<SectionDefinition> sections() {
        return sections;
    }

    public boolean hasSections() {
        return !sections.isEmpty();
    }

    /** First section with the given name (exact match). */
    public Optional<SectionDefinition> section(String name) {
        return sections.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /** Section at the given 1-based declaration position. */
    public Optional<SectionDefinition> sectionAt(int declarationIndex) {
        return sections.stream()
                .filter(s -> s.declarationIndex() == declarationIndex)
                .findFirst();
    }

    /** All fields, sections and fields both in display order. */
    public Stream<FieldDefinition> fields() {
        return sections.stream().flatMap(s -> s.fields().stream());
    }

    public int fieldCount() {
        return sections.stream().mapToInt(s -> s.fields().size()).sum();
    }

    @Override
    public String toString() {
        return "FormSchema[sections=" + sections.size() + ", fields=" + fieldCount() + "]";
    }
}
