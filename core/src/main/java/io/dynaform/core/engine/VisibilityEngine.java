package io.dynaform.core.engine;

import io.dynaform.core.model.CriteriaOutcome;
import io.dynaform.core.model.FieldDefinition;
import io.dynaform.core.model.FormSchema;
import io.dynaform.core.model.SectionDefinition;
import io.dynaform.core.spec.CriteriaParser;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes the visibility of every section and field of a schema from the current values.
 *
 * <p>A pass walks the whole schema in display order; it is not incremental. Every flag is a
 * function of the current values and the criteria text only, so running a pass twice without a
 * value change yields identical flags.
 *
 * <p>For each section the section criteria are evaluated first. A field is visible only if its
 * section is visible and its own criteria are satisfied (or absent). The field's own criteria are
 * evaluated even when the section is hidden, and its diagnostics are recorded either way.
 *
 * <p>Not thread-safe on its own; the {@link FormController} serializes calls.
 */
public final class VisibilityEngine {

    private static final Logger LOG = LoggerFactory.getLogger(VisibilityEngine.class);

    private final CriteriaParser parser;

    public VisibilityEngine(CriteriaParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /**
     * Runs one full visibility pass, overwriting every {@code isVisible} flag.
     *
     * @param schema the schema to update in place
     * @return counts of what is visible after the pass
     */
    public PassSummary recompute(FormSchema schema) {
        int visibleSections = 0;
        int visibleFields = 0;
        for (SectionDefinition section : schema.sections()) {
            CriteriaOutcome sectionOutcome = section.hasCriteria()
                    ? CriteriaEvaluator.evaluate(parser.parse(section.rawCriteria(), section.name()), schema)
                    : CriteriaOutcome.noCriteria();
            boolean sectionVisible = sectionOutcome.satisfied();
            section.applyVisibility(sectionVisible, sectionOutcome);
            if (sectionVisible) {
                visibleSections++;
            }
            LOG.debug("Section '{}' visible={} criteria='{}' details={}",
                    section.name(), sectionVisible, section.rawCriteria(), sectionOutcome.details());

            for (FieldDefinition field : section.fields()) {
                CriteriaOutcome fieldOutcome = field.hasCriteria()
                        ? CriteriaEvaluator.evaluate(
                                parser.parse(field.rawCriteria(), section.name() + "." + field.fieldApiName()), schema)
                        : CriteriaOutcome.noCriteria();
                boolean fieldVisible = sectionVisible && fieldOutcome.satisfied();
                field.applyVisibility(fieldVisible, fieldOutcome);
                if (fieldVisible) {
                    visibleFields++;
                }
                LOG.debug("  Field '{}' value={} visible={} criteria='{}'",
                        field.fieldApiName(), field.value(), fieldVisible, field.rawCriteria());
            }
        }
        return new PassSummary(schema.sections().size(), visibleSections, schema.fieldCount(), visibleFields);
    }

    /**
     * Counts after one pass.
     *
     * @param sections        total sections
     * @param visibleSections sections shown
     * @param fields          total fields
     * @param visibleFields   fields shown
     */
    public record PassSummary(int sections, int visibleSections, int fields, int visibleFields) {}
}
