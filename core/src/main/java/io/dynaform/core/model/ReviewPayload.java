package io.dynaform.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Flattened, serializable snapshot of a form: every section and field with its current value,
 * visibility and criteria diagnostics. Applying a payload back writes values by
 * {@code fieldApiName}; everything else in it is informational.
 *
 * @param sections sections in display order
 */
public record ReviewPayload(@JsonProperty("sections") List<ReviewSection> sections) {

    public ReviewPayload {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    /**
     * @param name              section name
     * @param order             explicit order, or {@code null}
     * @param visible           whether the section is shown
     * @param criteria          raw section criteria text
     * @param criteriaSatisfied whether the section criteria held
     * @param diagnostics       parse and evaluation details
     * @param fields            fields in display order
     */
    public record ReviewSection(
            String name,
            Integer order,
            boolean visible,
            String criteria,
            boolean criteriaSatisfied,
            List<String> diagnostics,
            List<ReviewField> fields) {

        public ReviewSection {
            diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
            fields = fields == null ? List.of() : List.copyOf(fields);
        }
    }

    /**
     * @param fieldApiName      field key
     * @param kind              field kind id, e.g. {@code "number"}
     * @param order             explicit order, or {@code null}
     * @param options           picklist choices
     * @param value             current value: {@code null}, a string or a boolean
     * @param visible           whether the field is shown
     * @param criteria          raw field criteria text
     * @param criteriaSatisfied whether the field's own criteria held
     * @param diagnostics       parse and evaluation details
     */
    public record ReviewField(
            String fieldApiName,
            String kind,
            Integer order,
            List<PickOption> options,
            Object value,
            boolean visible,
            String criteria,
            boolean criteriaSatisfied,
            List<String> diagnostics) {

        public ReviewField {
            options = options == null ? List.of() : List.copyOf(options);
            diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        }
    }
}
