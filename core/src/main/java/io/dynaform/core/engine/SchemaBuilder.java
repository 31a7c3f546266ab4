package io.dynaform.core.engine;

import io.dynaform.core.model.FieldDefinition;
import io.dynaform.core.model.FieldKind;
import io.dynaform.core.model.FormSchema;
import io.dynaform.core.model.MetadataRecord;
import io.dynaform.core.model.PickOption;
import io.dynaform.core.model.SectionDefinition;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups raw metadata rows into an ordered {@link FormSchema}.
 *
 * <p>Rows are grouped by section name in one pass. When several rows describe the same section,
 * the smallest explicit section order wins and the first non-blank section criteria wins; later
 * rows never overwrite it. Sections and fields are then sorted by explicit order ascending (absent
 * orders last), then by name case-insensitively, then by exact name, then by declaration position.
 *
 * <p>The builder never fails on malformed data: a missing section name becomes the fallback
 * section, an unparseable order is treated as absent, and unknown types become {@link
 * FieldKind#OTHER}. Every section and field starts visible until the first visibility pass.
 *
 * <p>Thread-safe and stateless apart from its immutable options.
 */
public final class SchemaBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaBuilder.class);

    /** Display order for sections and fields: explicit order, then names, then declaration. */
    static final Comparator<Integer> ORDER = Comparator.nullsLast(Comparator.naturalOrder());

    private static final Comparator<FieldDefinition> FIELD_ORDER = Comparator.comparing(
                    FieldDefinition::order, ORDER)
            .thenComparing(FieldDefinition::fieldApiName, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(FieldDefinition::fieldApiName)
            .thenComparingInt(FieldDefinition::declarationIndex);

    private static final Comparator<SectionDefinition> SECTION_ORDER = Comparator.comparing(
                    SectionDefinition::order, ORDER)
            .thenComparing(SectionDefinition::name, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(SectionDefinition::name)
            .thenComparingInt(SectionDefinition::declarationIndex);

    private final String fallbackSectionName;

    /** Creates a builder using the fallback section name from the given options. */
    public SchemaBuilder(FormEngineOptions options) {
        this.fallbackSectionName =
                Objects.requireNonNull(options, "options must not be null").fallbackSectionName();
    }

    /**
     * Builds a schema from metadata rows.
     *
     * @param records rows in upstream order; {@code null} entries are skipped
     * @return the ordered schema, empty if there are no rows
     */
    public FormSchema build(List<MetadataRecord> records) {
        Map<String, SectionAccumulator> grouped = new LinkedHashMap<>();
        for (MetadataRecord record : records) {
            if (record == null) {
                continue;
            }
            String sectionName = isBlank(record.sectionName()) ? fallbackSectionName : record.sectionName().trim();
            SectionAccumulator section = grouped.computeIfAbsent(
                    sectionName, name -> new SectionAccumulator(name, grouped.size() + 1));
            section.merge(parseOrder(record.sectionOrder()), record.sectionCriteria());
            section.fields.add(toField(record, section.fields.size() + 1, sectionName));
        }

        List<SectionDefinition> sections = new ArrayList<>(grouped.size());
        for (SectionAccumulator acc : grouped.values()) {
            List<FieldDefinition> fields = new ArrayList<>(acc.fields);
            fields.sort(FIELD_ORDER);
            sections.add(new SectionDefinition(acc.name, acc.order, acc.declarationIndex, acc.criteria, fields));
        }
        sections.sort(SECTION_ORDER);

        FormSchema schema = new FormSchema(sections);
        LOG.debug("Built {} from {} metadata records", schema, records.size());
        return schema;
    }

    private FieldDefinition toField(MetadataRecord record, int declarationIndex, String sectionName) {
        String apiName = record.fieldApiName() == null ? "" : record.fieldApiName().trim();
        if (apiName.isEmpty()) {
            LOG.warn("Metadata record in section '{}' has no field name (position {})", sectionName, declarationIndex);
        }
        FieldKind kind = TypeClassifier.classify(record.fieldType());
        List<PickOption> options =
                kind == FieldKind.PICKLIST ? parsePickOptions(record.picklistValues()) : List.of();
        return new FieldDefinition(
                apiName, kind, parseOrder(record.fieldOrder()), declarationIndex, options, record.fieldCriteria());
    }

    /**
     * Splits a comma-separated picklist string into options, trimming each entry and dropping
     * empty ones.
     *
     * @param raw the raw picklist text, may be {@code null}
     * @return options in source order, label equal to value
     */
    public static List<PickOption> parsePickOptions(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .map(PickOption::of)
                .toList();
    }

    /**
     * Parses an order numeral. Integral decimal text such as {@code "3"}, {@code " 3 "} or {@code
     * "3.0"} is accepted; anything else counts as absent.
     *
     * @param raw the raw order text, may be {@code null}
     * @return the order, or {@code null} when absent or unparseable
     */
    public static Integer parseOrder(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            LOG.debug("Unparseable order '{}' treated as absent", raw);
            return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** Mutable per-section state while grouping. */
    private static final class SectionAccumulator {

        private final String name;
        private final int declarationIndex;
        private final List<FieldDefinition> fields = new ArrayList<>();
        private Integer order;
        private String criteria = "";

        SectionAccumulator(String name, int declarationIndex) {
            this.name = name;
            this.declarationIndex = declarationIndex;
        }

        void merge(Integer candidateOrder, String candidateCriteria) {
            if (candidateOrder != null && (order == null || candidateOrder < order)) {
                order = candidateOrder;
            }
            if (criteria.isBlank() && !isBlank(candidateCriteria)) {
                criteria = candidateCriteria;
            }
        }
    }
}
