package io.dynaform.core.testkit;

import io.dynaform.core.engine.FormEngineOptions;
import io.dynaform.core.engine.SchemaBuilder;
import io.dynaform.core.model.FormSchema;
import io.dynaform.core.model.MetadataRecord;
import java.util.List;

/** Shorthand factories for metadata rows used across core tests. */
public final class TestRecords {

    private TestRecords() {}

    /** A row with section name/order and field name/type, no criteria. */
    public static MetadataRecord field(String section, int sectionOrder, String field, String type, int fieldOrder) {
        return MetadataRecord.builder()
                .section(section)
                .sectionOrder(sectionOrder)
                .field(field)
                .type(type)
                .fieldOrder(fieldOrder)
                .build();
    }

    /** A row whose field carries criteria. */
    public static MetadataRecord field(
            String section, int sectionOrder, String field, String type, int fieldOrder, String fieldCriteria) {
        return MetadataRecord.builder()
                .section(section)
                .sectionOrder(sectionOrder)
                .field(field)
                .type(type)
                .fieldOrder(fieldOrder)
                .fieldCriteria(fieldCriteria)
                .build();
    }

    /** A row whose section carries criteria. */
    public static MetadataRecord sectionWithCriteria(
            String section, int sectionOrder, String sectionCriteria, String field, String type, int fieldOrder) {
        return MetadataRecord.builder()
                .section(section)
                .sectionOrder(sectionOrder)
                .sectionCriteria(sectionCriteria)
                .field(field)
                .type(type)
                .fieldOrder(fieldOrder)
                .build();
    }

    /** Builds a schema with default options. */
    public static FormSchema schema(MetadataRecord... records) {
        return new SchemaBuilder(FormEngineOptions.DEFAULT).build(List.of(records));
    }
}
