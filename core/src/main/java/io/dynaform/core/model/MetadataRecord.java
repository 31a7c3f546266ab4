package io.dynaform.core.model;

/**
 * One raw metadata row as delivered by a {@link io.dynaform.core.spi.MetadataSource}: a single
 * form field together with the attributes of the section it belongs to.
 *
 * <p>Every component is nullable. Orders are raw text (upstream sources deliver strings or
 * decimal numbers); the schema builder decides what is parseable.
 *
 * @param sectionName    section the field belongs to
 * @param sectionOrder   display order of the section
 * @param sectionCriteria visibility rule of the section
 * @param fieldApiName   field key and label
 * @param fieldType      raw type tag, e.g. {@code "Picklist"} or {@code "currency"}
 * @param fieldOrder     display order of the field within its section
 * @param fieldCriteria  visibility rule of the field
 * @param picklistValues comma-separated picklist choices
 */
public record MetadataRecord(
        String sectionName,
        String sectionOrder,
        String sectionCriteria,
        String fieldApiName,
        String fieldType,
        String fieldOrder,
        String fieldCriteria,
        String picklistValues) {

    /** Creates a new builder with every component unset. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link MetadataRecord}. */
    public static final class Builder {

        private String sectionName;
        private String sectionOrder;
        private String sectionCriteria;
        private String fieldApiName;
        private String fieldType;
        private String fieldOrder;
        private String fieldCriteria;
        private String picklistValues;

        Builder() {}

        public Builder section(String name) {
            this.sectionName = name;
            return this;
        }

        public Builder sectionOrder(String order) {
            this.sectionOrder = order;
            return this;
        }

        public Builder sectionOrder(int order) {
            return sectionOrder(Integer.toString(order));
        }

        public Builder sectionCriteria(String criteria) {
            this.sectionCriteria = criteria;
            return this;
        }

        public Builder field(String apiName) {
            this.fieldApiName = apiName;
            return this;
        }

        public Builder type(String type) {
            this.fieldType = type;
            return this;
        }

        public Builder fieldOrder(String order) {
            this.fieldOrder = order;
            return this;
        }

        public Builder fieldOrder(int order) {
            return fieldOrder(Integer.toString(order));
        }

        public Builder fieldCriteria(String criteria) {
            this.fieldCriteria = criteria;
            return this;
        }

        public Builder picklistValues(String values) {
            this.picklistValues = values;
            return this;
        }

        public MetadataRecord build() {
            return new MetadataRecord(
                    sectionName,
                    sectionOrder,
                    sectionCriteria,
                    fieldApiName,
                    fieldType,
                    fieldOrder,
                    fieldCriteria,
                    picklistValues);
        }
    }
}
