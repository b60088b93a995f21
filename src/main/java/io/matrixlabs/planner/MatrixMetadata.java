package io.matrixlabs.planner;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import io.matrixlabs.model.TemporalWindow;
import io.matrixlabs.model.Values;

/**
 * The self describing metadata of one matrix. Two matrices with the same metadata content are the
 * same matrix, so equality is defined on {@link #asMap()} regardless of how the record was built.
 * Values are stored as they read back from their canonical JSON, so two records are equal exactly
 * when they give the same {@link CanonicalJson} text and therefore the same matrix uuid.
 */
public class MatrixMetadata {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Assembles metadata in three overlay steps, which must be applied in order: the computed
     * fields, then the window fields, then the user metadata. Each step overwrites keys set by the
     * steps before it.
     */
    public static class Builder {

        /**
         * Set a computed field. A null value leaves the field out.
         *
         * @throws IllegalArgumentException if the value cannot be written as JSON
         */
        public Builder computed(MetadataField field, Object value) {
            advance(Stage.COMPUTED);
            if (value != null) {
                m_fields.put(field, store(value));
            }
            return this;
        }

        /** Copy every field of the window over the computed fields */
        public Builder overlayWindow(TemporalWindow window) {
            advance(Stage.WINDOW);
            for (Map.Entry<String, Object> e : window.getFields().entrySet()) {
                put(e.getKey(), e.getValue());
            }
            return this;
        }

        /** Copy the user metadata over everything else */
        public Builder overlayUser(Map<String, ?> userMetadata) {
            advance(Stage.USER);
            for (Map.Entry<String, ?> e : userMetadata.entrySet()) {
                put(e.getKey(), e.getValue());
            }
            return this;
        }

        public MatrixMetadata build() {
            return new MatrixMetadata(m_fields, m_extra);
        }

        private void advance(Stage stage) {
            if (stage.ordinal() < m_stage.ordinal()) {
                throw new IllegalStateException(
                        "Cannot apply " + stage + " overlay after " + m_stage + " overlay");
            }
            m_stage = stage;
        }

        private void put(String key, Object value) {
            MetadataField field = MetadataField.forKey(key);
            if (field != null) {
                m_fields.put(field, store(value));
            } else {
                m_extra.put(key, store(value));
            }
        }

        private static Object store(Object value) {
            return Values.freeze(CanonicalJson.normalize(value));
        }

        private Builder() {}

        private enum Stage {
            COMPUTED, WINDOW, USER
        }

        private Stage m_stage = Stage.COMPUTED;
        private final EnumMap<MetadataField, Object> m_fields = new EnumMap<>(MetadataField.class);
        private final TreeMap<String, Object> m_extra = new TreeMap<>();
    }

    private MatrixMetadata(EnumMap<MetadataField, Object> fields, TreeMap<String, Object> extra) {
        TreeMap<String, Object> all = new TreeMap<>(extra);
        for (Map.Entry<MetadataField, Object> e : fields.entrySet()) {
            all.put(e.getKey().getKey(), e.getValue());
        }
        m_values = Collections.unmodifiableSortedMap(all);
    }

    /** Every field, sorted by key */
    public SortedMap<String, Object> asMap() {
        return m_values;
    }

    public Object get(String key) {
        return m_values.get(key);
    }

    public Object get(MetadataField field) {
        return m_values.get(field.getKey());
    }

    public boolean has(MetadataField field) {
        return m_values.containsKey(field.getKey());
    }

    public String getLabelName() {
        return getString(MetadataField.LABEL_NAME);
    }

    public String getLabelType() {
        return getString(MetadataField.LABEL_TYPE);
    }

    public String getLabelTimespan() {
        return getString(MetadataField.LABEL_TIMESPAN);
    }

    public String getMatrixType() {
        return getString(MetadataField.MATRIX_TYPE);
    }

    public String getMatrixId() {
        return getString(MetadataField.MATRIX_ID);
    }

    public String getState() {
        return getString(MetadataField.STATE);
    }

    public String getCohortName() {
        return getString(MetadataField.COHORT_NAME);
    }

    public Object getAsOfDateFrequency() {
        return get(MetadataField.AS_OF_DATE_FREQUENCY);
    }

    public Object getFeatureStartTime() {
        return get(MetadataField.FEATURE_START_TIME);
    }

    public Object getEndTime() {
        return get(MetadataField.END_TIME);
    }

    public List<?> getFeatureNames() {
        return getList(MetadataField.FEATURE_NAMES);
    }

    public List<?> getFeatureGroups() {
        return getList(MetadataField.FEATURE_GROUPS);
    }

    public List<?> getIndices() {
        return getList(MetadataField.INDICES);
    }

    private String getString(MetadataField field) {
        Object value = get(field);
        return value == null ? null : value.toString();
    }

    // a window or the user may have replaced a list field with something else
    private List<?> getList(MetadataField field) {
        Object value = get(field);
        return value instanceof List ? (List<?>) value : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MatrixMetadata))
            return false;
        return m_values.equals(((MatrixMetadata) o).m_values);
    }

    @Override
    public int hashCode() {
        return m_values.hashCode();
    }

    @Override
    public String toString() {
        return m_values.toString();
    }

    private final SortedMap<String, Object> m_values;
}
