package io.matrixlabs.planner;

import java.util.HashMap;
import java.util.Map;

/** The fields the planner computes for every matrix's metadata. */
public enum MetadataField {
    FEATURE_START_TIME("feature_start_time"),
    END_TIME("end_time"),
    AS_OF_DATE_FREQUENCY("as_of_date_frequency"),
    INDICES("indices"),
    FEATURE_NAMES("feature_names"),
    FEATURE_GROUPS("feature_groups"),
    LABEL_NAME("label_name"),
    LABEL_TYPE("label_type"),
    LABEL_TIMESPAN("label_timespan"),
    COHORT_NAME("cohort_name"),
    STATE("state"),
    MATRIX_ID("matrix_id"),
    MATRIX_TYPE("matrix_type");

    MetadataField(String key) {
        m_key = key;
    }

    /** The key this field is stored under in the metadata */
    public String getKey() {
        return m_key;
    }

    /** Look up a field by its metadata key, null if the key is not a computed field */
    public static MetadataField forKey(String key) {
        return BY_KEY.get(key);
    }

    private final String m_key;

    private static final Map<String, MetadataField> BY_KEY = new HashMap<>();
    static {
        for (MetadataField f : values()) {
            BY_KEY.put(f.m_key, f);
        }
    }
}
