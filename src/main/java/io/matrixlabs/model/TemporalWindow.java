package io.matrixlabs.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One temporal window of a matrix set, as produced by the upstream time chopper. The window is an
 * ordered bag of fields; the well known ones have constants here, anything else is carried
 * verbatim into the matrix metadata.
 */
public class TemporalWindow {

    public static final String FIRST_AS_OF_TIME = "first_as_of_time";
    public static final String LAST_AS_OF_TIME = "last_as_of_time";
    public static final String MATRIX_INFO_END_TIME = "matrix_info_end_time";
    public static final String AS_OF_TIMES = "as_of_times";
    public static final String TRAINING_AS_OF_DATE_FREQUENCY = "training_as_of_date_frequency";
    public static final String TEST_AS_OF_DATE_FREQUENCY = "test_as_of_date_frequency";
    public static final String TRAINING_LABEL_TIMESPAN = "training_label_timespan";
    public static final String TEST_LABEL_TIMESPAN = "test_label_timespan";
    public static final String MAX_TRAINING_HISTORY = "max_training_history";
    public static final String TEST_DURATION = "test_duration";

    public TemporalWindow(Map<String, ?> fields) {
        m_fields = Values.freezeMap(fields);
    }

    public Object get(String key) {
        return m_fields.get(key);
    }

    public boolean has(String key) {
        return m_fields.containsKey(key);
    }

    /** All fields, in the order they were given */
    public Map<String, Object> getFields() {
        return m_fields;
    }

    public Object getFirstAsOfTime() {
        return m_fields.get(FIRST_AS_OF_TIME);
    }

    public Object getMatrixInfoEndTime() {
        return m_fields.get(MATRIX_INFO_END_TIME);
    }

    /**
     * The as of times rows are generated for.
     *
     * @return the as_of_times list, empty if the window does not carry one
     */
    public List<?> getAsOfTimes() {
        Object times = m_fields.get(AS_OF_TIMES);
        if (times instanceof List) {
            return (List<?>) times;
        }
        return Collections.emptyList();
    }

    public TemporalWindow copy() {
        return new TemporalWindow(m_fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TemporalWindow))
            return false;
        return m_fields.equals(((TemporalWindow) o).m_fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m_fields);
    }

    @Override
    public String toString() {
        return m_fields.toString();
    }

    private final Map<String, Object> m_fields;
}
