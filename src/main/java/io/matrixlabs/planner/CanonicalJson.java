package io.matrixlabs.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Writes values as JSON with the entries of every map, nested ones included, ordered by key. The
 * same content always gives the same string, whatever order its maps were filled in.
 */
public final class CanonicalJson {

    private CanonicalJson() {}

    /**
     * @throws IllegalArgumentException if the value holds something jackson cannot write
     */
    public static String write(Object value) {
        try {
            return m_mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Value cannot be written as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Read back what {@link #write(Object)} writes for the value, so that values writing the same
     * JSON become equal: dates become ISO strings and numbers take the narrowest type jackson reads
     * them as.
     *
     * @throws IllegalArgumentException if the value holds something jackson cannot write
     */
    public static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return m_mapper.readValue(write(value), Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Value cannot be read back from JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static final ObjectMapper m_mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
}
