package io.matrixlabs.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The feature columns to put in a matrix, grouped by the feature table they come from. */
public class FeatureDictionary {

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        /**
         * Add a feature table and its columns. Adding the same table twice appends the columns.
         */
        public Builder table(String tableName, List<String> columns) {
            m_tables.computeIfAbsent(tableName, k -> new ArrayList<>()).addAll(columns);
            return this;
        }

        public Builder table(String tableName, String... columns) {
            return table(tableName, Arrays.asList(columns));
        }

        public FeatureDictionary build() {
            return new FeatureDictionary(m_tables);
        }

        private Builder() {}

        private final LinkedHashMap<String, List<String>> m_tables = new LinkedHashMap<>();
    }

    public FeatureDictionary(Map<String, ? extends List<String>> tables) {
        LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends List<String>> e : tables.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        }
        m_tables = Collections.unmodifiableMap(copy);
    }

    /** The feature table names, in dictionary order */
    public List<String> getNames() {
        return new ArrayList<>(m_tables.keySet());
    }

    /**
     * Every feature column across all tables. Tables come in dictionary order and columns in the
     * order given for their table.
     */
    public List<String> getFeatureNames() {
        List<String> result = new ArrayList<>();
        for (List<String> columns : m_tables.values()) {
            result.addAll(columns);
        }
        return result;
    }

    /** The columns of one table, or null if the table is not in this dictionary */
    public List<String> getColumns(String tableName) {
        return m_tables.get(tableName);
    }

    public Map<String, List<String>> asMap() {
        return m_tables;
    }

    public boolean isEmpty() {
        return m_tables.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureDictionary))
            return false;
        return m_tables.equals(((FeatureDictionary) o).m_tables);
    }

    @Override
    public int hashCode() {
        return m_tables.hashCode();
    }

    @Override
    public String toString() {
        return m_tables.toString();
    }

    private final Map<String, List<String>> m_tables;
}
