package io.matrixlabs.planner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.matrixlabs.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The collection level settings a {@link Planner} applies to every matrix it plans. */
public class PlannerConfig {

    /** The entity state used when no states are configured */
    public static final String DEFAULT_ACTIVE_STATE = "active";

    public static final String DEFAULT_COHORT_NAME = "default";

    public static final String DEFAULT_MATRIX_DIRECTORY = "matrices";

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        /** Earliest time included in features */
        public Builder featureStartTime(Object x) {
            m_featureStartTime = x;
            return this;
        }

        public Builder labelNames(List<String> x) {
            m_labelNames = x;
            return this;
        }

        public Builder labelTypes(List<String> x) {
            m_labelTypes = x;
            return this;
        }

        /**
         * The entity state expressions to plan for. A null or empty list means
         * {@link PlannerConfig#DEFAULT_ACTIVE_STATE}.
         */
        public Builder states(List<String> x) {
            m_states = x;
            return this;
        }

        /**
         * Where build tasks write their matrices. If never set, falls back to the MATRIX_DIRECTORY
         * environment variable, then the io.matrixlabs.matrixDirectory system property.
         */
        public Builder matrixDirectory(String x) {
            m_matrixDirectory = x;
            return this;
        }

        /**
         * Metadata merged into every matrix's metadata, winning over all computed and window
         * fields. If {@link #overridableFields(Set)} is set, keys naming a {@link MetadataField}
         * must be in it.
         */
        public Builder userMetadata(Map<String, ?> x) {
            m_userMetadata = x;
            return this;
        }

        public Builder cohortName(String x) {
            m_cohortName = x;
            return this;
        }

        /**
         * Restrict which computed fields user metadata may override. When never set, user
         * metadata may override any of them.
         */
        public Builder overridableFields(Set<MetadataField> x) {
            m_overridableFields = x;
            return this;
        }

        public PlannerConfig build() throws PlannerException {
            return new PlannerConfig(this);
        }

        private Builder() {}

        Object m_featureStartTime;
        List<String> m_labelNames = Collections.emptyList();
        List<String> m_labelTypes = Collections.emptyList();
        List<String> m_states;
        String m_matrixDirectory;
        Map<String, ?> m_userMetadata = Collections.emptyMap();
        String m_cohortName = DEFAULT_COHORT_NAME;
        Set<MetadataField> m_overridableFields;
    }

    private PlannerConfig(Builder b) throws PlannerException {
        m_featureStartTime = Values.freeze(b.m_featureStartTime);
        m_labelNames = checkedList("label name", b.m_labelNames);
        m_labelTypes = checkedList("label type", b.m_labelTypes);
        if (b.m_states == null || b.m_states.isEmpty()) {
            m_states = Collections.singletonList(DEFAULT_ACTIVE_STATE);
        } else {
            m_states = checkedList("state", b.m_states);
        }
        m_matrixDirectory =
                b.m_matrixDirectory != null ? b.m_matrixDirectory : defaultMatrixDirectory();
        m_cohortName = b.m_cohortName != null ? b.m_cohortName : DEFAULT_COHORT_NAME;
        if (b.m_overridableFields == null) {
            m_overridableFields = Collections.unmodifiableSet(EnumSet.allOf(MetadataField.class));
        } else if (b.m_overridableFields.isEmpty()) {
            m_overridableFields = Collections.unmodifiableSet(EnumSet.noneOf(MetadataField.class));
        } else {
            m_overridableFields =
                    Collections.unmodifiableSet(EnumSet.copyOf(b.m_overridableFields));
        }
        Map<String, ?> user = b.m_userMetadata != null ? b.m_userMetadata : Collections.emptyMap();
        for (String key : user.keySet()) {
            MetadataField field = MetadataField.forKey(key);
            if (field != null && !m_overridableFields.contains(field)) {
                throw new PlannerException("User metadata key '" + key
                        + "' would override a computed field. Add it to the overridable fields to allow this.");
            }
        }
        m_userMetadata = Values.freezeMap(user);
    }

    /**
     * Read the configuration from a JSON object, using the snake_case keys of the configuration
     * file: feature_start_time, label_names, label_types, states, matrix_directory, user_metadata,
     * cohort_name and overridable_fields.
     *
     * @param jsonNode
     * @throws PlannerException if a value has the wrong shape
     */
    public PlannerConfig(JsonNode jsonNode) throws PlannerException {
        this(fromJson(jsonNode));
    }

    private static Builder fromJson(JsonNode jsonNode) throws PlannerException {
        if (jsonNode == null || !jsonNode.isObject()) {
            throw new PlannerException("Planner configuration must be a JSON object");
        }
        Builder b = builder();
        if (jsonNode.has("feature_start_time")) {
            b.featureStartTime(PlanJson.m_mapper.convertValue(jsonNode.get("feature_start_time"),
                    Object.class));
        }
        if (jsonNode.has("label_names")) {
            b.labelNames(stringList(jsonNode, "label_names"));
        }
        if (jsonNode.has("label_types")) {
            b.labelTypes(stringList(jsonNode, "label_types"));
        }
        if (jsonNode.has("states") && !jsonNode.get("states").isNull()) {
            b.states(stringList(jsonNode, "states"));
        }
        if (jsonNode.hasNonNull("matrix_directory")) {
            b.matrixDirectory(jsonNode.get("matrix_directory").asText());
        }
        if (jsonNode.hasNonNull("cohort_name")) {
            b.cohortName(jsonNode.get("cohort_name").asText());
        }
        if (jsonNode.hasNonNull("user_metadata")) {
            JsonNode user = jsonNode.get("user_metadata");
            if (!user.isObject()) {
                throw new PlannerException("user_metadata must be a JSON object");
            }
            b.userMetadata(PlanJson.m_mapper.convertValue(user,
                    new TypeReference<LinkedHashMap<String, Object>>() {}));
        }
        if (jsonNode.has("overridable_fields")) {
            EnumSet<MetadataField> fields = EnumSet.noneOf(MetadataField.class);
            for (String key : stringList(jsonNode, "overridable_fields")) {
                MetadataField field = MetadataField.forKey(key);
                if (field == null) {
                    throw new PlannerException("Unknown metadata field '" + key
                            + "' in overridable_fields");
                }
                fields.add(field);
            }
            b.overridableFields(fields);
        }
        return b;
    }

    private static List<String> stringList(JsonNode parent, String name) throws PlannerException {
        JsonNode node = parent.get(name);
        if (!node.isArray()) {
            throw new PlannerException(name + " must be a JSON array of strings");
        }
        List<String> result = new ArrayList<>();
        Iterator<JsonNode> it = node.elements();
        while (it.hasNext()) {
            JsonNode element = it.next();
            if (!element.isTextual()) {
                throw new PlannerException(name + " must only contain strings, found " + element);
            }
            result.add(element.asText());
        }
        return result;
    }

    private static List<String> checkedList(String what, List<String> values)
            throws PlannerException {
        if (values == null) {
            return Collections.emptyList();
        }
        for (String v : values) {
            if (v == null) {
                throw new PlannerException("Null " + what + " in planner configuration");
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    private static String defaultMatrixDirectory() {
        if (System.getenv("MATRIX_DIRECTORY") != null) {
            return System.getenv("MATRIX_DIRECTORY");
        } else if (System.getProperty("io.matrixlabs.matrixDirectory") != null) {
            return System.getProperty("io.matrixlabs.matrixDirectory");
        }
        logger.warn("MATRIX_DIRECTORY not set. Using " + DEFAULT_MATRIX_DIRECTORY);
        return DEFAULT_MATRIX_DIRECTORY;
    }

    public Object getFeatureStartTime() {
        return m_featureStartTime;
    }

    public List<String> getLabelNames() {
        return m_labelNames;
    }

    public List<String> getLabelTypes() {
        return m_labelTypes;
    }

    /** Never empty */
    public List<String> getStates() {
        return m_states;
    }

    public String getMatrixDirectory() {
        return m_matrixDirectory;
    }

    public Map<String, Object> getUserMetadata() {
        return m_userMetadata;
    }

    public String getCohortName() {
        return m_cohortName;
    }

    public Set<MetadataField> getOverridableFields() {
        return m_overridableFields;
    }

    private final Object m_featureStartTime;
    private final List<String> m_labelNames;
    private final List<String> m_labelTypes;
    private final List<String> m_states;
    private final String m_matrixDirectory;
    private final Map<String, Object> m_userMetadata;
    private final String m_cohortName;
    private final Set<MetadataField> m_overridableFields;
    private static final Logger logger = LoggerFactory.getLogger(PlannerConfig.class);
}
