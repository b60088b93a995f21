package io.matrixlabs.planner;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.matrixlabs.model.FeatureDictionary;
import io.matrixlabs.model.MatrixSetDefinition;
import io.matrixlabs.model.TemporalWindow;

/**
 * Reads planner inputs from JSON and writes plans for the matrix builder.
 * <p>
 * Matrix sets are read from an array of
 *
 * <pre>
 *  {"train_matrix": {...}, "test_matrices": [{...}, ...]}
 * </pre>
 *
 * and feature dictionaries from an array of {"table": ["column", ...], ...} objects.
 */
public final class PlanJson {

    private PlanJson() {}

    public static List<MatrixSetDefinition> readMatrixSets(String json) throws PlannerException {
        return matrixSets(parse(json));
    }

    public static List<MatrixSetDefinition> readMatrixSets(InputStream in)
            throws PlannerException {
        return matrixSets(parse(in));
    }

    public static List<FeatureDictionary> readFeatureDictionaries(String json)
            throws PlannerException {
        return featureDictionaries(parse(json));
    }

    public static List<FeatureDictionary> readFeatureDictionaries(InputStream in)
            throws PlannerException {
        return featureDictionaries(parse(in));
    }

    public static PlannerConfig readConfig(String json) throws PlannerException {
        return new PlannerConfig(parse(json));
    }

    public static PlannerConfig readConfig(InputStream in) throws PlannerException {
        return new PlannerConfig(parse(in));
    }

    /** Write the annotated matrix sets and the build tasks of a plan as one JSON object */
    public static String writePlan(MatrixPlan plan) {
        JsonGenerator gen = createGenerator();
        try {
            gen.writeStartObject();
            gen.writeFieldName("matrix_sets");
            gen.writeStartArray();
            for (MatrixSetDefinition matrixSet : plan.getMatrixSets()) {
                writeMatrixSet(gen, matrixSet);
            }
            gen.writeEndArray();
            gen.writeFieldName("build_tasks");
            gen.writeStartObject();
            for (BuildTask task : plan.getBuildTasks().tasks()) {
                gen.writeFieldName(task.getMatrixUuid());
                writeBuildTask(gen, task);
            }
            gen.writeEndObject();
            gen.writeEndObject();
        } catch (IOException e) {
            // we are writing to a string, so this should never fail
            throw new RuntimeException("Error writing plan to in memory generator.", e);
        }
        return getResult(gen);
    }

    static void writeMatrixSet(JsonGenerator gen, MatrixSetDefinition matrixSet)
            throws IOException {
        gen.writeStartObject();
        gen.writeObjectField("train_matrix", matrixSet.getTrainWindow().getFields());
        gen.writeFieldName("test_matrices");
        gen.writeStartArray();
        for (TemporalWindow w : matrixSet.getTestWindows()) {
            gen.writeObject(w.getFields());
        }
        gen.writeEndArray();
        if (matrixSet.getTrainUuid() != null) {
            gen.writeStringField("train_uuid", matrixSet.getTrainUuid());
            gen.writeObjectField("test_uuids", matrixSet.getTestUuids());
        }
        gen.writeEndObject();
    }

    static void writeBuildTask(JsonGenerator gen, BuildTask task) throws IOException {
        gen.writeStartObject();
        gen.writeObjectField("as_of_times", task.getAsOfTimes());
        gen.writeStringField("label_name", task.getLabelName());
        gen.writeStringField("label_type", task.getLabelType());
        gen.writeObjectField("feature_dictionary", task.getFeatureDictionary().asMap());
        gen.writeStringField("matrix_directory", task.getMatrixDirectory());
        gen.writeStringField("matrix_uuid", task.getMatrixUuid());
        gen.writeObjectField("matrix_metadata", task.getMatrixMetadata().asMap());
        gen.writeStringField("matrix_type", task.getMatrixType());
        gen.writeEndObject();
    }

    private static List<MatrixSetDefinition> matrixSets(JsonNode root) throws PlannerException {
        if (!root.isArray()) {
            throw new PlannerException("Expecting an array of matrix set definitions");
        }
        List<MatrixSetDefinition> result = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new PlannerException("Matrix set " + index + " is not a JSON object");
            }
            JsonNode train = node.get("train_matrix");
            if (train == null || !train.isObject()) {
                throw new PlannerException(
                        "Matrix set " + index + " is missing a train_matrix object");
            }
            JsonNode tests = node.get("test_matrices");
            if (tests == null || !tests.isArray()) {
                throw new PlannerException(
                        "Matrix set " + index + " is missing a test_matrices array");
            }
            List<TemporalWindow> testWindows = new ArrayList<>();
            for (JsonNode test : tests) {
                if (!test.isObject()) {
                    throw new PlannerException(
                            "Matrix set " + index + " has a test matrix that is not an object");
                }
                testWindows.add(window(test));
            }
            MatrixSetDefinition matrixSet = new MatrixSetDefinition(window(train), testWindows);
            if (node.hasNonNull("train_uuid")) {
                matrixSet.setTrainUuid(node.get("train_uuid").asText());
            }
            if (node.hasNonNull("test_uuids")) {
                if (!node.get("test_uuids").isArray()) {
                    throw new PlannerException(
                            "Matrix set " + index + " has a test_uuids value that is not an array");
                }
                List<String> uuids = new ArrayList<>();
                for (JsonNode uuid : node.get("test_uuids")) {
                    uuids.add(uuid.asText());
                }
                matrixSet.setTestUuids(uuids);
            }
            result.add(matrixSet);
            index++;
        }
        return result;
    }

    private static TemporalWindow window(JsonNode node) {
        return new TemporalWindow(m_mapper.convertValue(node, FIELDS));
    }

    private static List<FeatureDictionary> featureDictionaries(JsonNode root)
            throws PlannerException {
        if (!root.isArray()) {
            throw new PlannerException("Expecting an array of feature dictionaries");
        }
        List<FeatureDictionary> result = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new PlannerException("Feature dictionary " + index + " is not a JSON object");
            }
            FeatureDictionary.Builder builder = FeatureDictionary.builder();
            Iterator<Map.Entry<String, JsonNode>> tables = node.fields();
            while (tables.hasNext()) {
                Map.Entry<String, JsonNode> table = tables.next();
                if (!table.getValue().isArray()) {
                    throw new PlannerException("Feature table " + table.getKey()
                            + " in feature dictionary " + index + " is not an array of columns");
                }
                List<String> columns = new ArrayList<>();
                for (JsonNode column : table.getValue()) {
                    if (!column.isTextual()) {
                        throw new PlannerException("Feature table " + table.getKey()
                                + " has a column name that is not a string: " + column);
                    }
                    columns.add(column.asText());
                }
                builder.table(table.getKey(), columns);
            }
            result.add(builder.build());
            index++;
        }
        return result;
    }

    private static JsonNode parse(String json) throws PlannerException {
        try {
            return m_mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PlannerException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode parse(InputStream in) throws PlannerException {
        try {
            return m_mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new PlannerException("Malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PlannerException("Error reading JSON input", e);
        }
    }

    private static JsonGenerator createGenerator() {
        StringWriter sw = new StringWriter();
        try {
            return m_mapper.getFactory().createGenerator(sw);
        } catch (IOException e) {
            // we are writing to a string, so this should never fail
            throw new RuntimeException("Error creating in memory generator.", e);
        }
    }

    private static String getResult(JsonGenerator gen) {
        try {
            StringWriter sw = (StringWriter) (gen.getOutputTarget());
            gen.close();
            return sw.toString();
        } catch (IOException e) {
            // we are writing to a string, so this should never fail
            throw new RuntimeException("Error getting generation result.", e);
        }
    }

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS =
            new TypeReference<LinkedHashMap<String, Object>>() {};

    static final ObjectMapper m_mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
}
