package io.matrixlabs.planner;

import io.matrixlabs.model.FeatureDictionary;
import io.matrixlabs.model.MatrixType;
import io.matrixlabs.model.TemporalWindow;
import io.matrixlabs.testutil.PlanningFixtures;
import org.apache.avro.generic.GenericData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BuildTask Tests")
class BuildTaskTest {

    private static final FeatureDictionary FEATURES =
            FeatureDictionary.builder().table("tableA", "f1", "f2").build();

    private static BuildTask task(TemporalWindow window, MatrixType type) {
        MatrixMetadata metadata = new MetadataSynthesizer("2010-01-01", "default",
                Collections.emptyMap()).synthesize(window, FEATURES, "outcome", "binary",
                        "active", type);
        return BuildTask.create(metadata, new Md5MatrixIdentifier().identify(metadata), window,
                FEATURES, "/tmp/matrices");
    }

    @Test
    @DisplayName("Task takes as of times from the window and labels from the metadata")
    void testCreate() {
        TemporalWindow window = PlanningFixtures.trainWindow("2015-01-01", "2015-06-01");
        BuildTask task = task(window, MatrixType.TRAIN);

        assertEquals(Arrays.asList("2015-01-01", "2015-06-01"), task.getAsOfTimes());
        assertEquals("outcome", task.getLabelName());
        assertEquals("binary", task.getLabelType());
        assertEquals("train", task.getMatrixType());
        assertEquals("/tmp/matrices", task.getMatrixDirectory());
        assertSame(FEATURES, task.getFeatureDictionary());
        assertEquals("train", task.getMatrixMetadata().getMatrixType());
    }

    @Test
    @DisplayName("Task is a valid avro record of its schema")
    void testValidAvroRecord() {
        BuildTask task = task(PlanningFixtures.testWindow("2015-06-01", "2015-09-01"),
                MatrixType.TEST);

        assertSame(BuildTask.SCHEMA, task.getSchema());
        assertTrue(GenericData.get().validate(BuildTask.SCHEMA, task));
        assertEquals(task.getMatrixUuid(), task.get(BuildTask.SCHEMA.getField("matrix_uuid").pos()));
        assertEquals(Collections.singletonMap("tableA", Arrays.asList("f1", "f2")),
                task.get(BuildTask.SCHEMA.getField("feature_dictionary").pos()));
        assertEquals(CanonicalJson.write(task.getMatrixMetadata().asMap()),
                task.get(BuildTask.SCHEMA.getField("matrix_metadata").pos()));
    }

    @Test
    @DisplayName("Avro view renders as of times as strings")
    void testAsOfTimesAsStrings() {
        TemporalWindow window = PlanningFixtures.window("2015-01-01", "2015-06-01",
                TemporalWindow.AS_OF_TIMES, Arrays.asList(20150101, 20150201));
        BuildTask task = task(window, MatrixType.TRAIN);

        @SuppressWarnings("unchecked")
        List<String> times = (List<String>) task.get(BuildTask.SCHEMA.getField("as_of_times").pos());
        assertEquals(Arrays.asList("20150101", "20150201"), times);
        assertTrue(GenericData.get().validate(BuildTask.SCHEMA, task));
    }

    @Test
    @DisplayName("Tasks cannot be modified")
    void testImmutable() {
        BuildTask task = task(PlanningFixtures.trainWindow("2015-01-01", "2015-06-01"),
                MatrixType.TRAIN);
        assertThrows(UnsupportedOperationException.class, () -> task.put(0, "other"));
        assertThrows(UnsupportedOperationException.class, () -> task.getAsOfTimes().add("x"));
        assertThrows(IndexOutOfBoundsException.class, () -> task.get(42));
    }

    @Test
    @DisplayName("Tasks built from the same inputs are equal")
    void testEquality() {
        TemporalWindow window = PlanningFixtures.trainWindow("2015-01-01", "2015-06-01");
        assertEquals(task(window, MatrixType.TRAIN), task(window.copy(), MatrixType.TRAIN));
        Map<String, List<String>> features = task(window, MatrixType.TRAIN).getFeatureDictionary().asMap();
        assertEquals(1, features.size());
    }
}
