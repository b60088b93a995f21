package io.matrixlabs.planner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import io.matrixlabs.model.FeatureDictionary;
import io.matrixlabs.model.TemporalWindow;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.IndexedRecord;

/**
 * Everything a matrix builder needs to materialize one matrix. Tasks are immutable; they are
 * exposed to builders as avro records of {@link #SCHEMA}.
 */
public class BuildTask implements IndexedRecord {

    public static final Schema SCHEMA = SchemaBuilder.record("BuildTask")
            .namespace("io.matrixlabs.planner")
            .fields()
            .requiredString("matrix_uuid")
            .requiredString("matrix_type")
            .requiredString("label_name")
            .requiredString("label_type")
            .requiredString("matrix_directory")
            .name("as_of_times").type().array().items().stringType().noDefault()
            .name("feature_dictionary").type().map().values().array().items().stringType()
            .noDefault()
            .requiredString("matrix_metadata")
            .endRecord();

    /**
     * Make the task for a matrix. Label and matrix type come from the metadata, so any window or
     * user override of them carries into the task.
     */
    public static BuildTask create(MatrixMetadata metadata, String matrixUuid,
            TemporalWindow window, FeatureDictionary featureDictionary, String matrixDirectory) {
        return new BuildTask(window.getAsOfTimes(), metadata.getLabelName(),
                metadata.getLabelType(), featureDictionary, matrixDirectory, matrixUuid, metadata,
                metadata.getMatrixType());
    }

    public BuildTask(List<?> asOfTimes, String labelName, String labelType,
            FeatureDictionary featureDictionary, String matrixDirectory, String matrixUuid,
            MatrixMetadata matrixMetadata, String matrixType) {
        m_asOfTimes = Collections.unmodifiableList(new ArrayList<Object>(asOfTimes));
        m_labelName = labelName;
        m_labelType = labelType;
        m_featureDictionary = featureDictionary;
        m_matrixDirectory = matrixDirectory;
        m_matrixUuid = matrixUuid;
        m_matrixMetadata = matrixMetadata;
        m_matrixType = matrixType;
    }

    public List<Object> getAsOfTimes() {
        return m_asOfTimes;
    }

    public String getLabelName() {
        return m_labelName;
    }

    public String getLabelType() {
        return m_labelType;
    }

    public FeatureDictionary getFeatureDictionary() {
        return m_featureDictionary;
    }

    public String getMatrixDirectory() {
        return m_matrixDirectory;
    }

    public String getMatrixUuid() {
        return m_matrixUuid;
    }

    public MatrixMetadata getMatrixMetadata() {
        return m_matrixMetadata;
    }

    public String getMatrixType() {
        return m_matrixType;
    }

    @Override
    public Schema getSchema() {
        return SCHEMA;
    }

    @Override
    public void put(int i, Object v) {
        throw new UnsupportedOperationException("Build tasks are immutable");
    }

    @Override
    public Object get(int i) {
        switch (i) {
            case 0:
                return m_matrixUuid;
            case 1:
                return m_matrixType;
            case 2:
                return m_labelName;
            case 3:
                return m_labelType;
            case 4:
                return m_matrixDirectory;
            case 5:
                List<String> times = new ArrayList<>(m_asOfTimes.size());
                for (Object t : m_asOfTimes) {
                    times.add(String.valueOf(t));
                }
                return times;
            case 6:
                return m_featureDictionary.asMap();
            case 7:
                return CanonicalJson.write(m_matrixMetadata.asMap());
        }
        throw new IndexOutOfBoundsException("No build task field at position " + i);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BuildTask))
            return false;
        BuildTask other = (BuildTask) o;
        return m_asOfTimes.equals(other.m_asOfTimes)
                && Objects.equals(m_labelName, other.m_labelName)
                && Objects.equals(m_labelType, other.m_labelType)
                && m_featureDictionary.equals(other.m_featureDictionary)
                && Objects.equals(m_matrixDirectory, other.m_matrixDirectory)
                && m_matrixUuid.equals(other.m_matrixUuid)
                && m_matrixMetadata.equals(other.m_matrixMetadata)
                && Objects.equals(m_matrixType, other.m_matrixType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m_matrixUuid, m_matrixMetadata);
    }

    @Override
    public String toString() {
        return "BuildTask{" + m_matrixType + " " + m_matrixUuid + "}";
    }

    private final List<Object> m_asOfTimes;
    private final String m_labelName;
    private final String m_labelType;
    private final FeatureDictionary m_featureDictionary;
    private final String m_matrixDirectory;
    private final String m_matrixUuid;
    private final MatrixMetadata m_matrixMetadata;
    private final String m_matrixType;
}
