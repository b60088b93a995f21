package io.matrixlabs.planner;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import io.matrixlabs.model.FeatureDictionary;
import io.matrixlabs.model.MatrixType;
import io.matrixlabs.model.TemporalWindow;

/**
 * Builds the metadata of one matrix from its temporal window, the label/state/feature combination
 * it is planned for and the planner configuration. The result depends on nothing else, so equal
 * inputs always give equal metadata.
 */
public class MetadataSynthesizer {

    /** The index columns of every matrix */
    public static final List<String> INDICES =
            Collections.unmodifiableList(Arrays.asList("entity_id", "as_of_date"));

    /** Label timespan used when the window has none */
    public static final String DEFAULT_LABEL_TIMESPAN = "0 days";

    public MetadataSynthesizer(PlannerConfig config) {
        this(config.getFeatureStartTime(), config.getCohortName(), config.getUserMetadata());
    }

    public MetadataSynthesizer(Object featureStartTime, String cohortName,
            Map<String, ?> userMetadata) {
        m_featureStartTime = featureStartTime;
        m_cohortName = cohortName;
        m_userMetadata = userMetadata;
    }

    public MatrixMetadata synthesize(TemporalWindow window, FeatureDictionary featureDictionary,
            String labelName, String labelType, String state, MatrixType matrixType) {
        return MatrixMetadata.builder()
                // temporal information
                .computed(MetadataField.FEATURE_START_TIME, m_featureStartTime)
                .computed(MetadataField.END_TIME, window.getMatrixInfoEndTime())
                .computed(MetadataField.AS_OF_DATE_FREQUENCY, asOfDateFrequency(window, matrixType))
                // columns
                .computed(MetadataField.INDICES, INDICES)
                .computed(MetadataField.FEATURE_NAMES, featureDictionary.getFeatureNames())
                .computed(MetadataField.FEATURE_GROUPS, featureDictionary.getNames())
                .computed(MetadataField.LABEL_NAME, labelName)
                // other information
                .computed(MetadataField.LABEL_TYPE, labelType)
                .computed(MetadataField.LABEL_TIMESPAN, labelTimespan(window))
                .computed(MetadataField.COHORT_NAME, m_cohortName)
                .computed(MetadataField.STATE, state)
                .computed(MetadataField.MATRIX_ID, matrixId(window, labelName, labelType))
                .computed(MetadataField.MATRIX_TYPE, matrixType.getValue())
                .overlayWindow(window)
                .overlayUser(m_userMetadata)
                .build();
    }

    /** A human readable label for the matrix. Not unique. */
    static String matrixId(TemporalWindow window, String labelName, String labelType) {
        return String.join("_", labelName, labelType, String.valueOf(window.getFirstAsOfTime()),
                String.valueOf(window.getMatrixInfoEndTime()));
    }

    // the frequency of the window's own role first, then the other one. No default.
    static Object asOfDateFrequency(TemporalWindow window, MatrixType matrixType) {
        String preferred = matrixType == MatrixType.TRAIN
                ? TemporalWindow.TRAINING_AS_OF_DATE_FREQUENCY
                : TemporalWindow.TEST_AS_OF_DATE_FREQUENCY;
        String other = matrixType == MatrixType.TRAIN ? TemporalWindow.TEST_AS_OF_DATE_FREQUENCY
                : TemporalWindow.TRAINING_AS_OF_DATE_FREQUENCY;
        if (window.has(preferred)) {
            return window.get(preferred);
        }
        return window.get(other);
    }

    // test timespan, then training timespan, whatever the matrix type
    static Object labelTimespan(TemporalWindow window) {
        if (window.has(TemporalWindow.TEST_LABEL_TIMESPAN)) {
            return window.get(TemporalWindow.TEST_LABEL_TIMESPAN);
        }
        if (window.has(TemporalWindow.TRAINING_LABEL_TIMESPAN)) {
            return window.get(TemporalWindow.TRAINING_LABEL_TIMESPAN);
        }
        return DEFAULT_LABEL_TIMESPAN;
    }

    private final Object m_featureStartTime;
    private final String m_cohortName;
    private final Map<String, ?> m_userMetadata;
}
