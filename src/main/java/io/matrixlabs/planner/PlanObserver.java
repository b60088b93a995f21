package io.matrixlabs.planner;

import io.matrixlabs.model.MatrixSetDefinition;

/**
 * Receives progress from a {@link Planner}. Every callback does nothing by default. Observers of
 * a parallel planning run are called from several threads.
 */
public interface PlanObserver {

    /** An observer that ignores everything */
    public static final PlanObserver NONE = new PlanObserver() {};

    public default void matrixSetStarted(MatrixSetDefinition matrixSet, int labelNameCount,
            int labelTypeCount, int stateCount, int featureDictionaryCount) {}

    public default void uuidComputed(String matrixUuid, MatrixMetadata metadata) {}

    /** The task is the first one seen for its uuid */
    public default void taskAdded(BuildTask task) {}

    /** A task for the uuid was already registered */
    public default void taskReused(String matrixUuid, String matrixType) {}

    public default void planFinished(int matrixSetCount, int buildTaskCount) {}
}
