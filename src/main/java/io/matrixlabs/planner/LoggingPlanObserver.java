package io.matrixlabs.planner;

import io.matrixlabs.model.MatrixSetDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs planner progress. Per matrix detail goes to debug. */
public class LoggingPlanObserver implements PlanObserver {

    @Override
    public void matrixSetStarted(MatrixSetDefinition matrixSet, int labelNameCount,
            int labelTypeCount, int stateCount, int featureDictionaryCount) {
        logger.info("Making plans for matrix set {}", matrixSet);
        logger.info(
                "Iterating over {} label names, {} label types, {} states, {} feature dictionaries",
                labelNameCount, labelTypeCount, stateCount, featureDictionaryCount);
    }

    @Override
    public void uuidComputed(String matrixUuid, MatrixMetadata metadata) {
        logger.debug("Matrix uuid {} found for {} metadata {}", matrixUuid,
                metadata.getMatrixType(), metadata);
    }

    @Override
    public void taskAdded(BuildTask task) {
        logger.debug("{} uuid {} not found in build tasks yet, so added", task.getMatrixType(),
                task.getMatrixUuid());
    }

    @Override
    public void taskReused(String matrixUuid, String matrixType) {
        logger.debug("{} uuid {} already found in build tasks", matrixType, matrixUuid);
    }

    @Override
    public void planFinished(int matrixSetCount, int buildTaskCount) {
        logger.info(
                "Planner is finished generating matrix plans. {} matrix definitions and {} unique build tasks found",
                matrixSetCount, buildTaskCount);
    }

    private static final Logger logger = LoggerFactory.getLogger(LoggingPlanObserver.class);
}
