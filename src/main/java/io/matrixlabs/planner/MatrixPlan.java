package io.matrixlabs.planner;

import java.util.Collections;
import java.util.List;
import io.matrixlabs.model.MatrixSetDefinition;

/** The result of {@link Planner#generatePlans}: annotated matrix sets and their build tasks. */
public class MatrixPlan {

    public MatrixPlan(List<MatrixSetDefinition> matrixSets, BuildTaskRegistry buildTasks) {
        m_matrixSets = Collections.unmodifiableList(matrixSets);
        m_buildTasks = buildTasks;
    }

    /** One annotated copy per matrix set and label/state/feature combination */
    public List<MatrixSetDefinition> getMatrixSets() {
        return m_matrixSets;
    }

    public BuildTaskRegistry getBuildTasks() {
        return m_buildTasks;
    }

    private final List<MatrixSetDefinition> m_matrixSets;
    private final BuildTaskRegistry m_buildTasks;
}
