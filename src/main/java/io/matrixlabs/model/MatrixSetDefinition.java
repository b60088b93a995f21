package io.matrixlabs.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A train window and the test windows evaluated against it. The planner hands back copies of
 * these annotated with the uuid of every matrix it planned for them.
 */
public class MatrixSetDefinition {

    public MatrixSetDefinition(TemporalWindow trainWindow, List<TemporalWindow> testWindows) {
        m_trainWindow = Objects.requireNonNull(trainWindow, "trainWindow");
        m_testWindows = Collections.unmodifiableList(new ArrayList<>(testWindows));
    }

    public TemporalWindow getTrainWindow() {
        return m_trainWindow;
    }

    public List<TemporalWindow> getTestWindows() {
        return m_testWindows;
    }

    /** uuid of the planned train matrix, null if this definition has not been planned */
    public String getTrainUuid() {
        return m_trainUuid;
    }

    public void setTrainUuid(String uuid) {
        m_trainUuid = uuid;
    }

    /** uuids of the planned test matrices, parallel to {@link #getTestWindows()} */
    public List<String> getTestUuids() {
        return Collections.unmodifiableList(m_testUuids);
    }

    public void setTestUuids(List<String> uuids) {
        m_testUuids.clear();
        m_testUuids.addAll(uuids);
    }

    /** Deep copy, annotations included */
    public MatrixSetDefinition copy() {
        List<TemporalWindow> tests = new ArrayList<>(m_testWindows.size());
        for (TemporalWindow w : m_testWindows) {
            tests.add(w.copy());
        }
        MatrixSetDefinition result = new MatrixSetDefinition(m_trainWindow.copy(), tests);
        result.m_trainUuid = m_trainUuid;
        result.m_testUuids.addAll(m_testUuids);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MatrixSetDefinition))
            return false;
        MatrixSetDefinition other = (MatrixSetDefinition) o;
        return m_trainWindow.equals(other.m_trainWindow)
                && m_testWindows.equals(other.m_testWindows)
                && Objects.equals(m_trainUuid, other.m_trainUuid)
                && m_testUuids.equals(other.m_testUuids);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m_trainWindow, m_testWindows, m_trainUuid, m_testUuids);
    }

    @Override
    public String toString() {
        return "MatrixSetDefinition{train=" + m_trainWindow + ", tests=" + m_testWindows
                + ", trainUuid=" + m_trainUuid + ", testUuids=" + m_testUuids + "}";
    }

    private final TemporalWindow m_trainWindow;
    private final List<TemporalWindow> m_testWindows;
    private String m_trainUuid;
    private final List<String> m_testUuids = new ArrayList<>();
}
