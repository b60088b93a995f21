package io.matrixlabs.model;

/** The role a matrix plays in a matrix set. */
public enum MatrixType {
    TRAIN("train"), TEST("test");

    MatrixType(String value) {
        m_value = value;
    }

    /** The string written into matrix metadata */
    public String getValue() {
        return m_value;
    }

    @Override
    public String toString() {
        return m_value;
    }

    private final String m_value;
}
