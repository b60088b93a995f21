package io.matrixlabs.planner;

/**
 * Computes the uuid a matrix is stored under from its metadata. Implementations must be pure:
 * metadata with equal content must always get the same uuid, and different content a different
 * one.
 */
@FunctionalInterface
public interface MatrixIdentifier {

    public String identify(MatrixMetadata metadata);
}
