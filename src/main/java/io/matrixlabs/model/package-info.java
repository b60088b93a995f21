/**
 * The inputs to matrix planning.
 * <p>
 * A {@link io.matrixlabs.model.MatrixSetDefinition} pairs one train
 * {@link io.matrixlabs.model.TemporalWindow} with its test windows. A
 * {@link io.matrixlabs.model.FeatureDictionary} names the feature columns, grouped by table, that
 * go into a matrix. Windows come from the upstream time chopper and are shaped like:
 *
 * <pre>
 *  {"first_as_of_time": "2015-01-01", "matrix_info_end_time": "2015-06-01",
 *   "as_of_times": ["2015-01-01", "2015-03-01"], "training_label_timespan": "3 months"}
 * </pre>
 */
package io.matrixlabs.model;
