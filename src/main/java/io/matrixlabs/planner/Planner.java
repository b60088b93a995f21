package io.matrixlabs.planner;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import io.matrixlabs.model.FeatureDictionary;
import io.matrixlabs.model.MatrixSetDefinition;
import io.matrixlabs.model.MatrixType;
import io.matrixlabs.model.TemporalWindow;

/**
 * Expands matrix set definitions over every label name, label type, state and feature dictionary,
 * producing the build task for each unique matrix and the matrix sets annotated with the uuids of
 * their matrices.
 * <p>
 * Matrices whose metadata has the same content get the same uuid and share one build task, no
 * matter which matrix set or combination they were planned for.
 */
public class Planner {

    public Planner(PlannerConfig config) {
        this(config, new Md5MatrixIdentifier(), new LoggingPlanObserver());
    }

    public Planner(PlannerConfig config, MatrixIdentifier identifier, PlanObserver observer) {
        m_config = config;
        m_synthesizer = new MetadataSynthesizer(config);
        m_identifier = identifier;
        m_observer = observer;
    }

    /**
     * Create build tasks and annotate copies of the matrix set definitions with matrix uuids. The
     * given definitions are not modified.
     *
     * @param matrixSets the temporal information needed to generate each matrix
     * @param featureDictionaries combinations of features to include in matrices
     * @return one annotated copy per matrix set and combination, in input order, with the unique
     *         build tasks
     */
    public MatrixPlan generatePlans(List<MatrixSetDefinition> matrixSets,
            List<FeatureDictionary> featureDictionaries) {
        BuildTaskRegistry registry = new BuildTaskRegistry();
        List<MatrixSetDefinition> updated = new ArrayList<>();
        for (MatrixSetDefinition matrixSet : matrixSets) {
            updated.addAll(planMatrixSet(matrixSet, featureDictionaries, registry));
        }
        m_observer.planFinished(updated.size(), registry.size());
        return new MatrixPlan(updated, registry);
    }

    /**
     * Same as {@link #generatePlans(List, List)}, planning each matrix set as a separate task on
     * the executor. The annotated matrix sets come back in input order, so the result equals the
     * sequential one.
     *
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public MatrixPlan generatePlans(List<MatrixSetDefinition> matrixSets,
            List<FeatureDictionary> featureDictionaries, ExecutorService executor)
            throws InterruptedException {
        BuildTaskRegistry registry = new BuildTaskRegistry();
        List<Future<List<MatrixSetDefinition>>> futures = new ArrayList<>(matrixSets.size());
        for (MatrixSetDefinition matrixSet : matrixSets) {
            futures.add(executor
                    .submit(() -> planMatrixSet(matrixSet, featureDictionaries, registry)));
        }
        List<MatrixSetDefinition> updated = new ArrayList<>();
        try {
            for (Future<List<MatrixSetDefinition>> future : futures) {
                updated.addAll(future.get());
            }
        } catch (ExecutionException e) {
            cancel(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Unexpected exception planning matrix sets.", cause);
        } catch (InterruptedException e) {
            cancel(futures);
            throw e;
        }
        m_observer.planFinished(updated.size(), registry.size());
        return new MatrixPlan(updated, registry);
    }

    private static void cancel(List<? extends Future<?>> futures) {
        for (Future<?> f : futures) {
            f.cancel(true);
        }
    }

    // every combination gets its own copy of the matrix set
    private List<MatrixSetDefinition> planMatrixSet(MatrixSetDefinition matrixSet,
            List<FeatureDictionary> featureDictionaries, BuildTaskRegistry registry) {
        m_observer.matrixSetStarted(matrixSet, m_config.getLabelNames().size(),
                m_config.getLabelTypes().size(), m_config.getStates().size(),
                featureDictionaries.size());
        List<MatrixSetDefinition> result = new ArrayList<>();
        for (String labelName : m_config.getLabelNames()) {
            for (String labelType : m_config.getLabelTypes()) {
                for (String state : m_config.getStates()) {
                    for (FeatureDictionary featureDictionary : featureDictionaries) {
                        MatrixSetDefinition clone = matrixSet.copy();
                        clone.setTrainUuid(planMatrix(clone.getTrainWindow(), featureDictionary,
                                labelName, labelType, state, MatrixType.TRAIN, registry));
                        List<String> testUuids = new ArrayList<>(clone.getTestWindows().size());
                        for (TemporalWindow testWindow : clone.getTestWindows()) {
                            testUuids.add(planMatrix(testWindow, featureDictionary, labelName,
                                    labelType, state, MatrixType.TEST, registry));
                        }
                        clone.setTestUuids(testUuids);
                        result.add(clone);
                    }
                }
            }
        }
        return result;
    }

    private String planMatrix(TemporalWindow window, FeatureDictionary featureDictionary,
            String labelName, String labelType, String state, MatrixType matrixType,
            BuildTaskRegistry registry) {
        MatrixMetadata metadata = m_synthesizer.synthesize(window, featureDictionary, labelName,
                labelType, state, matrixType);
        String uuid = m_identifier.identify(metadata);
        m_observer.uuidComputed(uuid, metadata);
        boolean added = registry.registerIfAbsent(uuid, () -> BuildTask.create(metadata, uuid,
                window, featureDictionary, m_config.getMatrixDirectory()));
        if (added) {
            m_observer.taskAdded(registry.get(uuid));
        } else {
            m_observer.taskReused(uuid, metadata.getMatrixType());
        }
        return uuid;
    }

    public PlannerConfig getConfig() {
        return m_config;
    }

    private final PlannerConfig m_config;
    private final MetadataSynthesizer m_synthesizer;
    private final MatrixIdentifier m_identifier;
    private final PlanObserver m_observer;
}
