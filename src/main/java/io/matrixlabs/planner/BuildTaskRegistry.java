package io.matrixlabs.planner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.LinkedHashSet;
import java.util.function.Supplier;

/**
 * The unique build tasks of a plan, keyed by matrix uuid. Once a uuid is registered its task is
 * never replaced. All access is synchronized so several planning workers can share a registry.
 */
public class BuildTaskRegistry {

    /**
     * Register a task under the uuid unless one is already there. The factory is only called if
     * the uuid is new.
     *
     * @return true if the task was added, false if the uuid was already registered
     */
    public synchronized boolean registerIfAbsent(String matrixUuid, Supplier<BuildTask> factory) {
        if (m_tasks.containsKey(matrixUuid)) {
            return false;
        }
        m_tasks.put(matrixUuid, factory.get());
        return true;
    }

    public synchronized BuildTask get(String matrixUuid) {
        return m_tasks.get(matrixUuid);
    }

    public synchronized boolean contains(String matrixUuid) {
        return m_tasks.containsKey(matrixUuid);
    }

    public synchronized int size() {
        return m_tasks.size();
    }

    public synchronized boolean isEmpty() {
        return m_tasks.isEmpty();
    }

    /** uuids in registration order */
    public synchronized Set<String> uuids() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(m_tasks.keySet()));
    }

    public synchronized List<BuildTask> tasks() {
        return Collections.unmodifiableList(new ArrayList<>(m_tasks.values()));
    }

    /** A snapshot of the registry */
    public synchronized Map<String, BuildTask> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(m_tasks));
    }

    private final LinkedHashMap<String, BuildTask> m_tasks = new LinkedHashMap<>();
}
