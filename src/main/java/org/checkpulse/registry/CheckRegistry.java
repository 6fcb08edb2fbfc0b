package org.checkpulse.registry;

import org.checkpulse.checkfile.CheckDefinition;
import org.checkpulse.checkfile.CheckFile;
import org.checkpulse.services.CheckScheduler;
import org.checkpulse.services.ScheduledTask;
import org.checkpulse.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Authoritative name to definition mapping, merged from all checkfiles.
 * Keeps the scheduler and the state store in line with it on every reconcile.
 */
public class CheckRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CheckRegistry.class);

    private final StateStore stateStore;
    private final CheckScheduler scheduler;
    private final Function<CheckDefinition, ScheduledTask> taskFactory;

    private Map<String, CheckDefinition> definitions = new LinkedHashMap<>();

    public CheckRegistry(StateStore stateStore, CheckScheduler scheduler,
                         Function<CheckDefinition, ScheduledTask> taskFactory) {
        this.stateStore = stateStore;
        this.scheduler = scheduler;
        this.taskFactory = taskFactory;
    }

    /**
     * Merges {@code files} in the given order (later files win on name collisions) and applies
     * the difference to the state store and the scheduler. Unchanged checks are left running.
     */
    public synchronized RegistryDiff reconcile(List<CheckFile> files) {
        Map<String, CheckDefinition> merged = merge(files);

        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> changed = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();

        for (String name : definitions.keySet()) {
            if (!merged.containsKey(name)) removed.add(name);
        }
        for (Map.Entry<String, CheckDefinition> e : merged.entrySet()) {
            CheckDefinition current = definitions.get(e.getKey());
            if (current == null) {
                added.add(e.getKey());
            } else if (!current.equals(e.getValue())) {
                changed.add(e.getKey());
            } else {
                unchanged.add(e.getKey());
            }
        }

        for (String name : removed) {
            scheduler.cancel(name);
            stateStore.remove(name);
        }
        for (String name : changed) {
            CheckDefinition definition = merged.get(name);
            scheduler.cancel(name);
            stateStore.reset(definition);
            scheduler.schedule(taskFactory.apply(definition));
        }
        for (String name : added) {
            CheckDefinition definition = merged.get(name);
            stateStore.register(definition);
            scheduler.schedule(taskFactory.apply(definition));
        }

        definitions = merged;

        RegistryDiff diff = new RegistryDiff(sorted(added), sorted(removed), sorted(changed), sorted(unchanged));
        if (diff.isEmpty()) {
            logger.debug("Reconcile: no changes ({} checks)", merged.size());
        } else {
            logger.info("Reconcile: {}", diff);
        }
        return diff;
    }

    public synchronized Optional<CheckDefinition> get(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public synchronized List<CheckDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    public synchronized int size() {
        return definitions.size();
    }

    /**
     * Removes every check.
     */
    public synchronized void clear() {
        reconcile(List.of());
    }

    private static Map<String, CheckDefinition> merge(List<CheckFile> files) {
        Map<String, CheckDefinition> merged = new LinkedHashMap<>();
        for (CheckFile file : files) {
            if (file.hidden()) continue;
            for (CheckDefinition definition : file.definitions()) {
                CheckDefinition previous = merged.remove(definition.name());
                if (previous != null) {
                    logger.warn("Check name collision: '{}' in {} overrides the one in {}",
                            definition.name(), definition.sourceFile(), previous.sourceFile());
                }
                merged.put(definition.name(), definition);
            }
        }
        return merged;
    }

    private static List<String> sorted(Collection<String> names) {
        return Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(names)));
    }
}
