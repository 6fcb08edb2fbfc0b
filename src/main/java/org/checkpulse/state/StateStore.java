package org.checkpulse.state;

import org.checkpulse.checkfile.CheckDefinition;
import org.checkpulse.contract.CheckResult;
import org.checkpulse.runner.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide mapping from check name to its current {@link CheckState} and recent runs.
 * Every mutation replaces the whole entry, so readers always see complete records.
 */
public class StateStore {

    private static final Logger logger = LoggerFactory.getLogger(StateStore.class);

    /** Generation 0 is never issued; it stands for "not registered". */
    private record Entry(long generation, CheckState state, List<RunResult> history) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final List<StateListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong generations = new AtomicLong();
    private final int historySize;
    private final Clock clock;

    public StateStore(int historySize) {
        this(historySize, Clock.systemUTC());
    }

    public StateStore(int historySize, Clock clock) {
        this.historySize = Math.max(0, historySize);
        this.clock = clock;
    }

    public void addListener(StateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(StateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Creates a PENDING state for a newly registered check. Each call starts a new generation,
     * even when the definition is identical to an earlier one.
     *
     * @return the generation of the new registration
     */
    public long register(CheckDefinition definition) {
        CheckState state = CheckState.pending(definition, clock.instant());
        long generation = generations.incrementAndGet();
        Entry previous = entries.put(definition.name(), new Entry(generation, state, List.of()));
        notifyListeners(previous == null ? null : previous.state(), state);
        return generation;
    }

    /**
     * Replaces the definition and drops status and history.
     */
    public long reset(CheckDefinition definition) {
        return register(definition);
    }

    /**
     * @return the generation of the current registration of {@code name}, 0 if it is not registered
     */
    public long generation(String name) {
        Entry entry = entries.get(name);
        return entry == null ? 0 : entry.generation();
    }

    public void remove(String name) {
        Entry previous = entries.remove(name);
        if (previous != null) {
            notifyListeners(previous.state(), null);
        }
    }

    /**
     * Applies a run's result, unless the check was removed, re-registered or redefined while it ran.
     *
     * @param generation the registration the run started under, see {@link #generation(String)}
     * @return false when the result was discarded
     */
    public boolean apply(CheckDefinition ranDefinition, long generation, RunResult run, CheckResult result) {
        CheckState[] change = new CheckState[2];
        entries.computeIfPresent(ranDefinition.name(), (name, current) -> {
            if (current.generation() != generation || !current.state().definition().equals(ranDefinition)) {
                return current;
            }
            CheckState next = current.state().withResult(result, run, clock.instant());
            change[0] = current.state();
            change[1] = next;
            return new Entry(generation, next, appendHistory(current.history(), run));
        });

        if (change[1] == null) {
            logger.debug("Discarding result of '{}': check was removed or re-registered", ranDefinition.name());
            return false;
        }
        notifyListeners(change[0], change[1]);
        return true;
    }

    public Optional<CheckState> get(String name) {
        Entry entry = entries.get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.state());
    }

    public List<RunResult> history(String name) {
        Entry entry = entries.get(name);
        return entry == null ? List.of() : entry.history();
    }

    public Optional<CheckSnapshot> snapshot(String name) {
        return get(name).map(CheckSnapshot::of);
    }

    /**
     * Immutable view of every check, ordered by name.
     */
    public List<CheckSnapshot> snapshot() {
        List<CheckSnapshot> snapshots = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            snapshots.add(CheckSnapshot.of(entry.state()));
        }
        snapshots.sort(Comparator.comparing(CheckSnapshot::name));
        return Collections.unmodifiableList(snapshots);
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    private List<RunResult> appendHistory(List<RunResult> history, RunResult run) {
        if (historySize == 0 || run == null) return history;
        List<RunResult> next = new ArrayList<>(history.size() + 1);
        next.addAll(history);
        next.add(run);
        while (next.size() > historySize) {
            next.remove(0);
        }
        return List.copyOf(next);
    }

    private void notifyListeners(CheckState previous, CheckState current) {
        for (StateListener listener : listeners) {
            try {
                listener.stateChanged(previous, current);
            } catch (RuntimeException e) {
                logger.error("State listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
