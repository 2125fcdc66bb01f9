package com.railplan.resolve;

import com.google.common.collect.ImmutableList;
import com.railplan.conflict.Conflict;
import com.railplan.conflict.ConflictDetector;
import com.railplan.transit.Timetable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fast local conflict resolution. In each iteration every detected conflict is resolved by delaying the less
 * important of the two trains by a fixed increment from the conflict location onward; conflicts are then detected
 * again. This repeats until there are no conflicts or the iteration limit is reached.
 *
 * Delays only ever accumulate, and the more important train of a conflict is never moved. The result is not
 * optimal: a train in several conflicts is delayed once per conflict in the same iteration.
 */
public class PriorityResolver {

    private static final Logger LOG = LoggerFactory.getLogger(PriorityResolver.class);

    public interface Config {
        int delayIncrementMinutes ();
        int maxIterations ();
    }

    public enum State {
        DETECTING, RESOLVING, CONVERGED, EXHAUSTED
    }

    private final ConflictDetector detector;

    private final int delayIncrementMinutes;

    private final int maxIterations;

    private volatile State state = State.DETECTING;

    public PriorityResolver (ConflictDetector detector, Config config) {
        this.detector = detector;
        this.delayIncrementMinutes = config.delayIncrementMinutes();
        this.maxIterations = config.maxIterations();
        if (delayIncrementMinutes <= 0 || maxIterations < 0) {
            throw new IllegalArgumentException("Delay increment must be positive and iteration limit non-negative.");
        }
    }

    /** The state of the resolver, for observers on other threads. */
    public State getState () {
        return state;
    }

    /**
     * Resolve conflicts among the given timetables. The input timetables are not modified; the report contains
     * resolved copies.
     */
    public ResolutionReport resolve (Collection<Timetable> timetables) {
        Map<String, Timetable> working = new LinkedHashMap<>();
        Map<String, Adjustment> adjustments = new LinkedHashMap<>();
        for (Timetable timetable : timetables) {
            working.put(timetable.trainId, timetable.copy());
        }
        List<Conflict> initialConflicts = null;
        List<Conflict> conflicts;
        int iteration = 0;
        while (true) {
            state = State.DETECTING;
            conflicts = new ArrayList<>(detector.detect(working.values()));
            conflicts.sort(Conflict.ORDER);
            if (initialConflicts == null) {
                initialConflicts = ImmutableList.copyOf(conflicts);
            }
            if (conflicts.isEmpty()) {
                state = State.CONVERGED;
                break;
            }
            if (iteration >= maxIterations) {
                state = State.EXHAUSTED;
                break;
            }
            state = State.RESOLVING;
            iteration += 1;
            LOG.debug("Iteration {}: resolving {} conflicts.", iteration, conflicts.size());
            for (Conflict conflict : conflicts) {
                Timetable yielding = yieldingTrain(conflict, working);
                int firstMoved = yielding.delayFrom(conflict.stopIndexOf(yielding.trainId), delayIncrementMinutes);
                Adjustment adjustment = adjustments.computeIfAbsent(yielding.trainId,
                        id -> new Adjustment(id, Adjustment.Source.PRIORITY_RESOLVER, yielding.entries.size()));
                if (firstMoved == 0) {
                    adjustment.departureShiftMinutes += delayIncrementMinutes;
                } else {
                    adjustment.dwellDeltas[firstMoved - 1] += delayIncrementMinutes;
                }
            }
        }
        Map<String, Integer> delays = new LinkedHashMap<>();
        for (Timetable timetable : working.values()) {
            if (timetable.totalDelayMinutes > 0) {
                delays.put(timetable.trainId, timetable.totalDelayMinutes);
            }
        }
        if (state == State.EXHAUSTED) {
            LOG.warn("Priority resolution stopped after {} iterations with {} conflicts remaining.",
                    iteration, conflicts.size());
        } else {
            LOG.info("Priority resolution converged after {} iterations, {} trains delayed.",
                    iteration, delays.size());
        }
        return new ResolutionReport(state, iteration, new ArrayList<>(working.values()), initialConflicts,
                ImmutableList.copyOf(conflicts), delays, new ArrayList<>(adjustments.values()));
    }

    /**
     * The train that gives way in a conflict: the one with the lowest priority. Between equal priorities the train
     * with the greater ID gives way, so repeated runs make the same choice.
     */
    static Timetable yieldingTrain (Conflict conflict, Map<String, Timetable> timetables) {
        Timetable yielding = null;
        for (String trainId : conflict.trainIds) {
            Timetable candidate = timetables.get(trainId);
            if (yielding == null || candidate.priority < yielding.priority ||
                    (candidate.priority == yielding.priority && candidate.trainId.compareTo(yielding.trainId) > 0)) {
                yielding = candidate;
            }
        }
        return yielding;
    }

}
