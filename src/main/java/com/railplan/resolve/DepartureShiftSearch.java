package com.railplan.resolve;

import com.railplan.ScheduleException;
import com.railplan.common.TimeUtils;
import com.railplan.conflict.ConflictDetector;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetablePropagator;
import com.railplan.transit.Train;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy search for departure times of new trains. One train at a time, a fixed series of departure shifts is tried
 * (small shifts first, alternating later and earlier) and the shift giving the fewest conflicts overall is kept. This
 * quickly removes the obvious clashes of a new cadence with the existing timetable before the slower optimizers run.
 */
public class DepartureShiftSearch {

    private static final Logger LOG = LoggerFactory.getLogger(DepartureShiftSearch.class);

    /** Shifts tried for each train, in minutes. */
    static final int[] CANDIDATE_SHIFTS = {
            1, -1, 2, -2, 3, -3, 4, -4, 5, -5, 10, -10, 15, -15, 20, -20, 30, -30, 45, -45, 60, -60
    };

    private final TimetablePropagator propagator;

    private final ConflictDetector detector;

    public DepartureShiftSearch (TimetablePropagator propagator, ConflictDetector detector) {
        this.propagator = propagator;
        this.detector = detector;
    }

    /**
     * Shift the departures of the given trains in place.
     *
     * @param trains the trains whose departures may be shifted, all of which must be reachable.
     * @param fixedTimetables timetables of trains that may not be changed.
     * @return one adjustment per train that was shifted.
     */
    public List<Adjustment> search (List<Train> trains, List<Timetable> fixedTimetables) {
        Map<String, Timetable> current = new LinkedHashMap<>();
        for (Train train : trains) {
            current.put(train.id, propagator.propagate(train));
        }
        int conflicts = countConflicts(fixedTimetables, current);
        List<Adjustment> adjustments = new ArrayList<>();
        for (Train train : trains) {
            if (conflicts == 0) break;
            int appliedShift = 0;
            int bestShift = 0;
            Timetable bestTimetable = current.get(train.id);
            for (int shift : CANDIDATE_SHIFTS) {
                train.shiftDeparture(TimeUtils.minutesToSeconds(shift - appliedShift));
                appliedShift = shift;
                Timetable candidate;
                try {
                    candidate = propagator.propagate(train);
                } catch (ScheduleException e) {
                    // Skip a shift that makes the train impossible to schedule.
                    LOG.debug("Shift of {} min failed for train {}: {}", shift, train.id, e.getMessage());
                    continue;
                }
                current.put(train.id, candidate);
                int candidateConflicts = countConflicts(fixedTimetables, current);
                if (candidateConflicts < conflicts) {
                    conflicts = candidateConflicts;
                    bestShift = shift;
                    bestTimetable = candidate;
                    if (conflicts == 0) break;
                }
            }
            train.shiftDeparture(TimeUtils.minutesToSeconds(bestShift - appliedShift));
            current.put(train.id, bestTimetable);
            if (bestShift != 0) {
                Adjustment adjustment = new Adjustment(train.id, Adjustment.Source.DEPARTURE_SEARCH,
                        train.stops.size());
                adjustment.departureShiftMinutes = bestShift;
                adjustments.add(adjustment);
                LOG.debug("Shifted departure of train {} by {} min.", train.id, bestShift);
            }
        }
        LOG.info("Departure search shifted {} of {} trains, {} conflicts remain.",
                adjustments.size(), trains.size(), conflicts);
        return adjustments;
    }

    private int countConflicts (List<Timetable> fixedTimetables, Map<String, Timetable> current) {
        List<Timetable> all = new ArrayList<>(fixedTimetables);
        all.addAll(current.values());
        return detector.detect(all).size();
    }

}
