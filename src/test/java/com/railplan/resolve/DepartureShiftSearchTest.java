package com.railplan.resolve;

import com.railplan.FakeNetwork;
import com.railplan.conflict.ConflictDetector;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetablePropagator;
import com.railplan.transit.Train;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.railplan.FakeNetwork.time;

public class DepartureShiftSearchTest {

    @Test
    public void smallestClearingShiftIsKept () {
        TimetablePropagator propagator = new TimetablePropagator(FakeNetwork.doubleTrackLine());
        ConflictDetector detector = new ConflictDetector();
        Timetable existing = propagator.propagate(FakeNetwork.train("E1", 5, time(8, 0), "A", "B", "C"));
        Train added = FakeNetwork.train("N1", 5, time(8, 0), "A", "B", "C");

        List<Adjustment> adjustments = new DepartureShiftSearch(propagator, detector)
                .search(List.of(added), List.of(existing));

        // The origin platform is held three minutes before departure, so three minutes later is the first clear slot.
        Assertions.assertEquals(1, adjustments.size());
        Assertions.assertEquals(3, adjustments.get(0).departureShiftMinutes, 1e-9);
        Assertions.assertEquals(Adjustment.Source.DEPARTURE_SEARCH, adjustments.get(0).source);
        Assertions.assertEquals(time(8, 3), added.departureTime);
        List<Timetable> all = new ArrayList<>(List.of(existing, propagator.propagate(added)));
        Assertions.assertTrue(detector.detect(all).isEmpty());
    }

    @Test
    public void conflictFreeTrainsAreLeftAlone () {
        TimetablePropagator propagator = new TimetablePropagator(FakeNetwork.doubleTrackLine());
        Timetable existing = propagator.propagate(FakeNetwork.train("E1", 5, time(8, 0), "A", "B", "C"));
        Train added = FakeNetwork.train("N1", 5, time(9, 0), "A", "B", "C");
        List<Adjustment> adjustments = new DepartureShiftSearch(propagator, new ConflictDetector())
                .search(List.of(added), List.of(existing));
        Assertions.assertTrue(adjustments.isEmpty());
        Assertions.assertEquals(time(9, 0), added.departureTime);
    }

}
