package com.railplan.resolve;

import com.railplan.FakeNetwork;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetablePropagator;
import com.railplan.transit.Train;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.railplan.FakeNetwork.time;

public class AdjustmentTest {

    private final TimetablePropagator propagator = new TimetablePropagator(FakeNetwork.doubleTrackLine());

    @Test
    public void shiftIsNotAbsorbedByPlannedTimes () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C");
        train.stops.get(0).plannedDeparture = time(8, 0);
        train.stops.get(2).plannedArrival = time(8, 40);
        Timetable before = propagator.propagate(train);

        Adjustment adjustment = new Adjustment("T1", Adjustment.Source.PRIORITY_RESOLVER, 3);
        adjustment.departureShiftMinutes = 5;
        adjustment.applyTo(train);
        Timetable after = propagator.propagate(train);

        Assertions.assertEquals(before.firstDeparture() + 300, after.firstDeparture());
        Assertions.assertEquals(before.lastArrival() + 300, after.lastArrival());
    }

    @Test
    public void dwellDelaysEverythingAfterTheStop () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C", "D");
        train.stops.get(1).plannedDeparture = time(8, 30);
        train.stops.get(3).plannedArrival = time(9, 30);
        Timetable before = propagator.propagate(train);

        Adjustment adjustment = new Adjustment("T1", Adjustment.Source.PRIORITY_RESOLVER, 4);
        adjustment.dwellDeltas[1] = 5;
        adjustment.applyTo(train);
        Timetable after = propagator.propagate(train);

        Assertions.assertEquals(before.firstDeparture(), after.firstDeparture());
        Assertions.assertEquals(before.entries.get(1).arrival, after.entries.get(1).arrival);
        Assertions.assertEquals(before.entries.get(1).departure + 300, (int) after.entries.get(1).departure);
        Assertions.assertEquals(before.lastArrival() + 300, after.lastArrival());
    }

    @Test
    public void negativeDwellStopsAtZero () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C");
        train.stops.get(1).plannedDeparture = time(8, 30);
        train.addExtraDwell(1, 2);

        Adjustment adjustment = new Adjustment("T1", Adjustment.Source.ORACLE, 3);
        adjustment.dwellDeltas[1] = -10;
        adjustment.applyTo(train);

        Assertions.assertEquals(0, train.stops.get(1).extraDwellMinutes, 1e-9);
        Assertions.assertEquals(time(8, 30), (int) train.stops.get(1).plannedDeparture);
    }

    @Test
    public void adjustmentForAnotherTrainIsRefused () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B");
        Adjustment adjustment = new Adjustment("T2", Adjustment.Source.ORACLE, 2);
        Assertions.assertThrows(IllegalArgumentException.class, () -> adjustment.applyTo(train));
    }

}
