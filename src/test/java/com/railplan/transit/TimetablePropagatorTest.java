package com.railplan.transit;

import com.railplan.FakeNetwork;
import com.railplan.ScheduleException;
import com.railplan.network.RailwayNetwork;
import com.railplan.network.Station;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.railplan.FakeNetwork.time;

public class TimetablePropagatorTest {

    private RailwayNetwork network;

    private TimetablePropagator propagator;

    /** Rounded running time from rest to rest over segment AB (20 km, 160 km/h) for the fake trains. */
    private int runAB;

    private int runBC;

    @BeforeEach
    public void setUp () {
        network = FakeNetwork.doubleTrackLine();
        propagator = new TimetablePropagator(network);
        Train reference = FakeNetwork.train("reference", 5, 0, "A", "B");
        runAB = (int) Math.round(TravelTimeCalculator.travelTimeSeconds(20, 160, reference, 0, 0));
        runBC = (int) Math.round(TravelTimeCalculator.travelTimeSeconds(30, 120, reference, 0, 0));
    }

    @Test
    public void timesFollowRunningAndDwell () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C");
        Timetable timetable = propagator.propagate(train);
        List<TimetableEntry> entries = timetable.entries;

        Assertions.assertNull(entries.get(0).arrival);
        Assertions.assertEquals(time(8, 0), entries.get(0).departure);
        Assertions.assertEquals(time(8, 0) + runAB, entries.get(1).arrival);
        Assertions.assertEquals(time(8, 0) + runAB + 120, entries.get(1).departure);
        Assertions.assertEquals(time(8, 0) + runAB + 120 + runBC, entries.get(2).arrival);
        Assertions.assertNull(entries.get(2).departure);

        // Origin platform is held for the dwell before departure, the terminus is cleared at once.
        Assertions.assertEquals(time(7, 57), entries.get(0).occupancyStart);
        Assertions.assertEquals(time(8, 0), entries.get(0).occupancyEnd);
        Assertions.assertEquals(entries.get(1).arrival, entries.get(1).occupancyStart);
        Assertions.assertEquals(entries.get(1).departure, entries.get(1).occupancyEnd);
        Assertions.assertFalse(entries.get(2).occupiesPlatform());

        SegmentOccupancy ab = entries.get(1).inboundSegments.get(0);
        Assertions.assertEquals("AB", ab.segment.id);
        Assertions.assertEquals(time(8, 0), ab.entry);
        Assertions.assertEquals(time(8, 0) + runAB, ab.exit);
    }

    @Test
    public void legsOverSeveralSegmentsAddUpSegmentTimes () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "C");
        Timetable timetable = propagator.propagate(train);
        TimetableEntry c = timetable.entries.get(1);
        Assertions.assertEquals(2, c.inboundSegments.size());
        Assertions.assertEquals(time(8, 0) + runAB + runBC, c.arrival);
        Assertions.assertEquals(c.inboundSegments.get(0).exit, c.inboundSegments.get(1).entry);
    }

    @Test
    public void nominalDepartureIsReducedToTimeOfDay () {
        Train train = FakeNetwork.train("T1", 5, time(24 + 8, 0), "A", "B");
        Assertions.assertEquals(time(8, 0), propagator.propagate(train).firstDeparture());
    }

    @Test
    public void shiftedDepartureKeepsCountingPastMidnight () {
        Train train = FakeNetwork.train("T1", 5, time(23, 58), "A", "B");
        train.shiftDeparture(600);
        Timetable timetable = propagator.propagate(train);
        Assertions.assertEquals(time(23, 58) + 600, timetable.firstDeparture());
        Assertions.assertEquals(time(23, 58) + 600 + runAB, timetable.lastArrival());
    }

    @Test
    public void shiftedDepartureMovesPlannedTimes () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C");
        train.stops.get(0).plannedDeparture = time(8, 0);
        train.stops.get(1).plannedDeparture = time(8, 30);
        train.shiftDeparture(300);
        Timetable timetable = propagator.propagate(train);
        Assertions.assertEquals(time(8, 5), timetable.firstDeparture());
        Assertions.assertEquals(time(8, 35), timetable.entries.get(1).departure);
    }

    @Test
    public void extraDwellPushesLaterPlannedTimes () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C");
        train.stops.get(1).plannedDeparture = time(8, 30);
        train.stops.get(2).plannedArrival = time(9, 0);
        train.addExtraDwell(1, 5);
        Timetable timetable = propagator.propagate(train);
        Assertions.assertEquals(time(8, 35), timetable.entries.get(1).departure);
        Assertions.assertEquals(time(9, 5), timetable.entries.get(2).arrival);

        train.resetExtraDwell();
        Assertions.assertEquals(time(8, 30), (int) train.stops.get(1).plannedDeparture);
        Assertions.assertEquals(time(9, 0), (int) train.stops.get(2).plannedArrival);
    }

    @Test
    public void plannedDepartureHoldsTrainButNeverShortensDwell () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C");
        train.stops.get(1).plannedDeparture = time(8, 30);
        Assertions.assertEquals(time(8, 30), propagator.propagate(train).entries.get(1).departure);

        train.stops.get(1).plannedDeparture = time(8, 1);
        Timetable timetable = propagator.propagate(train);
        TimetableEntry b = timetable.entries.get(1);
        Assertions.assertEquals(b.arrival + 120, b.departure);
    }

    @Test
    public void plannedArrivalTakesPrecedence () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C");
        train.stops.get(1).plannedArrival = time(8, 20);
        Timetable timetable = propagator.propagate(train);
        Assertions.assertEquals(time(8, 20), timetable.entries.get(1).arrival);
        Assertions.assertEquals(time(8, 22), timetable.entries.get(1).departure);
    }

    @Test
    public void extraDwellDelaysTheRestOfTheRoute () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C");
        int before = propagator.propagate(train).lastArrival();
        train.stops.get(1).extraDwellMinutes = 1.5;
        Assertions.assertEquals(before + 90, propagator.propagate(train).lastArrival());
    }

    @Test
    public void skippedStopHasNoDwellAndNoPlatform () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C");
        train.stops.get(1).skipped = true;
        TimetableEntry b = propagator.propagate(train).entries.get(1);
        Assertions.assertEquals(b.arrival, b.departure);
        Assertions.assertFalse(b.occupiesPlatform());
    }

    @Test
    public void propagationIsIdempotentAndPure () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A", "B", "C", "D");
        train.stops.get(2).extraDwellMinutes = 2;
        Timetable first = propagator.propagate(train);
        Timetable second = propagator.propagate(train);
        for (int i = 0; i < first.entries.size(); i++) {
            Assertions.assertEquals(first.entries.get(i).arrival, second.entries.get(i).arrival);
            Assertions.assertEquals(first.entries.get(i).departure, second.entries.get(i).departure);
        }
        Assertions.assertNull(train.stops.get(1).arrival, "Propagation must not write into the train");

        first.writeTimesTo(train);
        Assertions.assertEquals(first.entries.get(1).arrival, train.stops.get(1).arrival);
    }

    @Test
    public void unreachableStopFailsOnlyThatTrain () {
        network.addStation(new Station("E", "Elmsworth"));
        Train lost = FakeNetwork.train("LOST", 5, time(8, 0), "A", "E");
        ScheduleException e = Assertions.assertThrows(ScheduleException.class, () -> propagator.propagate(lost));
        Assertions.assertEquals(ScheduleException.Type.UNREACHABLE_STOP, e.type);

        Train fine = FakeNetwork.train("FINE", 5, time(8, 0), "A", "B");
        PropagationReport report = propagator.propagateAll(List.of(lost, fine));
        Assertions.assertTrue(report.failures.containsKey("LOST"));
        Assertions.assertTrue(report.timetables.containsKey("FINE"));
        Assertions.assertFalse(report.timetables.containsKey("LOST"));
    }

    @Test
    public void emptyRouteIsRejectedOutright () {
        Train empty = new Train("EMPTY", "Empty", 5, 160, time(8, 0));
        Train fine = FakeNetwork.train("FINE", 5, time(8, 0), "A", "B");
        ScheduleException e = Assertions.assertThrows(ScheduleException.class,
                () -> propagator.propagateAll(List.of(fine, empty)));
        Assertions.assertEquals(ScheduleException.Type.BAD_INPUT, e.type);
    }

    @Test
    public void singleStopTrainOnlyDeparts () {
        Train train = FakeNetwork.train("T1", 5, time(8, 0), "A");
        Timetable timetable = propagator.propagate(train);
        Assertions.assertEquals(1, timetable.entries.size());
        Assertions.assertEquals(time(8, 0), timetable.firstDeparture());
    }

}
