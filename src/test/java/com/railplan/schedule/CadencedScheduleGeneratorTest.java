package com.railplan.schedule;

import com.railplan.FakeNetwork;
import com.railplan.ScheduleException;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetablePropagator;
import com.railplan.transit.Train;
import com.railplan.transit.TrainCategory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.railplan.FakeNetwork.time;

public class CadencedScheduleGeneratorTest {

    private TimetablePropagator propagator;

    private CadencedScheduleGenerator generator;

    private ServiceTemplate outward;

    @BeforeEach
    public void setUp () {
        propagator = new TimetablePropagator(FakeNetwork.doubleTrackLine());
        generator = new CadencedScheduleGenerator(propagator);
        outward = new ServiceTemplate("S1", "Shuttle")
                .addStop("A", 3)
                .addStop("B", 2)
                .addStop("C", 2)
                .addStop("D", 0);
    }

    @Test
    public void halfHourlyService () {
        List<Train> trains = generator.generate(outward, time(8, 0), time(10, 0), 30, null, 0);

        Assertions.assertEquals(5, trains.size());
        for (int i = 0; i < trains.size(); i++) {
            Train train = trains.get(i);
            Assertions.assertEquals(1000 + 2 * i, train.code);
            Assertions.assertEquals("S1-" + train.code, train.id);
            Assertions.assertEquals(time(8, 30 * i), train.departureTime);
            Assertions.assertEquals("S1", train.lineId);
            Assertions.assertEquals(TrainCategory.REGIONAL.defaultMaxSpeedKmh, train.maxSpeedKmh, 1e-9);
        }
        Assertions.assertEquals("Shuttle 09:30", trains.get(3).name);
    }

    @Test
    public void returnTrainsLeaveAfterTurnaround () {
        List<Train> trains = generator.generate(outward, time(8, 0), time(10, 0), 30, outward.reversed(), 10);

        Assertions.assertEquals(10, trains.size());
        for (int i = 0; i < trains.size(); i += 2) {
            Train out = trains.get(i);
            Train back = trains.get(i + 1);
            Assertions.assertEquals(out.code + 1, back.code);
            Assertions.assertEquals("D", back.stops.get(0).stationId);
            Assertions.assertEquals("A", back.stops.get(3).stationId);
            Timetable outTimetable = propagator.propagate(out);
            Assertions.assertEquals(outTimetable.lastArrival() + 600, back.departureTime);
        }
    }

    @Test
    public void serviceRunsPastMidnight () {
        List<Train> trains = generator.generate(outward, time(23, 0), time(1, 0), 60, null, 0);
        Assertions.assertEquals(3, trains.size());
        Assertions.assertEquals(time(23, 0), trains.get(0).departureTime);
        Assertions.assertEquals(time(24, 0), trains.get(1).departureTime);
        Assertions.assertEquals(time(25, 0), trains.get(2).departureTime);
        Assertions.assertEquals("Shuttle 00:00", trains.get(1).name);
        Assertions.assertEquals("Shuttle 01:00", trains.get(2).name);
    }

    @Test
    public void zeroIntervalGivesSingleTrip () {
        List<Train> trains = generator.generate(outward, time(8, 0), time(10, 0), 0, null, 0);
        Assertions.assertEquals(1, trains.size());
        Train single = generator.singleTrip(outward, time(8, 0));
        Assertions.assertEquals(trains.get(0).id, single.id);
    }

    @Test
    public void generatedTrainsDoNotShareStops () {
        List<Train> trains = generator.generate(outward, time(8, 0), time(8, 30), 30, null, 0);
        trains.get(0).stops.get(1).extraDwellMinutes = 5;
        Assertions.assertEquals(0, trains.get(1).stops.get(1).extraDwellMinutes, 1e-9);
        Assertions.assertEquals(0, outward.stops.get(1).extraDwellMinutes, 1e-9);
    }

    @Test
    public void serviceWithoutStopsIsRejected () {
        ServiceTemplate empty = new ServiceTemplate("S2", "Empty");
        ScheduleException e = Assertions.assertThrows(ScheduleException.class,
                () -> generator.generate(empty, time(8, 0), time(9, 0), 30, null, 0));
        Assertions.assertEquals(ScheduleException.Type.BAD_INPUT, e.type);
    }

}
