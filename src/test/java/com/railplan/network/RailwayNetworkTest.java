package com.railplan.network;

import com.railplan.FakeNetwork;
import com.railplan.ScheduleException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class RailwayNetworkTest {

    private RailwayNetwork network;

    @BeforeEach
    public void setUp () {
        network = FakeNetwork.doubleTrackLine();
    }

    @Test
    public void pathFollowsLineInBothDirections () {
        NetworkPath forward = network.findShortestPath("A", "D");
        Assertions.assertEquals(List.of("A", "B", "C", "D"), forward.stationIds);
        Assertions.assertEquals(75, forward.distanceKm, 1e-9);

        List<TrackSegment> backward = network.findPathEdges("D", "B");
        Assertions.assertEquals(2, backward.size());
        Assertions.assertEquals("CD", backward.get(0).id);
        Assertions.assertEquals("BC", backward.get(1).id);
    }

    @Test
    public void shortcutIsPreferred () {
        network.addSegment(new TrackSegment("AC", "A", "C", 40, 80, TrackType.REGIONAL));
        NetworkPath path = network.findShortestPath("A", "C");
        Assertions.assertEquals(List.of("A", "C"), path.stationIds);
        Assertions.assertEquals(40, path.distanceKm, 1e-9);
    }

    @Test
    public void contentsAreListed () {
        Assertions.assertEquals(4, network.getStations().size());
        Assertions.assertEquals(3, network.getSegments().size());
        Assertions.assertEquals(2, network.getStation("B").platforms);
        Assertions.assertSame(network.getSegment("BC"), network.findPathEdges("B", "C").get(0));
    }

    @Test
    public void sameStationGivesEmptyPath () {
        Assertions.assertTrue(network.findPathEdges("B", "B").isEmpty());
    }

    @Test
    public void disconnectedStationsHaveNoPath () {
        network.addStation(new Station("E", "Elmsworth"));
        Assertions.assertNull(network.findPathEdges("A", "E"));
        Assertions.assertNull(network.findShortestPath("E", "A"));
        Assertions.assertNull(network.findPathEdges("A", "nowhere"));
    }

    @Test
    public void invalidElementsAreRejected () {
        ScheduleException e = Assertions.assertThrows(ScheduleException.class,
                () -> new TrackSegment("XY", "A", "B", 0, 100, TrackType.DOUBLE));
        Assertions.assertEquals(ScheduleException.Type.BAD_INPUT, e.type);
        Assertions.assertThrows(ScheduleException.class, () -> network.addStation(new Station("A", "Again")));
        Assertions.assertThrows(ScheduleException.class,
                () -> network.addSegment(new TrackSegment("AZ", "A", "Z", 5, 100, TrackType.DOUBLE)));
    }

    @Test
    public void singleOccupancyDependsOnTypeAndCapacity () {
        Assertions.assertTrue(new TrackSegment("s", "A", "B", 1, 100, TrackType.SINGLE).isSingleOccupancy());
        Assertions.assertFalse(new TrackSegment("d", "A", "B", 1, 100, TrackType.DOUBLE).isSingleOccupancy());
        Assertions.assertTrue(new TrackSegment("r", "A", "B", 1, 100, TrackType.REGIONAL).isSingleOccupancy());
        Assertions.assertEquals(1, new TrackSegment("r", "A", "B", 1, 100, TrackType.REGIONAL).capacity);
        Assertions.assertTrue(new TrackSegment("r", "A", "B", 1, 100, TrackType.REGIONAL, 2).isSingleOccupancy());
        Assertions.assertFalse(new TrackSegment("h", "A", "B", 1, 100, TrackType.HIGH_SPEED).isSingleOccupancy());
        Assertions.assertTrue(new TrackSegment("h", "A", "B", 1, 100, TrackType.HIGH_SPEED, 1).isSingleOccupancy());
    }

}
