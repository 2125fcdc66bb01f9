package com.railplan.resolve.genetic;

import com.railplan.FakeNetwork;
import com.railplan.SchedulerConfig;
import com.railplan.TestConfig;
import com.railplan.conflict.ConflictDetector;
import com.railplan.network.RailwayNetwork;
import com.railplan.progress.CancellationToken;
import com.railplan.progress.ProgressListener;
import com.railplan.progress.TestingProgressListener;
import com.railplan.resolve.Adjustment;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetablePropagator;
import com.railplan.transit.Train;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.railplan.FakeNetwork.time;

public class PopulationOptimizerTest {

    private RailwayNetwork network;

    private TimetablePropagator propagator;

    private ConflictDetector detector;

    private List<Timetable> existing;

    @BeforeEach
    public void setUp () {
        network = FakeNetwork.doubleTrackLine();
        propagator = new TimetablePropagator(network);
        detector = new ConflictDetector();
        existing = List.of(
                propagator.propagate(FakeNetwork.train("E1", 5, time(8, 0), "A", "B", "C", "D")),
                propagator.propagate(FakeNetwork.train("E2", 5, time(8, 20), "A", "B", "C", "D")));
    }

    private PopulationOptimizer optimizer (SchedulerConfig config) {
        return new PopulationOptimizer(propagator, detector, network, config);
    }

    @Test
    public void conflictFreeTrainsAreReturnedUnchanged () {
        Train added = FakeNetwork.train("N1", 5, time(8, 10), "A", "B", "C", "D");
        PopulationOptimizer optimizer = optimizer(TestConfig.config());
        OptimizationResult result = optimizer.optimize(List.of(added), existing, 50,
                CancellationToken.none(), ProgressListener.NONE);

        Assertions.assertEquals(OptimizationResult.Status.CONVERGED, result.status);
        Assertions.assertEquals(1, result.generations);
        Assertions.assertTrue(result.adjustments.isEmpty());
        Assertions.assertEquals(added.departureTime, result.trains.get(0).departureTime);
        Assertions.assertNotSame(added, result.trains.get(0));
        Assertions.assertEquals(OptimizerProgress.Status.CONVERGED, optimizer.getProgress().getStatus());
        Assertions.assertEquals(1, optimizer.getProgress().getGeneration());
        Assertions.assertEquals(0, optimizer.getProgress().getBestConflictCount());
        Assertions.assertEquals(0, optimizer.getProgress().getBestFitness(), 1e-9);
    }

    /**
     * With no randomness in the initial population, every improvement has to come from mutation, so several
     * generations run and the best fitness must never get worse.
     */
    @Test
    public void bestFitnessNeverIncreases () {
        Train added = FakeNetwork.train("N1", 5, time(8, 0), "A", "B", "C", "D");
        SchedulerConfig config = TestConfig.config("initial-shift-minutes", "0", "initial-dwell-minutes", "0",
                "population-size", "20", "elite-count", "2");
        TestingProgressListener listener = new TestingProgressListener();
        OptimizationResult result = optimizer(config).optimize(List.of(added), existing, 40,
                CancellationToken.none(), listener);

        Assertions.assertTrue(result.initialConflictCount > 0);
        Assertions.assertTrue(result.finalConflictCount <= result.initialConflictCount);
        Assertions.assertEquals(result.generations, result.bestFitnessHistory.size());
        for (int i = 1; i < result.bestFitnessHistory.size(); i++) {
            Assertions.assertTrue(result.bestFitnessHistory.get(i) <= result.bestFitnessHistory.get(i - 1));
        }
        listener.assertUsedCorrectly();
        Assertions.assertEquals(time(8, 0), added.departureTime, "Input trains must not be modified");
    }

    @Test
    public void clashingTrainIsMovedClear () {
        Train added = FakeNetwork.train("N1", 5, time(8, 0), "A", "B", "C", "D");
        OptimizationResult result = optimizer(TestConfig.config()).optimize(List.of(added), existing, 100,
                CancellationToken.none(), ProgressListener.NONE);

        Assertions.assertEquals(OptimizationResult.Status.CONVERGED, result.status);
        Assertions.assertEquals(0, result.finalConflictCount);
        Assertions.assertEquals(1, result.adjustments.size());
        Assertions.assertEquals(Adjustment.Source.POPULATION_OPTIMIZER, result.adjustments.get(0).source);

        List<Timetable> all = new java.util.ArrayList<>(existing);
        all.add(propagator.propagate(result.trains.get(0)));
        Assertions.assertTrue(detector.detect(all).isEmpty());
    }

    @Test
    public void runsAreReproducible () {
        SchedulerConfig config = TestConfig.config("initial-shift-minutes", "0", "initial-dwell-minutes", "0");
        Train added = FakeNetwork.train("N1", 5, time(8, 0), "A", "B", "C", "D");
        OptimizationResult first = optimizer(config).optimize(List.of(added), existing, 30,
                CancellationToken.none(), ProgressListener.NONE);
        OptimizationResult second = optimizer(config).optimize(List.of(added), existing, 30,
                CancellationToken.none(), ProgressListener.NONE);
        Assertions.assertEquals(first.bestFitnessHistory, second.bestFitnessHistory);
        Assertions.assertEquals(first.trains.get(0).departureTime, second.trains.get(0).departureTime);
    }

    @Test
    public void cancellationStopsAfterCurrentGeneration () {
        Train added = FakeNetwork.train("N1", 5, time(8, 0), "A", "B", "C", "D");
        CancellationToken token = new CancellationToken();
        token.cancel();
        SchedulerConfig config = TestConfig.config("initial-shift-minutes", "0", "initial-dwell-minutes", "0");
        PopulationOptimizer optimizer = optimizer(config);
        OptimizationResult result = optimizer.optimize(List.of(added), existing, 100, token, ProgressListener.NONE);
        Assertions.assertEquals(OptimizationResult.Status.CANCELLED, result.status);
        Assertions.assertEquals(1, result.generations);
        Assertions.assertEquals(OptimizerProgress.Status.CANCELLED, optimizer.getProgress().getStatus());
    }

    @Test
    public void budgetExhaustionIsReportedNotThrown () {
        // A new train identical to an existing one, with no way to change anything: mutation never fires.
        Train added = FakeNetwork.train("N1", 5, time(8, 0), "A", "B", "C", "D");
        SchedulerConfig config = TestConfig.config("initial-shift-minutes", "0", "initial-dwell-minutes", "0",
                "mutation-rate", "0");
        OptimizationResult result = optimizer(config).optimize(List.of(added), existing, 3,
                CancellationToken.none(), ProgressListener.NONE);
        Assertions.assertEquals(OptimizationResult.Status.INCOMPLETE, result.status);
        Assertions.assertEquals(3, result.generations);
        Assertions.assertTrue(result.finalConflictCount > 0);
    }

}
