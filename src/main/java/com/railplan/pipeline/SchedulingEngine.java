package com.railplan.pipeline;

import com.google.common.base.Strings;
import com.railplan.SchedulerConfig;
import com.railplan.conflict.Conflict;
import com.railplan.conflict.ConflictDetector;
import com.railplan.network.NetworkPathService;
import com.railplan.oracle.HttpOptimizationOracle;
import com.railplan.oracle.OptimizationOracle;
import com.railplan.progress.CancellationToken;
import com.railplan.progress.ProgressListener;
import com.railplan.resolve.Adjustment;
import com.railplan.resolve.PriorityResolver;
import com.railplan.resolve.ResolutionReport;
import com.railplan.transit.PropagationReport;
import com.railplan.transit.Stop;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetablePropagator;
import com.railplan.transit.Train;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the scheduling engine, exposing its four operations on lists of trains. Each operation takes the
 * network it works on; pipelines are kept per network so that only one pipeline run at a time can work on the trains
 * of a given network.
 */
public class SchedulingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SchedulingEngine.class);

    private final SchedulerConfig config;

    private final OptimizationOracle oracle;

    private final ConflictDetector detector;

    private final Map<NetworkPathService, HybridResolutionPipeline> pipelines = new ConcurrentHashMap<>();

    /**
     * @param oracle the optimization oracle consulted by pipelines run with useOracle, or null if there is none.
     */
    public SchedulingEngine (SchedulerConfig config, OptimizationOracle oracle) {
        this.config = config;
        this.oracle = oracle;
        this.detector = new ConflictDetector(config);
    }

    /** An engine calling the HTTP oracle at the configured endpoint, or no oracle if the endpoint is empty. */
    public static SchedulingEngine fromConfig (SchedulerConfig config) {
        OptimizationOracle oracle = Strings.isNullOrEmpty(config.oracleEndpoint())
                ? null
                : new HttpOptimizationOracle(config);
        return new SchedulingEngine(config, oracle);
    }

    /**
     * Compute arrival and departure times of all trains and store them in their stops. Trains that cannot be
     * scheduled have their times cleared and are listed in the report.
     */
    public PropagationReport refreshSchedules (List<Train> trains, NetworkPathService network) {
        PropagationReport report = new TimetablePropagator(network).propagateAll(trains);
        for (Train train : trains) {
            Timetable timetable = report.timetables.get(train.id);
            if (timetable != null) {
                timetable.writeTimesTo(train);
            } else {
                for (Stop stop : train.stops) {
                    stop.arrival = null;
                    stop.departure = null;
                }
            }
        }
        return report;
    }

    /** All conflicts between the trains, sorted by location and time. Unschedulable trains are left out. */
    public List<Conflict> detectConflicts (List<Train> trains, NetworkPathService network) {
        PropagationReport report = new TimetablePropagator(network).propagateAll(trains);
        return sorted(detector.detect(report.timetables()));
    }

    /**
     * Resolve conflicts by delaying lower priority trains, then store the delays in the trains as extra dwell or
     * later departures and refresh their times. The returned report describes the refreshed trains: its timetables
     * and remaining conflicts come from a new detection after the delays are applied.
     */
    public ResolutionReport resolveLocally (List<Train> trains, NetworkPathService network) {
        PropagationReport propagation = new TimetablePropagator(network).propagateAll(trains);
        ResolutionReport report = new PriorityResolver(detector, config).resolve(propagation.timetables());
        for (Adjustment adjustment : report.adjustments) {
            for (Train train : trains) {
                if (train.id.equals(adjustment.trainId)) {
                    adjustment.applyTo(train);
                }
            }
        }
        PropagationReport refreshed = refreshSchedules(trains, network);
        List<Conflict> remaining = sorted(detector.detect(refreshed.timetables()));
        PriorityResolver.State state = remaining.isEmpty()
                ? PriorityResolver.State.CONVERGED
                : PriorityResolver.State.EXHAUSTED;
        if (remaining.size() != report.remainingConflicts.size()) {
            LOG.warn("Applied delays left {} conflicts where resolution predicted {}.", remaining.size(),
                    report.remainingConflicts.size());
        }
        ResolutionReport applied = new ResolutionReport(state, report.iterations, refreshed.timetableList(),
                report.initialConflicts, remaining, report.delayMinutesByTrain, report.adjustments);
        LOG.info("Local resolution {}: {} conflicts before, {} after, {} min total delay.", applied.state,
                applied.initialConflicts.size(), applied.remainingConflicts.size(), applied.totalDelayMinutes());
        return applied;
    }

    public PipelineResult executePipeline (List<Train> newTrains, List<Train> existingTrains,
                                           NetworkPathService network, boolean useOracle) {
        return executePipeline(newTrains, existingTrains, network, useOracle, CancellationToken.none(),
                ProgressListener.NONE);
    }

    /**
     * Fit new trains into the timetable of the existing ones, see HybridResolutionPipeline. The input trains are not
     * modified: the result holds the existing trains and refined copies of the new ones.
     */
    public PipelineResult executePipeline (List<Train> newTrains, List<Train> existingTrains,
                                           NetworkPathService network, boolean useOracle,
                                           CancellationToken cancellationToken, ProgressListener progressListener) {
        HybridResolutionPipeline pipeline = pipelines.computeIfAbsent(network,
                n -> new HybridResolutionPipeline(n, oracle, config));
        return pipeline.execute(newTrains, existingTrains, useOracle, cancellationToken, progressListener);
    }

    private static List<Conflict> sorted (Collection<Conflict> conflicts) {
        List<Conflict> sorted = new ArrayList<>(conflicts);
        sorted.sort(Conflict.ORDER);
        return sorted;
    }

}
