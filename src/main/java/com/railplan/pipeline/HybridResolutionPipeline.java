package com.railplan.pipeline;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.railplan.ScheduleException;
import com.railplan.common.ExceptionUtils;
import com.railplan.conflict.Conflict;
import com.railplan.conflict.ConflictDetector;
import com.railplan.conflict.ConflictReport;
import com.railplan.network.NetworkPathService;
import com.railplan.network.Station;
import com.railplan.oracle.OptimizationOracle;
import com.railplan.oracle.OracleRequest;
import com.railplan.oracle.OracleResolution;
import com.railplan.oracle.OracleResponse;
import com.railplan.progress.CancellationToken;
import com.railplan.progress.ProgressListener;
import com.railplan.resolve.Adjustment;
import com.railplan.resolve.DepartureShiftSearch;
import com.railplan.resolve.genetic.OptimizationResult;
import com.railplan.resolve.genetic.PopulationOptimizer;
import com.railplan.transit.PropagationReport;
import com.railplan.transit.Stop;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetablePropagator;
import com.railplan.transit.Train;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fits new trains into an existing timetable. The existing trains are never changed. The stages are:
 * baseline propagation and detection, an optional greedy departure search, an optional call to the optimization
 * oracle whose proposals are filtered and verified, refinement by the population optimizer, and a final propagation
 * and detection whose result is always reported, conflict-free or not.
 *
 * All work is done on copies of the new trains. Cancellation is checked between stages, around the oracle call and
 * in every optimizer generation; a cancelled run returns the input unchanged. Only one run may be in progress on a
 * pipeline at a time.
 */
public class HybridResolutionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(HybridResolutionPipeline.class);

    public interface Config extends PopulationOptimizer.Config, ConflictDetector.Config {
        int pipelineGenerations ();
        /** Run the greedy departure search before the oracle and the optimizer. */
        boolean departureSearch ();
        /** Oracle responses with a lower average confidence are ignored. */
        double oracleMinConfidence ();
        /** Oracle proposals adding more than this many conflicts are rolled back. */
        int oracleRollbackTolerance ();
        int oracleTimeoutSeconds ();
        int reportPreviewSize ();
    }

    /** Oracle calls run on daemon threads so a hanging oracle can be abandoned without blocking shutdown. */
    private static final ExecutorService oracleExecutor = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("oracle-call-%d").build());

    private final NetworkPathService network;

    private final OptimizationOracle oracle;

    private final Config config;

    private final TimetablePropagator propagator;

    private final ConflictDetector detector;

    private final PopulationOptimizer optimizer;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param oracle the optimization oracle, or null to always resolve locally.
     */
    public HybridResolutionPipeline (NetworkPathService network, OptimizationOracle oracle, Config config) {
        this.network = network;
        this.oracle = oracle;
        this.config = config;
        this.propagator = new TimetablePropagator(network);
        this.detector = new ConflictDetector(config);
        this.optimizer = new PopulationOptimizer(propagator, detector, network, config);
    }

    public PipelineResult execute (List<Train> newTrains, List<Train> existingTrains, boolean useOracle) {
        return execute(newTrains, existingTrains, useOracle, CancellationToken.none(), ProgressListener.NONE);
    }

    /**
     * @throws ScheduleException of type BAD_INPUT for malformed trains, before anything is computed.
     * @throws IllegalStateException if another run is in progress on this pipeline.
     */
    public PipelineResult execute (List<Train> newTrains, List<Train> existingTrains, boolean useOracle,
                                   CancellationToken cancellationToken, ProgressListener progressListener) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A resolution pipeline run is already in progress.");
        }
        try {
            return run(newTrains, existingTrains, useOracle, cancellationToken, progressListener);
        } finally {
            running.set(false);
        }
    }

    private PipelineResult run (List<Train> newTrains, List<Train> existingTrains, boolean useOracle,
                                CancellationToken cancellationToken, ProgressListener progressListener) {
        validate(newTrains, existingTrains);
        LOG.info("Resolving {} new trains against {} existing trains.", newTrains.size(), existingTrains.size());

        List<Train> working = Train.deepCopy(newTrains);
        for (Train train : working) {
            train.resetExtraDwell();
        }
        PropagationReport existingReport = propagator.propagateAll(existingTrains);
        List<Timetable> fixed = existingReport.timetableList();
        Map<String, String> failures = new LinkedHashMap<>(existingReport.failures);

        PropagationReport newReport = propagator.propagateAll(working);
        failures.putAll(newReport.failures);
        List<Conflict> baseline = detectAll(fixed, newReport);
        LOG.info("Baseline: {} conflicts.", baseline.size());
        if (cancellationToken.isCancelled()) {
            return cancelled(newTrains, existingTrains, baseline, failures);
        }

        List<Adjustment> adjustments = new ArrayList<>();
        List<Train> reachable = reachable(working, newReport);
        int currentConflicts = baseline.size();

        if (config.departureSearch() && currentConflicts > 0 && !reachable.isEmpty()) {
            adjustments.addAll(new DepartureShiftSearch(propagator, detector).search(reachable, fixed));
            newReport = propagator.propagateAll(working);
            currentConflicts = detectAll(fixed, newReport).size();
            if (cancellationToken.isCancelled()) {
                return cancelled(newTrains, existingTrains, baseline, failures);
            }
        }

        OracleOutcome oracleOutcome;
        if (!useOracle || oracle == null) {
            oracleOutcome = OracleOutcome.DISABLED;
        } else if (currentConflicts == 0) {
            oracleOutcome = OracleOutcome.NOT_NEEDED;
        } else {
            List<Conflict> current = detectAll(fixed, newReport);
            OracleResponse response = callOracle(existingTrains, working, existingReport, newReport, current);
            if (cancellationToken.isCancelled()) {
                return cancelled(newTrains, existingTrains, baseline, failures);
            }
            if (response == null) {
                oracleOutcome = OracleOutcome.FAILED;
            } else if (!response.success) {
                LOG.warn("Optimization oracle reported failure: {}", response.errorMessage);
                oracleOutcome = OracleOutcome.FAILED;
            } else if (response.averageConfidence() < config.oracleMinConfidence()) {
                LOG.warn("Ignoring oracle proposals with confidence {} below {}.",
                        response.averageConfidence(), config.oracleMinConfidence());
                oracleOutcome = OracleOutcome.REJECTED_LOW_CONFIDENCE;
            } else {
                List<Train> candidate = Train.deepCopy(working);
                List<Adjustment> oracleAdjustments = applyOracleResponse(response, candidate);
                PropagationReport candidateReport = propagator.propagateAll(candidate);
                int candidateConflicts = detectAll(fixed, candidateReport).size();
                if (candidateConflicts > currentConflicts + config.oracleRollbackTolerance()) {
                    LOG.warn("Oracle proposals raise conflicts from {} to {}, rolling back.",
                            currentConflicts, candidateConflicts);
                    oracleOutcome = OracleOutcome.ROLLED_BACK;
                } else {
                    LOG.info("Applied {} oracle adjustments, conflicts {} -> {}.",
                            oracleAdjustments.size(), currentConflicts, candidateConflicts);
                    working = candidate;
                    newReport = candidateReport;
                    reachable = reachable(working, newReport);
                    currentConflicts = candidateConflicts;
                    adjustments.addAll(oracleAdjustments);
                    oracleOutcome = OracleOutcome.APPLIED;
                }
            }
        }

        OptimizationResult optimization = null;
        if (currentConflicts > 0 && !reachable.isEmpty()) {
            optimization = optimizer.optimize(working, fixed, config.pipelineGenerations(),
                    cancellationToken, progressListener);
            if (optimization.status == OptimizationResult.Status.CANCELLED) {
                return cancelled(newTrains, existingTrains, baseline, failures);
            }
            working = optimization.trains;
            adjustments.addAll(optimization.adjustments);
        }

        // Final verification on the merged fleet.
        newReport = propagator.propagateAll(working);
        for (Train train : working) {
            Timetable timetable = newReport.timetables.get(train.id);
            if (timetable != null) {
                timetable.writeTimesTo(train);
            }
        }
        List<Conflict> finalConflicts = new ArrayList<>(detectAll(fixed, newReport));
        finalConflicts.sort(Conflict.ORDER);

        PipelineResult result = new PipelineResult();
        result.status = PipelineResult.Status.COMPLETED;
        result.newTrains = working;
        result.trains = new ArrayList<>(existingTrains);
        result.trains.addAll(working);
        result.baselineConflictCount = baseline.size();
        result.finalConflicts = finalConflicts;
        result.residualPreview = ConflictReport.preview(finalConflicts, config.reportPreviewSize());
        result.hotspots = ConflictReport.hotspots(finalConflicts);
        result.oracleOutcome = oracleOutcome;
        result.optimization = optimization;
        result.adjustments = adjustments;
        result.failures = failures;
        if (finalConflicts.isEmpty()) {
            LOG.info("Pipeline finished without conflicts (baseline {}).", baseline.size());
        } else {
            LOG.warn("Pipeline finished with {} of {} conflicts remaining.\n{}", finalConflicts.size(),
                    baseline.size(), ConflictReport.format(finalConflicts, config.reportPreviewSize()));
        }
        return result;
    }

    private static void validate (List<Train> newTrains, List<Train> existingTrains) {
        Set<String> ids = new HashSet<>();
        for (Train train : existingTrains) {
            train.validate();
            if (!ids.add(train.id)) {
                throw ScheduleException.badInput("Duplicate train ID " + train.id);
            }
        }
        for (Train train : newTrains) {
            train.validate();
            if (!ids.add(train.id)) {
                throw ScheduleException.badInput("Duplicate train ID " + train.id);
            }
        }
    }

    private List<Conflict> detectAll (List<Timetable> fixed, PropagationReport newReport) {
        List<Timetable> all = new ArrayList<>(fixed);
        all.addAll(newReport.timetables());
        return detector.detect(all);
    }

    private static List<Train> reachable (List<Train> trains, PropagationReport report) {
        List<Train> reachable = new ArrayList<>();
        for (Train train : trains) {
            if (report.timetables.containsKey(train.id)) {
                reachable.add(train);
            }
        }
        return reachable;
    }

    /**
     * Send the current state to the oracle and wait a bounded time for its answer, whatever the oracle
     * implementation does about timeouts itself. Returns null on any failure.
     */
    private OracleResponse callOracle (List<Train> existingTrains, List<Train> working,
                                       PropagationReport existingReport, PropagationReport newReport,
                                       List<Conflict> conflicts) {
        List<Train> allTrains = new ArrayList<>(existingTrains);
        allTrains.addAll(working);
        Map<String, Timetable> timetables = new LinkedHashMap<>(existingReport.timetables);
        timetables.putAll(newReport.timetables);
        List<String> fixedIds = new ArrayList<>();
        for (Train train : existingTrains) {
            fixedIds.add(train.id);
        }
        OracleRequest request = OracleRequest.create(network, allTrains, timetables, conflicts, fixedIds);
        Future<OracleResponse> future = oracleExecutor.submit(() -> oracle.optimize(request));
        try {
            return future.get(config.oracleTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Optimization oracle did not answer within {} s, continuing locally.",
                    config.oracleTimeoutSeconds());
        } catch (ExecutionException e) {
            LOG.warn("Optimization oracle failed, continuing locally: {}", ExceptionUtils.shortCauseString(e.getCause()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for optimization oracle, continuing locally.");
        }
        return null;
    }

    /**
     * Turn oracle resolutions into adjustments of the given trains and apply them. Extra dwell is reset first so the
     * oracle's proposal replaces earlier resolution rather than adding to it. Resolutions for fixed or unknown trains
     * are ignored, as are negative dwell delays. A suggested platform is used at every stop whose station has that
     * many platforms.
     */
    private List<Adjustment> applyOracleResponse (OracleResponse response, List<Train> trains) {
        Map<String, Train> trainsById = new LinkedHashMap<>();
        for (Train train : trains) {
            trainsById.put(train.id, train);
        }
        List<Adjustment> adjustments = new ArrayList<>();
        if (response.resolutions == null) return adjustments;
        for (OracleResolution resolution : response.resolutions) {
            Train train = trainsById.get(resolution.trainId);
            if (train == null) {
                LOG.debug("Ignoring oracle resolution for train {} which may not be changed.", resolution.trainId);
                continue;
            }
            train.resetExtraDwell();
            Adjustment adjustment = new Adjustment(train.id, Adjustment.Source.ORACLE, train.stops.size());
            adjustment.departureShiftMinutes = resolution.timeAdjustmentMin;
            if (resolution.dwellDelays != null) {
                for (int i = 0; i < resolution.dwellDelays.size() && i < train.stops.size(); i++) {
                    Double delay = resolution.dwellDelays.get(i);
                    if (delay != null && delay > 0) {
                        adjustment.dwellDeltas[i] = delay;
                    }
                }
            }
            Integer platform = parsePlatform(resolution.trackAssignment);
            if (platform != null) {
                for (int i = 0; i < train.stops.size(); i++) {
                    Stop stop = train.stops.get(i);
                    Station station = network.getStation(stop.stationId);
                    if (!stop.skipped && station != null && platform <= station.platforms) {
                        adjustment.trackAssignments.put(i, platform.toString());
                    }
                }
            }
            adjustment.applyTo(train);
            adjustments.add(adjustment);
        }
        return adjustments;
    }

    private static Integer parsePlatform (String trackAssignment) {
        if (trackAssignment == null) return null;
        try {
            int platform = Integer.parseInt(trackAssignment.trim());
            return platform > 0 ? platform : null;
        } catch (NumberFormatException e) {
            LOG.debug("Ignoring non-numeric track suggestion '{}'.", trackAssignment);
            return null;
        }
    }

    /**
     * The result of a cancelled run: the input trains, whose conflicts are those found at the start, and the trains
     * that could not be scheduled.
     */
    private PipelineResult cancelled (List<Train> newTrains, List<Train> existingTrains, List<Conflict> baseline,
                                      Map<String, String> failures) {
        LOG.info("Resolution pipeline cancelled, no changes applied.");
        PipelineResult result = new PipelineResult();
        result.status = PipelineResult.Status.CANCELLED;
        result.newTrains = new ArrayList<>(newTrains);
        result.trains = new ArrayList<>(existingTrains);
        result.trains.addAll(newTrains);
        List<Conflict> sorted = new ArrayList<>(baseline);
        sorted.sort(Conflict.ORDER);
        result.baselineConflictCount = sorted.size();
        result.finalConflicts = sorted;
        result.residualPreview = ConflictReport.preview(sorted, config.reportPreviewSize());
        result.hotspots = ConflictReport.hotspots(sorted);
        result.adjustments = List.of();
        result.failures = failures;
        return result;
    }

}
