package com.railplan;

import com.railplan.oracle.HttpOptimizationOracle;
import com.railplan.pipeline.HybridResolutionPipeline;
import com.railplan.resolve.PriorityResolver;

import java.util.Properties;

/**
 * Loads the scheduling engine configuration and exposes it through the Config interface of each component.
 */
public class SchedulerConfig extends ConfigBase implements
        PriorityResolver.Config,
        HybridResolutionPipeline.Config,
        HttpOptimizationOracle.Config {

    public static final String DEFAULT_RESOURCE = "scheduler.properties";

    // INSTANCE FIELDS

    private final int delayIncrementMinutes;
    private final int maxIterations;
    private final int populationSize;
    private final int eliteCount;
    private final double mutationRate;
    private final int initialShiftMinutes;
    private final int initialDwellMinutes;
    private final double conflictWeight;
    private final double delayWeight;
    private final double trackChangeWeight;
    private final int pipelineGenerations;
    private final long randomSeed;
    private final boolean parallelEvaluation;
    private final boolean parallelDetection;
    private final boolean departureSearch;
    private final String oracleEndpoint;
    private final String oracleToken;
    private final String oracleApiKey;
    private final int oracleTimeoutSeconds;
    private final double oracleMinConfidence;
    private final int oracleRollbackTolerance;
    private final int reportPreviewSize;

    // CONSTRUCTORS

    /** The configuration shipped on the classpath, with any environment or system property overrides. */
    public static SchedulerConfig defaults () {
        return new SchedulerConfig(propsFromResource(DEFAULT_RESOURCE));
    }

    public static SchedulerConfig fromFile (String filename) {
        return new SchedulerConfig(propsFromFile(filename));
    }

    public SchedulerConfig (Properties properties) {
        super(properties);
        delayIncrementMinutes = intProp("delay-increment-minutes");
        maxIterations = intProp("max-iterations");
        populationSize = intProp("population-size");
        eliteCount = intProp("elite-count");
        mutationRate = doubleProp("mutation-rate");
        initialShiftMinutes = intProp("initial-shift-minutes");
        initialDwellMinutes = intProp("initial-dwell-minutes");
        conflictWeight = doubleProp("conflict-weight");
        delayWeight = doubleProp("delay-weight");
        trackChangeWeight = doubleProp("track-change-weight");
        pipelineGenerations = intProp("pipeline-generations");
        randomSeed = longProp("random-seed");
        parallelEvaluation = boolProp("parallel-evaluation");
        parallelDetection = boolProp("parallel-detection");
        departureSearch = boolProp("departure-search");
        oracleEndpoint = strProp("oracle-endpoint");
        oracleToken = strProp("oracle-token");
        oracleApiKey = strProp("oracle-api-key");
        oracleTimeoutSeconds = intProp("oracle-timeout-seconds");
        oracleMinConfidence = doubleProp("oracle-min-confidence");
        oracleRollbackTolerance = intProp("oracle-rollback-tolerance");
        reportPreviewSize = intProp("report-preview-size");
        throwIfErrors();
    }

    // INTERFACE IMPLEMENTATIONS
    // Methods implementing the Config interfaces of the scheduling components.
    // Note that one method can implement several Config interfaces at once.

    @Override public int delayIncrementMinutes () { return delayIncrementMinutes; }
    @Override public int maxIterations () { return maxIterations; }
    @Override public int populationSize () { return populationSize; }
    @Override public int eliteCount () { return eliteCount; }
    @Override public double mutationRate () { return mutationRate; }
    @Override public int initialShiftMinutes () { return initialShiftMinutes; }
    @Override public int initialDwellMinutes () { return initialDwellMinutes; }
    @Override public double conflictWeight () { return conflictWeight; }
    @Override public double delayWeight () { return delayWeight; }
    @Override public double trackChangeWeight () { return trackChangeWeight; }
    @Override public int pipelineGenerations () { return pipelineGenerations; }
    @Override public long randomSeed () { return randomSeed; }
    @Override public boolean parallelEvaluation () { return parallelEvaluation; }
    @Override public boolean parallelDetection () { return parallelDetection; }
    @Override public boolean departureSearch () { return departureSearch; }
    @Override public String oracleEndpoint () { return oracleEndpoint; }
    @Override public String oracleToken () { return oracleToken; }
    @Override public String oracleApiKey () { return oracleApiKey; }
    @Override public int oracleTimeoutSeconds () { return oracleTimeoutSeconds; }
    @Override public double oracleMinConfidence () { return oracleMinConfidence; }
    @Override public int oracleRollbackTolerance () { return oracleRollbackTolerance; }
    @Override public int reportPreviewSize () { return reportPreviewSize; }

}
