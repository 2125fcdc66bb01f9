package com.railplan.resolve.genetic;

import com.railplan.ScheduleException;
import com.railplan.conflict.Conflict;
import com.railplan.conflict.ConflictDetector;
import com.railplan.network.NetworkPathService;
import com.railplan.network.Station;
import com.railplan.progress.CancellationToken;
import com.railplan.progress.ProgressListener;
import com.railplan.resolve.Adjustment;
import com.railplan.transit.Stop;
import com.railplan.transit.Timetable;
import com.railplan.transit.TimetablePropagator;
import com.railplan.transit.Train;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Genetic search over departure shifts, extra dwell and platform assignments of a set of new trains, against the fixed
 * timetables of the existing trains. Fitness is a weighted sum of the number of conflicts involving the new trains,
 * the delay introduced and the number of platform changes, so that removing conflicts always dominates.
 *
 * The best chromosomes of each generation are carried over unchanged, which makes the best fitness non-increasing.
 * Mutation is concentrated on trains that are still in conflict. All randomness comes from one java.util.Random
 * seeded from the configuration, so a run can be repeated exactly.
 */
public class PopulationOptimizer {

    private static final Logger LOG = LoggerFactory.getLogger(PopulationOptimizer.class);

    /** Shift range in minutes for mutations of trains in conflict. */
    private static final int MAX_MUTATION_SHIFT = 10;

    /** Highest platform number tried when a station's platform count is large. */
    private static final int MAX_PLATFORMS = 8;

    public interface Config {
        int populationSize ();
        int eliteCount ();
        double mutationRate ();
        /** Half width of the departure shift range used to create the initial population, in minutes. */
        int initialShiftMinutes ();
        /** Maximum extra dwell per stop in the initial population, in minutes. */
        int initialDwellMinutes ();
        double conflictWeight ();
        double delayWeight ();
        double trackChangeWeight ();
        long randomSeed ();
        boolean parallelEvaluation ();
    }

    private final TimetablePropagator propagator;

    private final ConflictDetector detector;

    private final NetworkPathService network;

    private final Config config;

    private final OptimizerProgress progress = new OptimizerProgress();

    public PopulationOptimizer (TimetablePropagator propagator, ConflictDetector detector,
                                NetworkPathService network, Config config) {
        if (config.populationSize() < 2 || config.eliteCount() < 1 || config.eliteCount() >= config.populationSize()) {
            throw ScheduleException.configuration("Population size must be at least two and exceed a positive elite count.");
        }
        this.propagator = propagator;
        this.detector = detector;
        this.network = network;
        this.config = config;
    }

    public OptimizerProgress getProgress () {
        return progress;
    }

    /**
     * Evolve adjustments for the given trains. The trains are not modified; the result contains adjusted copies.
     * Trains that cannot be propagated are returned unchanged and take no part in the search.
     *
     * @param fixedTimetables timetables of the trains that keep their schedule.
     * @param generations maximum number of generations to evaluate.
     */
    public OptimizationResult optimize (List<Train> trains, List<Timetable> fixedTimetables, int generations,
                                        CancellationToken cancellationToken, ProgressListener progressListener) {
        progress.start();
        Random random = new Random(config.randomSeed());
        List<Train> evolving = new ArrayList<>();
        for (Train train : trains) {
            try {
                propagator.propagate(train);
                evolving.add(train);
            } catch (ScheduleException e) {
                LOG.warn("Train {} excluded from optimization: {}", train.id, e.getMessage());
            }
        }

        Evaluator evaluator = new Evaluator(evolving, fixedTimetables);
        Map<String, Train> trainsById = new LinkedHashMap<>();
        for (Train train : evolving) {
            trainsById.put(train.id, train);
        }
        List<Chromosome> population = new ArrayList<>(config.populationSize());
        population.add(identity(evolving));
        while (population.size() < config.populationSize()) {
            population.add(randomChromosome(evolving, random));
        }

        int maxGenerations = Math.max(generations, 1);
        progressListener.beginTask("Optimizing timetable of " + evolving.size() + " trains", maxGenerations);
        List<Double> history = new ArrayList<>();
        int initialConflicts = -1;
        OptimizationResult.Status status;
        Chromosome best;
        int generation = 0;
        while (true) {
            evaluator.evaluateAll(population);
            if (initialConflicts < 0) {
                // The identity chromosome is the first one of the initial population.
                initialConflicts = population.get(0).conflictCount;
            }
            population.sort(Comparator.comparingDouble(c -> c.fitness));
            best = population.get(0);
            history.add(best.fitness);
            generation += 1;
            progress.update(generation, best);
            progressListener.increment();
            LOG.debug("Generation {}: best fitness {} with {} conflicts.", generation, best.fitness, best.conflictCount);
            if (best.conflictCount == 0) {
                status = OptimizationResult.Status.CONVERGED;
                break;
            }
            if (cancellationToken.isCancelled()) {
                status = OptimizationResult.Status.CANCELLED;
                break;
            }
            if (generation >= maxGenerations) {
                status = OptimizationResult.Status.INCOMPLETE;
                break;
            }
            population = breed(population, trainsById, random);
        }
        if (generation < maxGenerations) {
            progressListener.increment(maxGenerations - generation);
        }

        progress.finish(status == OptimizationResult.Status.CONVERGED ? OptimizerProgress.Status.CONVERGED
                : status == OptimizationResult.Status.CANCELLED ? OptimizerProgress.Status.CANCELLED
                : OptimizerProgress.Status.EXHAUSTED);
        LOG.info("Optimization {} after {} generations: conflicts {} -> {}, delay {} min.",
                status, generation, initialConflicts, best.conflictCount, best.delayMinutes);

        Map<String, TrainGene> bestGenes = new LinkedHashMap<>();
        for (TrainGene gene : best.genes) {
            bestGenes.put(gene.trainId, gene);
        }
        List<Train> optimized = new ArrayList<>(trains.size());
        List<Adjustment> adjustments = new ArrayList<>();
        for (Train train : trains) {
            Train copy = train.clone();
            TrainGene gene = bestGenes.get(train.id);
            if (gene != null) {
                Adjustment adjustment = gene.toAdjustment();
                if (!adjustment.isEmpty()) {
                    adjustment.applyTo(copy);
                    adjustments.add(adjustment);
                }
            }
            optimized.add(copy);
        }
        return new OptimizationResult(status, optimized, adjustments, initialConflicts, best.conflictCount,
                generation, history);
    }

    private Chromosome identity (List<Train> trains) {
        List<TrainGene> genes = new ArrayList<>(trains.size());
        for (Train train : trains) {
            genes.add(new TrainGene(train.id, train.stops.size()));
        }
        return new Chromosome(genes);
    }

    private Chromosome randomChromosome (List<Train> trains, Random random) {
        Chromosome chromosome = identity(trains);
        int maxShift = config.initialShiftMinutes();
        for (int t = 0; t < trains.size(); t++) {
            TrainGene gene = chromosome.genes.get(t);
            if (maxShift > 0) {
                gene.departureOffsetMinutes = random.nextInt(2 * maxShift + 1) - maxShift;
            }
            for (int s : dwellStops(trains.get(t))) {
                if (random.nextBoolean()) {
                    gene.dwellOffsets[s] = random.nextInt(config.initialDwellMinutes() + 1);
                }
            }
        }
        return chromosome;
    }

    private List<Chromosome> breed (List<Chromosome> sorted, Map<String, Train> trainsById, Random random) {
        List<Chromosome> next = new ArrayList<>(sorted.size());
        for (int i = 0; i < config.eliteCount(); i++) {
            next.add(sorted.get(i).copy());
        }
        while (next.size() < sorted.size()) {
            Chromosome a = tournament(sorted, random);
            Chromosome b = tournament(sorted, random);
            Chromosome child = crossover(a, b, random);
            mutate(child, trainsById, random);
            next.add(child);
        }
        return next;
    }

    /** Binary tournament: the fitter of two chromosomes picked at random. */
    private static Chromosome tournament (List<Chromosome> population, Random random) {
        Chromosome a = population.get(random.nextInt(population.size()));
        Chromosome b = population.get(random.nextInt(population.size()));
        return a.fitness <= b.fitness ? a : b;
    }

    /** Uniform crossover: each train's gene is taken whole from one parent or the other. */
    private static Chromosome crossover (Chromosome a, Chromosome b, Random random) {
        List<TrainGene> genes = new ArrayList<>(a.genes.size());
        for (int i = 0; i < a.genes.size(); i++) {
            genes.add((random.nextBoolean() ? a : b).genes.get(i).copy());
        }
        Chromosome child = new Chromosome(genes);
        child.conflictingTrainIds.addAll(a.conflictingTrainIds);
        child.conflictingTrainIds.addAll(b.conflictingTrainIds);
        return child;
    }

    private void mutate (Chromosome chromosome, Map<String, Train> trainsById, Random random) {
        for (TrainGene gene : chromosome.genes) {
            boolean conflicting = chromosome.conflictingTrainIds.contains(gene.trainId);
            double chance = conflicting ? Math.min(1, config.mutationRate() * 2.5) : config.mutationRate() * 0.5;
            if (random.nextDouble() >= chance) continue;
            Train train = trainsById.get(gene.trainId);
            List<Integer> dwellStops = dwellStops(train);
            if (conflicting && random.nextDouble() < 0.6) {
                shiftDeparture(gene, random);
                continue;
            }
            double r = random.nextDouble();
            if (r < 0.3 && changeTrack(gene, train, random)) {
                continue;
            }
            if (dwellStops.isEmpty()) {
                shiftDeparture(gene, random);
                continue;
            }
            int s = dwellStops.get(random.nextInt(dwellStops.size()));
            if (r < 0.5) {
                // Small nudge of half a minute or a minute either way.
                double nudge = random.nextBoolean() ? 0.5 : 1.0;
                gene.dwellOffsets[s] += random.nextBoolean() ? nudge : -nudge;
            } else {
                gene.dwellOffsets[s] += random.nextInt(5) - 1;
            }
            gene.dwellOffsets[s] = Math.max(0, gene.dwellOffsets[s]);
        }
        chromosome.evaluated = false;
    }

    private static void shiftDeparture (TrainGene gene, Random random) {
        int shift = 1 + random.nextInt(MAX_MUTATION_SHIFT);
        gene.departureOffsetMinutes += random.nextBoolean() ? shift : -shift;
    }

    /** Move the train to another platform at one of its stops, if any station on the route has several. */
    private boolean changeTrack (TrainGene gene, Train train, Random random) {
        List<Integer> candidates = new ArrayList<>();
        for (int s = 0; s < train.stops.size(); s++) {
            Stop stop = train.stops.get(s);
            Station station = network.getStation(stop.stationId);
            if (!stop.skipped && station != null && station.platforms > 1) {
                candidates.add(s);
            }
        }
        if (candidates.isEmpty()) return false;
        int s = candidates.get(random.nextInt(candidates.size()));
        int platforms = Math.min(network.getStation(train.stops.get(s).stationId).platforms, MAX_PLATFORMS);
        gene.tracks[s] = Integer.toString(1 + random.nextInt(platforms));
        return true;
    }

    /** Indexes of the stops where extra dwell shifts the rest of the route: intermediate stops the train calls at. */
    private static List<Integer> dwellStops (Train train) {
        List<Integer> stops = new ArrayList<>();
        for (int s = 1; s < train.stops.size() - 1; s++) {
            if (!train.stops.get(s).skipped) {
                stops.add(s);
            }
        }
        return stops;
    }

    /**
     * Applies chromosomes to copies of the evolving trains, propagates them and counts conflicts with each other and
     * with the fixed timetables. Evaluation only reads shared state, so chromosomes can be evaluated in parallel.
     */
    private class Evaluator {

        final List<Train> trains;

        final List<Timetable> fixedTimetables;

        final Set<String> evolvingIds = new HashSet<>();

        Evaluator (List<Train> trains, List<Timetable> fixedTimetables) {
            this.trains = trains;
            this.fixedTimetables = fixedTimetables;
            for (Train train : trains) {
                evolvingIds.add(train.id);
            }
        }

        void evaluateAll (List<Chromosome> population) {
            (config.parallelEvaluation() ? population.parallelStream() : population.stream())
                    .filter(c -> !c.evaluated)
                    .forEach(this::evaluate);
        }

        void evaluate (Chromosome chromosome) {
            List<Timetable> timetables = new ArrayList<>(fixedTimetables);
            chromosome.delayMinutes = 0;
            chromosome.trackChanges = 0;
            try {
                for (int t = 0; t < trains.size(); t++) {
                    Train train = trains.get(t);
                    TrainGene gene = chromosome.genes.get(t);
                    Train copy = train.clone();
                    gene.toAdjustment().applyTo(copy);
                    timetables.add(propagator.propagate(copy));
                    chromosome.delayMinutes += gene.delayMinutes();
                    for (int s = 0; s < gene.tracks.length; s++) {
                        if (gene.tracks[s] != null && !gene.tracks[s].equals(train.stops.get(s).track)) {
                            chromosome.trackChanges += 1;
                        }
                    }
                }
            } catch (ScheduleException e) {
                // A pinned time can make an adjusted train impossible to schedule. Such a chromosome never wins.
                LOG.debug("Chromosome could not be evaluated: {}", e.getMessage());
                chromosome.fitness = Double.POSITIVE_INFINITY;
                chromosome.conflictCount = Integer.MAX_VALUE;
                chromosome.evaluated = true;
                return;
            }
            Set<String> conflicting = new HashSet<>();
            int count = 0;
            for (Conflict conflict : detector.detect(timetables)) {
                boolean involvesEvolving = false;
                for (String trainId : conflict.trainIds) {
                    if (evolvingIds.contains(trainId)) {
                        conflicting.add(trainId);
                        involvesEvolving = true;
                    }
                }
                if (involvesEvolving) count += 1;
            }
            chromosome.conflictCount = count;
            chromosome.conflictingTrainIds = conflicting;
            chromosome.fitness = count * config.conflictWeight()
                    + chromosome.delayMinutes * config.delayWeight()
                    + chromosome.trackChanges * config.trackChangeWeight();
            chromosome.evaluated = true;
        }
    }

}
