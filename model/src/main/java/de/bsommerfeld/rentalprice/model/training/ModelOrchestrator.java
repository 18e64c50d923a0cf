package de.bsommerfeld.rentalprice.model.training;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.rentalprice.core.config.ModelConfig;
import de.bsommerfeld.rentalprice.core.config.RegressorConfig;
import de.bsommerfeld.rentalprice.core.config.WeightStrategy;
import de.bsommerfeld.rentalprice.core.event.PipelineEventBus;
import de.bsommerfeld.rentalprice.core.event.PipelineEvents;
import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;
import de.bsommerfeld.rentalprice.core.exception.InsufficientModelsException;
import de.bsommerfeld.rentalprice.core.exception.TrainingFailureException;
import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import de.bsommerfeld.rentalprice.model.regressor.FittedRegressor;
import de.bsommerfeld.rentalprice.model.regressor.Regressor;
import de.bsommerfeld.rentalprice.model.regressor.RegressorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Trains every configured regressor on the same split, isolates
 * individual failures and combines the survivors into an {@link Ensemble}.
 * Regressors run concurrently; they only read the shared training arrays.
 */
public class ModelOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(ModelOrchestrator.class);
    private static final long QUEUED_POLL_MILLIS = 50;

    private final ModelConfig config;
    private final RegressorFactory factory;
    private final PipelineEventBus eventBus;
    private final int parallelism;

    public ModelOrchestrator(ModelConfig config, RegressorFactory factory, PipelineEventBus eventBus,
            int parallelism) {
        this.config = config;
        this.factory = factory;
        this.eventBus = eventBus;
        this.parallelism = Math.max(1, parallelism);
    }

    /** Predictor columns: every matrix column except the target, in matrix order. */
    public static List<String> predictorColumns(FeatureMatrix matrix, String targetColumn) {
        List<String> out = new ArrayList<>(matrix.columns());
        out.remove(targetColumn);
        return out;
    }

    public TrainingResult train(FeatureMatrix matrix) {
        return train(matrix, config.getTargetColumn());
    }

    /**
     * @throws ConfigurationException   if the target column is missing or a
     *                                  regressor or weight entry is unusable
     * @throws IllegalArgumentException if the matrix has too few labelled rows
     */
    public TrainingResult train(FeatureMatrix matrix, String targetColumn) {
        if (!matrix.schema().contains(targetColumn)) {
            throw new ConfigurationException("Target column not in feature matrix: " + targetColumn);
        }
        Map<String, RegressorConfig> entries = new LinkedHashMap<>();
        List<Regressor> regressors = new ArrayList<>();
        for (RegressorConfig entry : config.getRegressors()) {
            regressors.add(factory.create(entry, config.getRandomSeed()));
            entries.put(entry.getName(), entry);
        }

        TrainTestSplit split = TrainTestSplit.of(matrix, targetColumn, config.getHeldOutFraction(),
                config.getRandomSeed());
        List<String> predictors = predictorColumns(matrix, targetColumn);
        double[][] x = split.train().columns(predictors);
        double[] y = split.train().column(targetColumn);

        LOG.info("Training {} regressors on {} rows x {} features", regressors.size(), x.length, predictors.size());
        List<TrainedModel> trained = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        fitAll(regressors, predictors, x, y, trained, failures);

        Ensemble ensemble = null;
        InsufficientModelsException ensembleFailure = null;
        if (trained.size() < 2) {
            ensembleFailure = new InsufficientModelsException(trained.size(), new ArrayList<>(failures.keySet()));
            LOG.warn(ensembleFailure.getMessage());
        } else {
            double[] weights = weights(trained, entries, split.train(), targetColumn, predictors);
            ensemble = new Ensemble(trained, weights);
            List<String> names = new ArrayList<>();
            List<Double> boxed = new ArrayList<>();
            for (int i = 0; i < trained.size(); i++) {
                names.add(trained.get(i).name());
                boxed.add(weights[i]);
            }
            LOG.info("Built {}", ensemble);
            eventBus.post(new PipelineEvents.EnsembleBuiltEvent(names, boxed));
        }
        return new TrainingResult(targetColumn, split, trained, failures, ensemble, ensembleFailure);
    }

    /**
     * Every regressor gets its own daemon thread, while a fair semaphore caps
     * how many fit at once. The timeout is one deadline per model, counted
     * from the moment its fit starts. A fit that ignores interruption is
     * abandoned on timeout and gives up its slot so queued models still run.
     */
    private void fitAll(List<Regressor> regressors, List<String> predictors, double[][] x, double[] y,
            List<TrainedModel> trained, Map<String, String> failures) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, regressors.size()),
                new ThreadFactoryBuilder().setNameFormat("model-trainer-%d").setDaemon(true).build());
        Semaphore slots = new Semaphore(parallelism, true);
        try {
            List<FitTask> tasks = new ArrayList<>();
            List<Future<TrainedModel>> futures = new ArrayList<>();
            for (Regressor regressor : regressors) {
                FitTask task = new FitTask(regressor, predictors, x, y, slots);
                tasks.add(task);
                futures.add(pool.submit(task));
            }
            for (int i = 0; i < regressors.size(); i++) {
                String name = regressors.get(i).name();
                try {
                    TrainedModel model = await(name, tasks.get(i), futures.get(i));
                    trained.add(model);
                    LOG.info("Trained {} in {} ms", name, model.trainingTime().toMillis());
                    eventBus.post(new PipelineEvents.ModelTrainedEvent(name, model.trainingTime()));
                } catch (TrainingFailureException e) {
                    String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                    failures.put(name, reason);
                    LOG.warn("Regressor {} failed: {}", name, reason);
                    eventBus.post(new PipelineEvents.ModelFailedEvent(name, reason));
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static TrainedModel fitOne(Regressor regressor, List<String> predictors, double[][] x, double[] y) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        FittedRegressor fitted = regressor.fit(x, y);
        return new TrainedModel(regressor.name(), regressor.type(), predictors, fitted, stopwatch.elapsed());
    }

    private TrainedModel await(String name, FitTask task, Future<TrainedModel> future) {
        long timeout = config.getTrainingTimeoutSeconds();
        try {
            if (timeout <= 0) {
                return future.get();
            }
            long timeoutNanos = TimeUnit.SECONDS.toNanos(timeout);
            while (true) {
                long startedAt = task.startedAt;
                if (startedAt < 0) {
                    try {
                        return future.get(QUEUED_POLL_MILLIS, TimeUnit.MILLISECONDS);
                    } catch (TimeoutException stillQueued) {
                        continue;
                    }
                }
                long remaining = startedAt + timeoutNanos - System.nanoTime();
                try {
                    if (remaining <= 0) {
                        throw new TimeoutException();
                    }
                    return future.get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    task.releaseSlot();
                    throw new TrainingFailureException(name, "timed out after " + timeout + "s", e);
                }
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TrainingFailureException) {
                throw (TrainingFailureException) cause;
            }
            throw new TrainingFailureException(name, cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                    cause);
        } catch (CancellationException e) {
            throw new TrainingFailureException(name, "cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            task.releaseSlot();
            throw new TrainingFailureException(name, "interrupted", e);
        }
    }

    /** One fit holding a concurrency slot from start until it returns or is abandoned. */
    private static final class FitTask implements Callable<TrainedModel> {

        private final Regressor regressor;
        private final List<String> predictors;
        private final double[][] x;
        private final double[] y;
        private final Semaphore slots;
        private final AtomicBoolean holdsSlot = new AtomicBoolean();
        private volatile long startedAt = -1;

        private FitTask(Regressor regressor, List<String> predictors, double[][] x, double[] y, Semaphore slots) {
            this.regressor = regressor;
            this.predictors = predictors;
            this.x = x;
            this.y = y;
            this.slots = slots;
        }

        @Override
        public TrainedModel call() throws InterruptedException {
            slots.acquire();
            holdsSlot.set(true);
            startedAt = System.nanoTime();
            try {
                return fitOne(regressor, predictors, x, y);
            } finally {
                releaseSlot();
            }
        }

        void releaseSlot() {
            if (holdsSlot.compareAndSet(true, false)) {
                slots.release();
            }
        }
    }

    private double[] weights(List<TrainedModel> trained, Map<String, RegressorConfig> entries,
            FeatureMatrix train, String targetColumn, List<String> predictors) {
        WeightStrategy strategy = config.getEnsembleWeighting();
        switch (strategy) {
            case CONFIGURED:
                double[] raw = new double[trained.size()];
                double survivingWeight = 0;
                for (int i = 0; i < raw.length; i++) {
                    raw[i] = entries.get(trained.get(i).name()).getWeight();
                    survivingWeight += raw[i];
                }
                if (survivingWeight == 0) {
                    LOG.warn("Every trained model has configured weight 0, falling back to uniform weights");
                    return uniform(trained.size());
                }
                return normalize(raw);
            case OPTIMIZED:
                return optimizedWeights(trained, entries, train, targetColumn, predictors);
            case UNIFORM:
            default:
                return uniform(trained.size());
        }
    }

    /**
     * Re-normalises weights to sum to one.
     *
     * @throws ConfigurationException for negative or all-zero weights
     */
    static double[] normalize(double[] raw) {
        double sum = 0;
        for (double w : raw) {
            if (!(w >= 0) || Double.isInfinite(w)) {
                throw new ConfigurationException("Ensemble weights must be finite and non-negative: "
                        + Arrays.toString(raw));
            }
            sum += w;
        }
        if (sum <= 0) {
            throw new ConfigurationException("Ensemble weights of the trained models are all zero");
        }
        double[] out = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = raw[i] / sum;
        }
        return out;
    }

    static double[] uniform(int k) {
        double[] out = new double[k];
        Arrays.fill(out, 1.0 / k);
        return out;
    }

    /**
     * Refits the trained models' regressors on an inner slice of the
     * training rows, then random-searches the weight simplex for the lowest
     * validation MAE. Uniform weights are always a candidate, so the search
     * never does worse than the default on the validation slice.
     */
    private double[] optimizedWeights(List<TrainedModel> trained, Map<String, RegressorConfig> entries,
            FeatureMatrix train, String targetColumn, List<String> predictors) {
        int k = trained.size();
        TrainTestSplit inner;
        try {
            inner = TrainTestSplit.of(train, targetColumn, config.getValidationFraction(), config.getRandomSeed());
        } catch (IllegalArgumentException e) {
            LOG.warn("Cannot carve a validation slice ({}), using uniform weights", e.getMessage());
            return uniform(k);
        }
        double[][] innerX = inner.train().columns(predictors);
        double[] innerY = inner.train().column(targetColumn);
        double[][] validationX = inner.test().columns(predictors);
        double[] actual = inner.test().column(targetColumn);

        double[][] predictions = new double[k][];
        for (int m = 0; m < k; m++) {
            RegressorConfig entry = entries.get(trained.get(m).name());
            try {
                FittedRegressor fitted = factory.create(entry, config.getRandomSeed()).fit(innerX, innerY);
                predictions[m] = new double[actual.length];
                for (int i = 0; i < actual.length; i++) {
                    predictions[m][i] = fitted.predict(validationX[i]);
                }
            } catch (TrainingFailureException e) {
                LOG.warn("Validation refit of {} failed ({}), using uniform weights", entry.getName(), e.getMessage());
                return uniform(k);
            }
        }

        Random random = new Random(config.getRandomSeed());
        double[] best = uniform(k);
        double bestMae = blendedMae(best, predictions, actual);
        for (int t = 0; t < config.getOptimizationTrials(); t++) {
            double[] candidate = new double[k];
            for (int m = 0; m < k; m++) {
                candidate[m] = -Math.log(1.0 - random.nextDouble());
            }
            candidate = normalize(candidate);
            double mae = blendedMae(candidate, predictions, actual);
            if (mae < bestMae) {
                bestMae = mae;
                best = candidate;
            }
        }
        LOG.info("Optimized ensemble weights {} (validation MAE {})", Arrays.toString(best), bestMae);
        return best;
    }

    static double blendedMae(double[] weights, double[][] predictions, double[] actual) {
        double total = 0;
        for (int i = 0; i < actual.length; i++) {
            double blended = 0;
            for (int m = 0; m < weights.length; m++) {
                blended += weights[m] * predictions[m][i];
            }
            total += Math.abs(blended - actual[i]);
        }
        return total / actual.length;
    }
}
