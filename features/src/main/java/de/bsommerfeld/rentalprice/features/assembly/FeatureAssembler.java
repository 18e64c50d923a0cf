package de.bsommerfeld.rentalprice.features.assembly;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.core.event.PipelineEventBus;
import de.bsommerfeld.rentalprice.core.event.PipelineEvents;
import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;
import de.bsommerfeld.rentalprice.features.engine.EngineOutput;
import de.bsommerfeld.rentalprice.features.engine.FeatureEngine;
import de.bsommerfeld.rentalprice.features.engine.SoftFailure;
import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import de.bsommerfeld.rentalprice.features.matrix.FeatureSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Joins the column blocks of all engines into one {@link FeatureMatrix}.
 *
 * <p>
 * The combined schema is checked when the assembler is created, so a name
 * collision surfaces as a {@link ConfigurationException} before any
 * listing is processed. Every input listing yields exactly one row: if an
 * engine throws for the whole batch its block is filled with the engine's
 * sentinel row and the failure is reported per listing.
 */
public class FeatureAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureAssembler.class);

    private final List<FeatureEngine> engines;
    private final FeatureSchema schema;
    private final PipelineEventBus eventBus;
    private final int parallelism;

    public FeatureAssembler(List<FeatureEngine> engines, PipelineEventBus eventBus, int parallelism) {
        this.engines = List.copyOf(engines);
        this.eventBus = eventBus;
        this.parallelism = Math.max(1, parallelism);
        this.schema = buildSchema(this.engines);
    }

    public FeatureSchema schema() {
        return schema;
    }

    /**
     * Rejects column names declared by more than one engine (or twice by
     * the same engine).
     */
    static FeatureSchema buildSchema(List<FeatureEngine> engines) {
        Map<String, String> owner = new HashMap<>();
        List<String> columns = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        for (FeatureEngine engine : engines) {
            for (String column : engine.columns()) {
                String previous = owner.putIfAbsent(column, engine.name());
                if (previous != null) {
                    throw new ConfigurationException("Feature column '" + column + "' is produced by both '"
                            + previous + "' and '" + engine.name() + "'");
                }
                columns.add(column);
                sources.add(engine.name());
            }
        }
        return new FeatureSchema(columns, sources);
    }

    /**
     * @throws IllegalArgumentException if two listings share an id
     */
    public FeatureMatrix assemble(List<Listing> listings) {
        requireUniqueIds(listings);
        LOG.info("Assembling {} feature columns from {} engines for {} listings",
                schema.size(), engines.size(), listings.size());
        long start = System.nanoTime();

        ExecutorService executor = Executors.newFixedThreadPool(parallelism,
                new ThreadFactoryBuilder().setNameFormat("feature-worker-%d").setDaemon(true).build());
        List<SoftFailure> failures = new ArrayList<>();
        double[][] rows = new double[listings.size()][schema.size()];
        try {
            int offset = 0;
            for (FeatureEngine engine : engines) {
                EngineOutput output = runEngine(engine, listings, executor);
                int width = engine.columns().size();
                for (int i = 0; i < listings.size(); i++) {
                    System.arraycopy(output.rows()[i], 0, rows[i], offset, width);
                }
                failures.addAll(output.failures());
                offset += width;
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        List<String> ids = new ArrayList<>(listings.size());
        listings.forEach(l -> ids.add(l.id()));
        FeatureMatrix matrix = new FeatureMatrix(ids, schema, rows);

        for (SoftFailure failure : failures) {
            eventBus.post(new PipelineEvents.MalformedRecordEvent(failure.listingId(), failure.engine(), failure.reason()));
        }
        if (!failures.isEmpty()) {
            LOG.warn("{} soft failures while assembling features", failures.size());
        }
        LOG.info("Assembled {} in {} ms", matrix, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        eventBus.post(new PipelineEvents.FeaturesAssembledEvent(matrix.rowCount(), matrix.columnCount(), failures.size()));
        return matrix;
    }

    private EngineOutput runEngine(FeatureEngine engine, List<Listing> listings, ExecutorService executor) {
        try {
            EngineOutput output = engine.compute(listings, executor);
            if (output.rowCount() != listings.size()) {
                throw new IllegalStateException("engine returned " + output.rowCount() + " rows for "
                        + listings.size() + " listings");
            }
            return output;
        } catch (RuntimeException e) {
            LOG.warn("Engine '{}' failed for the whole batch, writing sentinels: {}", engine.name(), e.toString());
            double[][] rows = new double[listings.size()][];
            List<SoftFailure> failures = new ArrayList<>(listings.size());
            for (int i = 0; i < listings.size(); i++) {
                rows[i] = engine.sentinelRow();
                failures.add(new SoftFailure(listings.get(i).id(), engine.name(), "engine failed: " + e.getMessage()));
            }
            return new EngineOutput(engine.name(), engine.columns(), rows, failures);
        }
    }

    private static void requireUniqueIds(List<Listing> listings) {
        Set<String> seen = new HashSet<>();
        for (Listing listing : listings) {
            if (!seen.add(listing.id())) {
                throw new IllegalArgumentException("Duplicate listing id: " + listing.id());
            }
        }
    }
}
