package de.bsommerfeld.rentalprice.features.engine;

import de.bsommerfeld.rentalprice.core.domain.Listing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Base for engines whose rows depend on a single listing only. The batch
 * is cut into contiguous chunks that run on the shared executor; results
 * are stitched back in input order.
 *
 * <p>
 * An exception while computing one row is contained: the row is replaced
 * by {@link #sentinelRow()} and recorded as a {@link SoftFailure}.
 */
public abstract class PerListingFeatureEngine implements FeatureEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PerListingFeatureEngine.class);

    private static final int MIN_CHUNK = 64;

    /**
     * Computes one row. Recoverable data problems that still allow a row
     * are reported through {@code warnings}.
     */
    protected abstract double[] computeRow(Listing listing, List<String> warnings);


    @Override
    public EngineOutput compute(List<Listing> listings, ExecutorService executor) {
        int n = listings.size();
        double[][] rows = new double[n][];
        List<SoftFailure> failures = new ArrayList<>();
        if (n == 0) {
            return new EngineOutput(name(), columns(), rows, failures);
        }

        int chunk = Math.max(MIN_CHUNK, n / Math.max(1, Runtime.getRuntime().availableProcessors() * 2) + 1);
        List<CompletableFuture<List<SoftFailure>>> futures = new ArrayList<>();
        for (int start = 0; start < n; start += chunk) {
            int from = start;
            int to = Math.min(n, start + chunk);
            futures.add(CompletableFuture.supplyAsync(() -> computeRange(listings, rows, from, to), executor));
        }
        for (CompletableFuture<List<SoftFailure>> future : futures) {
            failures.addAll(future.join());
        }
        return new EngineOutput(name(), columns(), rows, failures);
    }

    private List<SoftFailure> computeRange(List<Listing> listings, double[][] rows, int from, int to) {
        List<SoftFailure> failures = new ArrayList<>();
        int width = columns().size();
        for (int i = from; i < to; i++) {
            Listing listing = listings.get(i);
            List<String> warnings = new ArrayList<>(1);
            double[] row;
            try {
                row = computeRow(listing, warnings);
                if (row.length != width) {
                    throw new IllegalStateException("row width " + row.length + " != " + width);
                }
            } catch (RuntimeException e) {
                LOG.warn("Engine '{}' failed for listing {}: {}", name(), listing.id(), e.toString());
                row = sentinelRow();
                warnings.add("computation failed: " + e.getMessage());
            }
            for (String warning : warnings) {
                failures.add(new SoftFailure(listing.id(), name(), warning));
            }
            rows[i] = row;
        }
        return failures;
    }

    protected static double[] filled(int width, double value) {
        double[] row = new double[width];
        Arrays.fill(row, value);
        return row;
    }
}
