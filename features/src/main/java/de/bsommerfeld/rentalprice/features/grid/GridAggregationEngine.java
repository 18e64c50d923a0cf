package de.bsommerfeld.rentalprice.features.grid;

import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.features.engine.EngineOutput;
import de.bsommerfeld.rentalprice.features.engine.FeatureEngine;
import de.bsommerfeld.rentalprice.features.engine.Sentinels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Neighbourhood price level per grid cell: {@code grid_avg_price},
 * {@code grid_median_price} and {@code grid_listing_count}.
 *
 * <p>
 * Runs in two phases. Every listing is bucketed first; only then is each
 * cell reduced, with its prices sorted before summation, so the result
 * does not depend on input order. A listing's own price is part of its
 * cell's aggregate, which makes single-listing cells echo their own price.
 * Cells without any known price fall back to the global mean (0 when the
 * batch has no prices at all).
 */
public class GridAggregationEngine implements FeatureEngine {

    private static final Logger LOG = LoggerFactory.getLogger(GridAggregationEngine.class);

    public static final String NAME = "grid";

    private static final List<String> COLUMNS = List.of("grid_avg_price", "grid_median_price", "grid_listing_count");

    private final double cellSizeDegrees;

    public GridAggregationEngine(double cellSizeDegrees) {
        if (!(cellSizeDegrees > 0)) {
            throw new IllegalArgumentException("cell size must be positive: " + cellSizeDegrees);
        }
        this.cellSizeDegrees = cellSizeDegrees;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> columns() {
        return COLUMNS;
    }

    @Override
    public EngineOutput compute(List<Listing> listings, ExecutorService executor) {
        // Phase 1: bucket
        Map<GridCell, List<Integer>> cells = new HashMap<>();
        List<Double> allPrices = new ArrayList<>();
        for (int i = 0; i < listings.size(); i++) {
            Listing listing = listings.get(i);
            cells.computeIfAbsent(GridCell.of(listing.location(), cellSizeDegrees), c -> new ArrayList<>()).add(i);
            if (listing.hasPrice()) {
                allPrices.add(listing.price());
            }
        }
        double globalMean = mean(sorted(allPrices));

        // Phase 2: reduce per cell
        double[][] rows = new double[listings.size()][];
        List<CompletableFuture<Void>> futures = new ArrayList<>(cells.size());
        for (List<Integer> members : cells.values()) {
            futures.add(CompletableFuture.runAsync(() -> reduceCell(listings, members, globalMean, rows), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        LOG.debug("Grid aggregation: {} listings in {} cells", listings.size(), cells.size());
        return new EngineOutput(NAME, COLUMNS, rows, List.of());
    }

    @Override
    public double[] sentinelRow() {
        return new double[] { Sentinels.UNKNOWN, Sentinels.UNKNOWN, Sentinels.UNKNOWN };
    }

    private static void reduceCell(List<Listing> listings, List<Integer> members, double globalMean, double[][] rows) {
        List<Double> prices = new ArrayList<>(members.size());
        for (int index : members) {
            Listing listing = listings.get(index);
            if (listing.hasPrice()) {
                prices.add(listing.price());
            }
        }
        double[] values = sorted(prices);
        double avg = values.length == 0 ? globalMean : mean(values);
        double median = values.length == 0 ? globalMean : median(values);
        for (int index : members) {
            rows[index] = new double[] { avg, median, members.size() };
        }
    }

    private static double[] sorted(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        Arrays.sort(array);
        return array;
    }

    private static double mean(double[] sortedValues) {
        if (sortedValues.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : sortedValues) {
            sum += v;
        }
        return sum / sortedValues.length;
    }

    private static double median(double[] sortedValues) {
        int n = sortedValues.length;
        return n % 2 == 1 ? sortedValues[n / 2] : (sortedValues[n / 2 - 1] + sortedValues[n / 2]) / 2.0;
    }
}
