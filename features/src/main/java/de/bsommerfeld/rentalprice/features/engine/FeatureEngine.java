package de.bsommerfeld.rentalprice.features.engine;

import de.bsommerfeld.rentalprice.core.domain.Listing;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Produces a fixed block of feature columns for a batch of listings.
 *
 * <p>
 * {@link #columns()} is known before {@link #compute} runs, so the
 * assembler can reject name collisions without touching any data.
 * Implementations never drop a listing: when a value cannot be derived
 * the engine writes its documented sentinel and reports a
 * {@link SoftFailure}.
 */
public interface FeatureEngine {

    /** Short name used in logs, events and the feature summary. */
    String name();

    /** Output columns in emission order. */
    List<String> columns();

    /**
     * @param listings batch in caller order; the output keeps that order
     * @param executor pool for per-listing work, shared across engines
     */
    EngineOutput compute(List<Listing> listings, ExecutorService executor);

    /**
     * Row of documented neutral values, used for a listing the engine
     * could not process.
     */
    double[] sentinelRow();
}
