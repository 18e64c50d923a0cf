package de.bsommerfeld.rentalprice.features.engine;

/**
 * A per-listing problem that did not abort the run. The affected columns
 * hold the engine's sentinel or a best-effort value.
 */
public record SoftFailure(String listingId, String engine, String reason) {
}
