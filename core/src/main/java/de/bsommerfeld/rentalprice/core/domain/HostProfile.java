package de.bsommerfeld.rentalprice.core.domain;

import java.time.LocalDate;

/**
 * Host attributes relevant for the host-quality score. Every field is
 * nullable; missing values contribute nothing to the score.
 *
 * @param superhost        platform superhost badge
 * @param identityVerified identity verification flag
 * @param responseRate     response rate as a 0.0–1.0 fraction
 * @param hostSince        date the host joined the platform
 * @param listingsCount    number of listings the host manages
 */
public record HostProfile(
        Boolean superhost,
        Boolean identityVerified,
        Double responseRate,
        LocalDate hostSince,
        Integer listingsCount) {

    public static final HostProfile UNKNOWN = new HostProfile(null, null, null, null, null);
}
