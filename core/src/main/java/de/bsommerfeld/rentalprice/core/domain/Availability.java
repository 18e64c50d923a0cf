package de.bsommerfeld.rentalprice.core.domain;

/**
 * Number of free nights in the next 30, 60 and 90 days. {@code null} means
 * the calendar was not scraped for that window.
 */
public record Availability(Integer next30, Integer next60, Integer next90) {

    public static final Availability UNKNOWN = new Availability(null, null, null);
}
