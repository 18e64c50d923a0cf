package de.bsommerfeld.rentalprice.features.amenity;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of parsing one amenity text. Names keep their first-seen order.
 * A {@link Status#MALFORMED} result always carries an empty set and the
 * reason it was rejected.
 */
public record AmenityParseResult(Set<String> amenities, Status status, String reason) {

    public enum Status {
        PARSED,
        EMPTY,
        MALFORMED
    }

    private static final AmenityParseResult EMPTY_RESULT = new AmenityParseResult(Set.of(), Status.EMPTY, null);

    public AmenityParseResult {
        amenities = Collections.unmodifiableSet(new LinkedHashSet<>(amenities));
    }

    public static AmenityParseResult parsed(Set<String> amenities) {
        return amenities.isEmpty() ? EMPTY_RESULT : new AmenityParseResult(amenities, Status.PARSED, null);
    }

    public static AmenityParseResult empty() {
        return EMPTY_RESULT;
    }

    public static AmenityParseResult malformed(String reason) {
        return new AmenityParseResult(Set.of(), Status.MALFORMED, reason);
    }

    public boolean isMalformed() {
        return status == Status.MALFORMED;
    }
}
