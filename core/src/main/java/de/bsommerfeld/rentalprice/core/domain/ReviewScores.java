package de.bsommerfeld.rentalprice.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Guest review signals of a listing. Ratings use the platform's 0–5 scale;
 * any rating may be {@code null} when the platform has not published it yet.
 *
 * @param rating          overall rating
 * @param accuracy        accuracy sub-rating
 * @param cleanliness     cleanliness sub-rating
 * @param checkin         check-in sub-rating
 * @param communication   communication sub-rating
 * @param locationRating  location sub-rating
 * @param value           value-for-money sub-rating
 * @param numberOfReviews total review count, never negative
 * @param reviewsPerMonth review velocity, {@code null} if unknown
 */
public record ReviewScores(
        Double rating,
        Double accuracy,
        Double cleanliness,
        Double checkin,
        Double communication,
        Double locationRating,
        Double value,
        int numberOfReviews,
        Double reviewsPerMonth) {

    public static final ReviewScores NONE = new ReviewScores(null, null, null, null, null, null, null, 0, null);

    public ReviewScores {
        if (numberOfReviews < 0)
            throw new IllegalArgumentException("numberOfReviews must not be negative: " + numberOfReviews);
    }

    /**
     * Convenience constructor for listings that only publish the overall rating.
     */
    public ReviewScores(Double rating, int numberOfReviews, Double reviewsPerMonth) {
        this(rating, null, null, null, null, null, null, numberOfReviews, reviewsPerMonth);
    }

    /**
     * Returns the sub-ratings that are present, in declaration order.
     */
    public List<Double> presentSubRatings() {
        List<Double> present = new ArrayList<>(6);
        for (Double d : new Double[] { accuracy, cleanliness, checkin, communication, locationRating, value }) {
            if (d != null && !d.isNaN())
                present.add(d);
        }
        return Collections.unmodifiableList(present);
    }
}
