package de.bsommerfeld.rentalprice.features.trust;

import de.bsommerfeld.rentalprice.core.config.TrustConfig;
import de.bsommerfeld.rentalprice.core.domain.HostProfile;
import de.bsommerfeld.rentalprice.core.domain.ReviewScores;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static de.bsommerfeld.rentalprice.features.engine.Sentinels.CONSISTENCY_UNKNOWN;
import static de.bsommerfeld.rentalprice.features.engine.Sentinels.UNKNOWN;
import static de.bsommerfeld.rentalprice.features.engine.Sentinels.clamp;

/**
 * Scoring rules for review credibility and host quality. All weights and
 * thresholds come from {@link TrustConfig}; results of the two composite
 * scores stay within [0, 1].
 */
public final class TrustScoring {

    private static final double DAYS_PER_YEAR = 365.25;

    private final TrustConfig config;

    public TrustScoring(TrustConfig config) {
        this.config = config;
    }

    /** Overall rating mapped to [0, 1]; 0 when the listing has no rating. */
    public double normalizedRating(Double rating) {
        if (rating == null || rating.isNaN()) {
            return 0.0;
        }
        return clamp(rating / config.getRatingScale(), 0.0, 1.0);
    }

    public double reviewSaturation(int numberOfReviews) {
        int saturation = config.getReviewSaturation();
        return Math.min(numberOfReviews, saturation) / (double) saturation;
    }

    public boolean hasEnoughReviews(int numberOfReviews) {
        return numberOfReviews >= config.getMinReviews();
    }

    public double trustScore(ReviewScores reviews) {
        double score = config.getRatingWeight() * normalizedRating(reviews.rating())
                + config.getReviewCountWeight() * reviewSaturation(reviews.numberOfReviews())
                + config.getSufficiencyWeight() * (hasEnoughReviews(reviews.numberOfReviews()) ? 1.0 : 0.0);
        return clamp(score, 0.0, 1.0);
    }

    /** Mean of the present sub-ratings on the rating scale; UNKNOWN without any. */
    public double averageDetailedRating(ReviewScores reviews) {
        List<Double> present = reviews.presentSubRatings();
        if (present.isEmpty()) {
            return UNKNOWN;
        }
        return statistics(present).getMean();
    }

    /**
     * Negative sample standard deviation of the present sub-ratings.
     * {@link de.bsommerfeld.rentalprice.features.engine.Sentinels#CONSISTENCY_UNKNOWN}
     * with fewer than two.
     */
    public double ratingConsistency(ReviewScores reviews) {
        List<Double> present = reviews.presentSubRatings();
        if (present.size() < 2) {
            return CONSISTENCY_UNKNOWN;
        }
        return 0.0 - statistics(present).getStandardDeviation();
    }

    public double hostExperienceYears(HostProfile host, LocalDate referenceDate) {
        if (host.hostSince() == null || host.hostSince().isAfter(referenceDate)) {
            return UNKNOWN;
        }
        return ChronoUnit.DAYS.between(host.hostSince(), referenceDate) / DAYS_PER_YEAR;
    }

    public double responseRate(HostProfile host) {
        Double rate = host.responseRate();
        return rate == null || rate.isNaN() ? UNKNOWN : clamp(rate, 0.0, 1.0);
    }

    public boolean isProfessionalHost(HostProfile host) {
        return host.listingsCount() != null && host.listingsCount() > config.getProfessionalHostListings();
    }

    /** Weighted host quality; inputs the host has not published contribute 0. */
    public double hostQuality(HostProfile host, LocalDate referenceDate) {
        double years = hostExperienceYears(host, referenceDate);
        double tenure = years == UNKNOWN ? 0.0 : Math.min(years, config.getTenureCapYears()) / config.getTenureCapYears();
        double response = responseRate(host);
        double score = config.getSuperhostWeight() * (Boolean.TRUE.equals(host.superhost()) ? 1.0 : 0.0)
                + config.getResponseRateWeight() * (response == UNKNOWN ? 0.0 : response)
                + config.getVerificationWeight() * (Boolean.TRUE.equals(host.identityVerified()) ? 1.0 : 0.0)
                + config.getTenureWeight() * tenure;
        return clamp(score, 0.0, 1.0);
    }

    private DescriptiveStatistics statistics(List<Double> ratings) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (double rating : ratings) {
            stats.addValue(clamp(rating, 0.0, config.getRatingScale()));
        }
        return stats;
    }
}
