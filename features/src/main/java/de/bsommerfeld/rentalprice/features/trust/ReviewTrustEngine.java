package de.bsommerfeld.rentalprice.features.trust;

import de.bsommerfeld.rentalprice.core.config.TrustConfig;
import de.bsommerfeld.rentalprice.core.domain.HostProfile;
import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.core.domain.ReviewScores;
import de.bsommerfeld.rentalprice.features.engine.PerListingFeatureEngine;

import java.time.LocalDate;
import java.util.List;

import static de.bsommerfeld.rentalprice.features.engine.Sentinels.CONSISTENCY_UNKNOWN;
import static de.bsommerfeld.rentalprice.features.engine.Sentinels.UNKNOWN;
import static de.bsommerfeld.rentalprice.features.engine.Sentinels.flag;

/**
 * Review credibility and host quality columns, see {@link TrustScoring}.
 */
public class ReviewTrustEngine extends PerListingFeatureEngine {

    public static final String NAME = "review_trust";

    private static final List<String> COLUMNS = List.of(
            "rating_normalized", "has_enough_reviews", "reviews_log", "review_frequency",
            "avg_detailed_rating", "rating_consistency", "trust_score",
            "is_superhost", "is_identity_verified", "host_response_rate", "host_experience_years",
            "is_professional_host", "host_quality_score");

    private final TrustScoring scoring;
    private final LocalDate referenceDate;

    public ReviewTrustEngine(TrustConfig config, LocalDate referenceDate) {
        this.scoring = new TrustScoring(config);
        this.referenceDate = referenceDate;
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
    protected double[] computeRow(Listing listing, List<String> warnings) {
        ReviewScores reviews = listing.reviews();
        HostProfile host = listing.host();
        int count = reviews.numberOfReviews();
        Double perMonth = reviews.reviewsPerMonth();
        return new double[] {
                scoring.normalizedRating(reviews.rating()),
                flag(scoring.hasEnoughReviews(count)),
                Math.log1p(count),
                perMonth == null || perMonth.isNaN() ? 0.0 : perMonth,
                scoring.averageDetailedRating(reviews),
                scoring.ratingConsistency(reviews),
                scoring.trustScore(reviews),
                host.superhost() == null ? UNKNOWN : flag(host.superhost()),
                host.identityVerified() == null ? UNKNOWN : flag(host.identityVerified()),
                scoring.responseRate(host),
                scoring.hostExperienceYears(host, referenceDate),
                host.listingsCount() == null ? UNKNOWN : flag(scoring.isProfessionalHost(host)),
                scoring.hostQuality(host, referenceDate)
        };
    }

    @Override
    public double[] sentinelRow() {
        double[] row = filled(COLUMNS.size(), UNKNOWN);
        row[0] = 0.0;
        row[1] = 0.0;
        row[2] = 0.0;
        row[3] = 0.0;
        row[5] = CONSISTENCY_UNKNOWN;
        row[6] = 0.0;
        row[12] = 0.0;
        return row;
    }
}
