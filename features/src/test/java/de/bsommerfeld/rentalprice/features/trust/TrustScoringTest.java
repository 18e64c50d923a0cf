package de.bsommerfeld.rentalprice.features.trust;

import de.bsommerfeld.rentalprice.core.config.TrustConfig;
import de.bsommerfeld.rentalprice.core.domain.HostProfile;
import de.bsommerfeld.rentalprice.core.domain.ReviewScores;
import de.bsommerfeld.rentalprice.features.engine.Sentinels;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TrustScoringTest {

    private static final LocalDate REFERENCE = LocalDate.of(2024, 6, 1);

    private final TrustScoring scoring = new TrustScoring(new TrustConfig());

    @Test
    void trustScore_perfectListing_shouldBeOne() {
        assertEquals(1.0, scoring.trustScore(new ReviewScores(5.0, 100, 3.0)), 1e-12);
    }

    @Test
    void trustScore_belowMinimumReviews_shouldDropSufficiencyComponent() {
        // 0.4 * 1.0 + 0.3 * 4/100 + 0.3 * 0
        assertEquals(0.412, scoring.trustScore(new ReviewScores(5.0, 4, null)), 1e-12);
    }

    @Test
    void trustScore_outOfRangeRating_shouldBeClamped() {
        assertEquals(1.0, scoring.trustScore(new ReviewScores(7.5, 500, null)), 1e-12);
        assertEquals(0.0, scoring.normalizedRating(-2.0));
    }

    @Test
    void trustScore_shouldStayWithinUnitInterval() {
        Random random = new Random(1);
        for (int i = 0; i < 500; i++) {
            double rating = random.nextDouble() * 20 - 10;
            double score = scoring.trustScore(new ReviewScores(rating, random.nextInt(1000), null));
            assertTrue(score >= 0.0 && score <= 1.0, "score " + score);
        }
    }

    @Test
    void ratingConsistency_shouldBeNegativeSampleStdDev() {
        ReviewScores reviews = new ReviewScores(4.5, 4.0, 5.0, null, null, null, null, 10, null);
        // sample stddev of {4, 5} = sqrt(0.5)
        assertEquals(-Math.sqrt(0.5), scoring.ratingConsistency(reviews), 1e-12);
    }

    @Test
    void ratingConsistency_identicalRatings_shouldBeZero() {
        ReviewScores reviews = new ReviewScores(5.0, 5.0, 5.0, 5.0, 5.0, 5.0, 5.0, 10, null);
        assertEquals(0.0, scoring.ratingConsistency(reviews));
    }

    @Test
    void ratingConsistency_missingSubRatings_shouldUseSentinelNotZero() {
        assertEquals(Sentinels.CONSISTENCY_UNKNOWN, scoring.ratingConsistency(new ReviewScores(4.0, 10, null)));
        ReviewScores single = new ReviewScores(4.0, 4.0, null, null, null, null, null, 10, null);
        assertEquals(Sentinels.CONSISTENCY_UNKNOWN, scoring.ratingConsistency(single));
    }

    @Test
    void hostQuality_fullHost_shouldBeOne() {
        HostProfile host = new HostProfile(true, true, 1.0, REFERENCE.minusYears(6), 2);
        assertEquals(1.0, scoring.hostQuality(host, REFERENCE), 1e-12);
    }

    @Test
    void hostQuality_unknownHost_shouldBeZero() {
        assertEquals(0.0, scoring.hostQuality(HostProfile.UNKNOWN, REFERENCE));
    }

    @Test
    void hostQuality_shouldWeighTenureAgainstCap() {
        HostProfile host = new HostProfile(false, false, null, REFERENCE.minusDays(913), null);
        // 913 days = 2.4997 years, cap 5
        assertEquals(0.15 * (913 / 365.25) / 5.0, scoring.hostQuality(host, REFERENCE), 1e-12);
    }

    @Test
    void isProfessionalHost_shouldRequireMoreThanThreeListings() {
        assertFalse(scoring.isProfessionalHost(new HostProfile(null, null, null, null, 3)));
        assertTrue(scoring.isProfessionalHost(new HostProfile(null, null, null, null, 4)));
    }
}
