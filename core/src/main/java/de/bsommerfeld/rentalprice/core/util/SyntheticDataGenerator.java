package de.bsommerfeld.rentalprice.core.util;

import de.bsommerfeld.rentalprice.core.domain.Availability;
import de.bsommerfeld.rentalprice.core.domain.GeoPoint;
import de.bsommerfeld.rentalprice.core.domain.HostProfile;
import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.core.domain.Poi;
import de.bsommerfeld.rentalprice.core.domain.PoiCategory;
import de.bsommerfeld.rentalprice.core.domain.ReviewScores;
import de.bsommerfeld.rentalprice.core.domain.RoomType;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generates plausible rental listings and points of interest around a city
 * centre for tests and offline runs.
 *
 * <p>
 * Output is fully determined by the seed. Prices follow a noisy linear
 * signal in capacity, room type, rating and distance to the centre, so the
 * regressors have something to learn.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li><strong>Listings</strong>: ids {@code L00000…}, coordinates within
 * roughly 5 km of the centre, prices between 20 and ~900 per night, ~70%
 * entire homes, review and host data with occasional gaps</li>
 * <li><strong>Amenities</strong>: a mix of JSON-array and curly-brace
 * serialisations; a configurable fraction is deliberately malformed</li>
 * <li><strong>POIs</strong>: a fixed count per category, ids
 * {@code <category>-<n>}</li>
 * </ul>
 */
public class SyntheticDataGenerator {

    public static final GeoPoint DEFAULT_CENTRE = new GeoPoint(-22.9711, -43.1822);

    private static final double SPREAD_DEGREES = 0.045;

    private static final String[] AMENITY_POOL = {
            "Wifi", "Kitchen", "Air conditioning", "TV", "Cable TV", "Heating", "Hot water",
            "Pool", "Gym", "Elevator", "Doorman", "Free parking on premises", "Washer", "Dryer",
            "Laptop friendly workspace", "Desk", "Ethernet connection", "Essentials", "Hangers",
            "Iron", "Hair dryer", "Smoke alarm", "Beach essentials"
    };

    private final Random random;
    private final GeoPoint centre;
    private double malformedAmenityRate;
    private LocalDate referenceDate = LocalDate.of(2024, 6, 1);

    public SyntheticDataGenerator(long seed) {
        this(seed, DEFAULT_CENTRE);
    }

    public SyntheticDataGenerator(long seed, GeoPoint centre) {
        this.random = new Random(seed);
        this.centre = centre;
    }

    /** Fraction of listings whose amenity text is syntactically broken. */
    public SyntheticDataGenerator withMalformedAmenityRate(double rate) {
        this.malformedAmenityRate = rate;
        return this;
    }

    /** Date that {@code lastReview} and {@code hostSince} are drawn relative to. */
    public SyntheticDataGenerator withReferenceDate(LocalDate referenceDate) {
        this.referenceDate = referenceDate;
        return this;
    }

    public List<Listing> listings(int count) {
        List<Listing> listings = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            listings.add(listing(String.format("L%05d", i)));
        }
        return listings;
    }

    public Listing listing(String id) {
        double lat = centre.latitude() + (random.nextDouble() * 2 - 1) * SPREAD_DEGREES;
        double lon = centre.longitude() + (random.nextDouble() * 2 - 1) * SPREAD_DEGREES;

        double roll = random.nextDouble();
        RoomType roomType = roll < 0.7 ? RoomType.ENTIRE_HOME
                : roll < 0.95 ? RoomType.PRIVATE_ROOM : RoomType.SHARED_ROOM;

        int bedrooms = roomType == RoomType.ENTIRE_HOME ? 1 + random.nextInt(4) : 1;
        int accommodates = bedrooms * 2 - random.nextInt(2);
        double bathrooms = Math.max(1, bedrooms - random.nextInt(2)) + (random.nextBoolean() ? 0.5 : 0.0);
        int beds = bedrooms + random.nextInt(2);

        int numberOfReviews = random.nextDouble() < 0.15 ? 0 : random.nextInt(250);
        Double rating = numberOfReviews == 0 ? null : round(3.5 + random.nextDouble() * 1.5);
        ReviewScores reviews = numberOfReviews == 0
                ? new ReviewScores(null, 0, null)
                : new ReviewScores(rating, subRating(rating), subRating(rating), subRating(rating),
                        subRating(rating), subRating(rating), subRating(rating),
                        numberOfReviews, round(0.1 + random.nextDouble() * 4));

        HostProfile host = new HostProfile(
                random.nextDouble() < 0.25,
                random.nextDouble() < 0.8,
                random.nextDouble() < 0.1 ? null : round(0.5 + random.nextDouble() * 0.5),
                referenceDate.minusDays(30 + random.nextInt(3000)),
                1 + random.nextInt(8));

        Availability availability = new Availability(random.nextInt(31), random.nextInt(61), random.nextInt(91));
        LocalDate lastReview = numberOfReviews == 0 ? null : referenceDate.minusDays(random.nextInt(400));

        double distanceKm = Math.hypot(lat - centre.latitude(), lon - centre.longitude()) * 111.0;
        double roomFactor = roomType == RoomType.ENTIRE_HOME ? 120.0
                : roomType == RoomType.PRIVATE_ROOM ? 50.0 : 20.0;
        double price = roomFactor + 60.0 * bedrooms + 15.0 * accommodates
                + 25.0 * (rating == null ? 4.0 : rating) - 12.0 * distanceKm
                + random.nextGaussian() * 15.0;

        return Listing.builder(id, lat, lon)
                .price(Math.max(20.0, round(price)))
                .roomType(roomType)
                .capacity(accommodates, bedrooms, bathrooms, beds)
                .reviews(reviews)
                .host(host)
                .amenities(amenityText())
                .availability(availability)
                .lastReview(lastReview)
                .build();
    }

    /** {@code perCategory} POIs for every {@link PoiCategory}. */
    public List<Poi> pois(int perCategory) {
        List<Poi> pois = new ArrayList<>();
        for (PoiCategory category : PoiCategory.values()) {
            for (int i = 0; i < perCategory; i++) {
                double lat = centre.latitude() + (random.nextDouble() * 2 - 1) * SPREAD_DEGREES * 1.5;
                double lon = centre.longitude() + (random.nextDouble() * 2 - 1) * SPREAD_DEGREES * 1.5;
                pois.add(new Poi(category.key() + "-" + i, lat, lon, category));
            }
        }
        return pois;
    }

    private Double subRating(Double rating) {
        if (rating == null || random.nextDouble() < 0.05) {
            return null;
        }
        return round(Math.min(5.0, Math.max(0.0, rating + random.nextGaussian() * 0.3)));
    }

    private String amenityText() {
        Set<String> picked = new LinkedHashSet<>();
        int count = 3 + random.nextInt(12);
        for (int i = 0; i < count; i++) {
            picked.add(AMENITY_POOL[random.nextInt(AMENITY_POOL.length)]);
        }
        if (random.nextDouble() < malformedAmenityRate) {
            return "[\"" + String.join("\", \"", picked) + "\"";
        }
        if (random.nextBoolean()) {
            return picked.stream().map(a -> "\"" + a + "\"").collect(Collectors.joining(", ", "[", "]"));
        }
        return picked.stream()
                .map(a -> a.contains(" ") ? "\"" + a + "\"" : a)
                .collect(Collectors.joining(",", "{", "}"));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
