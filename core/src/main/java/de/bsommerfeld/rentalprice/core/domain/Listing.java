package de.bsommerfeld.rentalprice.core.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Immutable snapshot of a rental listing as handed over by the data loader.
 * Feature engines only read from it; derived values live in the feature
 * matrix.
 *
 * @param id            platform listing id, join key of the feature run
 * @param location      listing coordinates
 * @param price         nightly price, {@code null} for listings that are
 *                      only scored
 * @param roomType      room type
 * @param accommodates  guest capacity, {@code null} if unknown
 * @param bedrooms      bedroom count, {@code null} if unknown
 * @param bathrooms     bathroom count (half baths allowed), {@code null} if
 *                      unknown
 * @param beds          bed count, {@code null} if unknown
 * @param reviews       review signals, never {@code null}
 * @param host          host attributes, never {@code null}
 * @param amenitiesText raw amenity list as scraped, may be {@code null}
 * @param availability  calendar availability, never {@code null}
 * @param lastReview    date of the most recent review, {@code null} if none
 */
public record Listing(
        String id,
        GeoPoint location,
        Double price,
        RoomType roomType,
        Integer accommodates,
        Integer bedrooms,
        Double bathrooms,
        Integer beds,
        ReviewScores reviews,
        HostProfile host,
        String amenitiesText,
        Availability availability,
        LocalDate lastReview) {

    public Listing {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(roomType, "roomType");
        reviews = reviews != null ? reviews : ReviewScores.NONE;
        host = host != null ? host : HostProfile.UNKNOWN;
        availability = availability != null ? availability : Availability.UNKNOWN;
    }

    public boolean hasPrice() {
        return price != null && !price.isNaN();
    }

    public static Builder builder(String id, double latitude, double longitude) {
        return new Builder(id, new GeoPoint(latitude, longitude));
    }

    /**
     * Fluent builder for tests and loaders that fill listings column by column.
     */
    public static final class Builder {

        private final String id;
        private final GeoPoint location;
        private Double price;
        private RoomType roomType = RoomType.ENTIRE_HOME;
        private Integer accommodates;
        private Integer bedrooms;
        private Double bathrooms;
        private Integer beds;
        private ReviewScores reviews = ReviewScores.NONE;
        private HostProfile host = HostProfile.UNKNOWN;
        private String amenitiesText;
        private Availability availability = Availability.UNKNOWN;
        private LocalDate lastReview;

        private Builder(String id, GeoPoint location) {
            this.id = id;
            this.location = location;
        }

        public Builder price(Double price) {
            this.price = price;
            return this;
        }

        public Builder roomType(RoomType roomType) {
            this.roomType = roomType;
            return this;
        }

        public Builder capacity(Integer accommodates, Integer bedrooms, Double bathrooms, Integer beds) {
            this.accommodates = accommodates;
            this.bedrooms = bedrooms;
            this.bathrooms = bathrooms;
            this.beds = beds;
            return this;
        }

        public Builder reviews(ReviewScores reviews) {
            this.reviews = reviews;
            return this;
        }

        public Builder host(HostProfile host) {
            this.host = host;
            return this;
        }

        public Builder amenities(String amenitiesText) {
            this.amenitiesText = amenitiesText;
            return this;
        }

        public Builder availability(Availability availability) {
            this.availability = availability;
            return this;
        }

        public Builder lastReview(LocalDate lastReview) {
            this.lastReview = lastReview;
            return this;
        }

        public Listing build() {
            return new Listing(id, location, price, roomType, accommodates, bedrooms, bathrooms, beds,
                    reviews, host, amenitiesText, availability, lastReview);
        }
    }
}
