package de.bsommerfeld.rentalprice.features.base;

import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.core.domain.RoomType;
import de.bsommerfeld.rentalprice.features.engine.PerListingFeatureEngine;

import java.util.List;

import static de.bsommerfeld.rentalprice.features.engine.Sentinels.UNKNOWN;
import static de.bsommerfeld.rentalprice.features.engine.Sentinels.flag;
import static de.bsommerfeld.rentalprice.features.engine.Sentinels.orUnknown;

/**
 * Listing attributes copied into the matrix: the price target (NaN when
 * unknown), one-hot room type, capacity counts and coordinates.
 */
public class BaseAttributeEngine extends PerListingFeatureEngine {

    public static final String NAME = "base";

    public static final String PRICE = "price";

    private static final List<String> COLUMNS = List.of(
            PRICE, "room_type_entire_home", "room_type_private_room", "room_type_shared_room",
            "accommodates", "bedrooms", "bathrooms", "beds", "total_rooms", "bedroom_bathroom_ratio",
            "latitude", "longitude");

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
        Integer bedrooms = listing.bedrooms();
        Double bathrooms = listing.bathrooms();
        boolean rooms = bedrooms != null && bathrooms != null && !bathrooms.isNaN();
        return new double[] {
                listing.hasPrice() ? listing.price() : Double.NaN,
                flag(listing.roomType() == RoomType.ENTIRE_HOME),
                flag(listing.roomType() == RoomType.PRIVATE_ROOM),
                flag(listing.roomType() == RoomType.SHARED_ROOM),
                orUnknown(listing.accommodates()),
                orUnknown(bedrooms),
                orUnknown(bathrooms),
                orUnknown(listing.beds()),
                rooms ? bedrooms + bathrooms : UNKNOWN,
                rooms ? bedrooms / (bathrooms + 0.1) : UNKNOWN,
                listing.location().latitude(),
                listing.location().longitude()
        };
    }

    @Override
    public double[] sentinelRow() {
        double[] row = filled(COLUMNS.size(), UNKNOWN);
        row[0] = Double.NaN;
        return row;
    }
}
