package de.bsommerfeld.rentalprice.features.grid;

import de.bsommerfeld.rentalprice.core.domain.GeoPoint;

/**
 * Cell of a fixed-size angular grid, addressed by floor division of the
 * coordinates by the cell size.
 */
public record GridCell(long row, long col) {

    public static GridCell of(GeoPoint point, double cellSizeDegrees) {
        return new GridCell(
                (long) Math.floor(point.latitude() / cellSizeDegrees),
                (long) Math.floor(point.longitude() / cellSizeDegrees));
    }
}
