package de.bsommerfeld.rentalprice.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.rentalprice.core.domain.PoiCategory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Geospatial feature parameters: which POI categories produce columns and
 * how far the distance and density queries reach.
 */
public class GeoConfig {

    @JsonProperty("poi-categories")
    private List<String> poiCategoryNames = Arrays.stream(PoiCategory.values())
            .map(PoiCategory::key)
            .collect(Collectors.toCollection(ArrayList::new));

    @JsonProperty("grid-cell-size-degrees")
    private double gridCellSizeDegrees = 0.01;

    @JsonProperty("density-radius-km")
    private double densityRadiusKm = 1.0;

    @JsonProperty("distance-cap-km")
    private double distanceCapKm = 10.0;

    public List<String> getPoiCategoryNames() {
        return poiCategoryNames;
    }

    public void setPoiCategoryNames(List<String> poiCategoryNames) {
        this.poiCategoryNames = poiCategoryNames;
    }

    /**
     * Configured categories in configuration order.
     *
     * @throws IllegalArgumentException if a name is not a known category
     */
    @JsonIgnore
    public List<PoiCategory> getPoiCategories() {
        return poiCategoryNames.stream().map(PoiCategory::fromKey).collect(Collectors.toList());
    }

    public double getGridCellSizeDegrees() {
        return gridCellSizeDegrees;
    }

    public void setGridCellSizeDegrees(double gridCellSizeDegrees) {
        this.gridCellSizeDegrees = gridCellSizeDegrees;
    }

    public double getDensityRadiusKm() {
        return densityRadiusKm;
    }

    public void setDensityRadiusKm(double densityRadiusKm) {
        this.densityRadiusKm = densityRadiusKm;
    }

    public double getDistanceCapKm() {
        return distanceCapKm;
    }

    public void setDistanceCapKm(double distanceCapKm) {
        this.distanceCapKm = distanceCapKm;
    }
}
