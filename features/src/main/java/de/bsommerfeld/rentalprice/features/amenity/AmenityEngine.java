package de.bsommerfeld.rentalprice.features.amenity;

import de.bsommerfeld.rentalprice.core.config.AmenityConfig;
import de.bsommerfeld.rentalprice.core.domain.AmenityCategory;
import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.features.engine.PerListingFeatureEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static de.bsommerfeld.rentalprice.features.engine.Sentinels.flag;

/**
 * Amenity coverage per {@link AmenityCategory}, individual key amenity
 * flags and a weighted {@code amenity_score} in [0, 1].
 *
 * <p>
 * An item matches a synonym or keyword when its lower-cased text contains
 * it. Malformed amenity text counts as "no amenities" and is reported as a
 * soft failure.
 */
public class AmenityEngine extends PerListingFeatureEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AmenityEngine.class);

    public static final String NAME = "amenity";

    private final AmenityParser parser;
    private final Map<AmenityCategory, List<String>> synonyms = new EnumMap<>(AmenityCategory.class);
    private final Map<AmenityCategory, Double> weights = new EnumMap<>(AmenityCategory.class);
    private final List<String> columns;

    public AmenityEngine(AmenityConfig config, AmenityParser parser) {
        this.parser = parser;
        List<String> cols = new ArrayList<>();
        cols.add("amenities_count");
        for (AmenityCategory category : AmenityCategory.values()) {
            synonyms.put(category, lowerCase(config.synonyms(category)));
            weights.put(category, config.weight(category));
            cols.add("has_" + category.key() + "_amenities");
            cols.add(category.key() + "_amenities_ratio");
        }
        for (KeyAmenity amenity : KeyAmenity.values()) {
            cols.add(amenity.column());
        }
        cols.add("amenity_score");
        this.columns = Collections.unmodifiableList(cols);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    @Override
    protected double[] computeRow(Listing listing, List<String> warnings) {
        AmenityParseResult parsed = parser.parse(listing.amenitiesText());
        if (parsed.isMalformed()) {
            LOG.warn("Malformed amenity text for listing {}: {}", listing.id(), parsed.reason());
            warnings.add("malformed amenity text: " + parsed.reason());
        }
        return row(parsed.amenities());
    }

    @Override
    public double[] sentinelRow() {
        return row(Set.of());
    }

    /** Feature row for an already parsed amenity set. */
    public double[] row(Set<String> amenities) {
        List<String> items = lowerCase(amenities);
        double[] row = new double[columns.size()];
        int col = 0;
        row[col++] = items.size();
        double score = 0.0;
        for (AmenityCategory category : AmenityCategory.values()) {
            List<String> categorySynonyms = synonyms.get(category);
            int matched = 0;
            for (String synonym : categorySynonyms) {
                if (containsAny(items, synonym)) {
                    matched++;
                }
            }
            double ratio = categorySynonyms.isEmpty() ? 0.0 : matched / (double) categorySynonyms.size();
            row[col++] = flag(matched > 0);
            row[col++] = ratio;
            score += weights.get(category) * ratio;
        }
        for (KeyAmenity amenity : KeyAmenity.values()) {
            boolean present = false;
            for (String keyword : amenity.keywords()) {
                present |= containsAny(items, keyword);
            }
            row[col++] = flag(present);
        }
        row[col] = Math.max(0.0, Math.min(1.0, score));
        return row;
    }

    private static boolean containsAny(List<String> items, String needle) {
        for (String item : items) {
            if (item.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lowerCase(Collection<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
    }
}
