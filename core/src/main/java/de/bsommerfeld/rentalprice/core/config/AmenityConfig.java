package de.bsommerfeld.rentalprice.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.rentalprice.core.domain.AmenityCategory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Amenity categories with their weights and matching synonyms, keyed by
 * {@link AmenityCategory#key()}. Categories missing from the file keep
 * their built-in values.
 */
public class AmenityConfig {

    @JsonProperty("weights")
    private Map<String, Double> weights = new LinkedHashMap<>();

    @JsonProperty("synonyms")
    private Map<String, List<String>> synonyms = new LinkedHashMap<>();

    public AmenityConfig() {
        for (AmenityCategory category : AmenityCategory.values()) {
            weights.put(category.key(), category.defaultWeight());
            synonyms.put(category.key(), new ArrayList<>(category.defaultSynonyms()));
        }
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights.putAll(weights);
    }

    public Map<String, List<String>> getSynonyms() {
        return synonyms;
    }

    public void setSynonyms(Map<String, List<String>> synonyms) {
        this.synonyms.putAll(synonyms);
    }

    @JsonIgnore
    public double weight(AmenityCategory category) {
        Double weight = weights.get(category.key());
        return weight != null ? weight : category.defaultWeight();
    }

    @JsonIgnore
    public List<String> synonyms(AmenityCategory category) {
        List<String> list = synonyms.get(category.key());
        return list != null ? List.copyOf(list) : category.defaultSynonyms();
    }

    /** Resolved synonyms in declaration order of {@link AmenityCategory}. */
    @JsonIgnore
    public Map<AmenityCategory, List<String>> resolvedSynonyms() {
        Map<AmenityCategory, List<String>> resolved = new EnumMap<>(AmenityCategory.class);
        for (AmenityCategory category : AmenityCategory.values()) {
            resolved.put(category, synonyms(category));
        }
        return resolved;
    }
}
