package de.bsommerfeld.rentalprice.features.assembly;

import de.bsommerfeld.rentalprice.core.config.PipelineConfig;
import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.core.event.PipelineEventBus;
import de.bsommerfeld.rentalprice.core.event.PipelineEvents;
import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;
import de.bsommerfeld.rentalprice.core.util.SyntheticDataGenerator;
import de.bsommerfeld.rentalprice.features.base.BaseAttributeEngine;
import de.bsommerfeld.rentalprice.features.engine.FeatureEngine;
import de.bsommerfeld.rentalprice.features.grid.GridAggregationEngine;
import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeatureAssemblerTest {

    private static final LocalDate REFERENCE = LocalDate.of(2024, 6, 1);

    @Mock
    private PipelineEventBus eventBus;

    @Mock
    private FeatureEngine brokenEngine;

    @Test
    void constructor_collidingColumns_shouldFailBeforeAnyComputation() {
        when(brokenEngine.name()).thenReturn("shadow");
        when(brokenEngine.columns()).thenReturn(List.of("grid_avg_price"));

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new FeatureAssembler(List.of(new GridAggregationEngine(0.01), brokenEngine), eventBus, 1));

        assertTrue(e.getMessage().contains("grid_avg_price"));
        verify(brokenEngine, never()).compute(anyList(), any());
    }

    @Test
    void assemble_standardEngines_shouldProduceUniqueStableColumns() {
        PipelineConfig config = new PipelineConfig();
        SyntheticDataGenerator generator = new SyntheticDataGenerator(4L);
        var assembler = new FeatureAssembler(
                FeatureEngines.standard(config, generator.pois(5), REFERENCE), eventBus, 2);

        FeatureMatrix first = assembler.assemble(generator.listings(50));
        FeatureMatrix second = assembler.assemble(new SyntheticDataGenerator(99L).listings(10));

        Set<String> unique = new HashSet<>(first.columns());
        assertEquals(first.columns().size(), unique.size());
        assertEquals(first.columns(), second.columns());
        assertEquals("price", first.columns().get(0));
        assertEquals("amenity_score", first.columns().get(first.columns().size() - 1));
        assertEquals(50, first.rowCount());
    }

    @Test
    void assemble_shouldCoverEveryContractBlockInOrder() {
        PipelineConfig config = new PipelineConfig();
        var assembler = new FeatureAssembler(FeatureEngines.standard(config, List.of(), REFERENCE), eventBus, 1);

        List<String> columns = assembler.schema().columns();
        int base = columns.indexOf("longitude");
        int distance = columns.indexOf("distance_to_beach");
        int grid = columns.indexOf("grid_avg_price");
        int temporal = columns.indexOf("month");
        int trust = columns.indexOf("rating_normalized");
        int amenity = columns.indexOf("amenities_count");
        assertTrue(base < distance && distance < grid && grid < temporal && temporal < trust && trust < amenity);
        assertEquals(List.of("base", "distance_density", "grid", "temporal", "review_trust", "amenity"),
                List.copyOf(assembler.schema().columnsBySource().keySet()));
    }

    @Test
    void assemble_engineFailingForWholeBatch_shouldStillEmitOneRowPerListing() {
        when(brokenEngine.name()).thenReturn("broken");
        when(brokenEngine.columns()).thenReturn(List.of("broken_a", "broken_b"));
        when(brokenEngine.compute(anyList(), any())).thenThrow(new IllegalStateException("boom"));
        when(brokenEngine.sentinelRow()).thenReturn(new double[] { -1.0, -1.0 });

        var assembler = new FeatureAssembler(List.of(new BaseAttributeEngine(), brokenEngine), eventBus, 1);
        List<Listing> listings = new SyntheticDataGenerator(2L).listings(7);

        FeatureMatrix matrix = assembler.assemble(listings);

        assertEquals(7, matrix.rowCount());
        for (int i = 0; i < 7; i++) {
            assertEquals(-1.0, matrix.value(i, "broken_a"));
            assertEquals(listings.get(i).price(), matrix.value(i, "price"), 1e-12);
        }
        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventBus, atLeastOnce()).post(events.capture());
        PipelineEvents.FeaturesAssembledEvent summary = events.getAllValues().stream()
                .filter(PipelineEvents.FeaturesAssembledEvent.class::isInstance)
                .map(PipelineEvents.FeaturesAssembledEvent.class::cast)
                .findFirst().orElseThrow();
        assertEquals(7, summary.softFailures());
    }

    @Test
    void assemble_malformedAmenities_shouldPostMalformedRecordEvents() {
        PipelineConfig config = new PipelineConfig();
        var assembler = new FeatureAssembler(FeatureEngines.standard(config, List.of(), REFERENCE), eventBus, 1);
        List<Listing> listings = new SyntheticDataGenerator(3L).withMalformedAmenityRate(1.0).listings(4);

        FeatureMatrix matrix = assembler.assemble(listings);

        assertEquals(4, matrix.rowCount());
        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventBus, atLeastOnce()).post(events.capture());
        long malformed = events.getAllValues().stream()
                .filter(PipelineEvents.MalformedRecordEvent.class::isInstance)
                .count();
        assertEquals(4, malformed);
    }

    @Test
    void assemble_duplicateIds_shouldBeRejected() {
        var assembler = new FeatureAssembler(List.of(new BaseAttributeEngine()), eventBus, 1);
        Listing a = Listing.builder("same", 0, 0).build();
        Listing b = Listing.builder("same", 1, 1).build();

        assertThrows(IllegalArgumentException.class, () -> assembler.assemble(List.of(a, b)));
    }

    @Test
    void assemble_missingSourceFields_shouldStillFillEveryColumn() {
        PipelineConfig config = new PipelineConfig();
        var assembler = new FeatureAssembler(FeatureEngines.standard(config, List.of(), REFERENCE), eventBus, 1);
        Listing bare = Listing.builder("bare", -22.97, -43.18).build();

        FeatureMatrix matrix = assembler.assemble(List.of(bare));

        assertEquals(assembler.schema().size(), matrix.row(0).values().length);
        assertTrue(Double.isNaN(matrix.value(0, "price")));
        for (String column : matrix.columns()) {
            if (!column.equals("price")) {
                assertFalse(Double.isNaN(matrix.value(0, column)), column);
            }
        }
    }

    @Test
    void summary_shouldGroupColumnsByEngine() {
        PipelineConfig config = new PipelineConfig();
        var assembler = new FeatureAssembler(FeatureEngines.standard(config, List.of(), REFERENCE), eventBus, 1);

        FeatureMatrix matrix = assembler.assemble(new SyntheticDataGenerator(1L).listings(3));

        assertEquals(List.of("grid_avg_price", "grid_median_price", "grid_listing_count"), matrix.summary().get("grid"));
    }
}
