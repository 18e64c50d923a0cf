package de.bsommerfeld.rentalprice.model.training;

import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import de.bsommerfeld.rentalprice.model.ModelFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TrainTestSplitTest {

    @Test
    void of_shouldHoldOutCeilingOfFraction() {
        TrainTestSplit split = TrainTestSplit.of(ModelFixtures.linear(11, 1L), ModelFixtures.TARGET, 0.2, 42L);

        assertEquals(3, split.test().rowCount());
        assertEquals(8, split.train().rowCount());
    }

    @Test
    void of_shouldPartitionRowsAndKeepTheirOrder() {
        FeatureMatrix matrix = ModelFixtures.linear(50, 1L);

        TrainTestSplit split = TrainTestSplit.of(matrix, ModelFixtures.TARGET, 0.3, 42L);

        Set<String> all = new HashSet<>(split.train().listingIds());
        all.addAll(split.test().listingIds());
        assertEquals(new HashSet<>(matrix.listingIds()), all);
        assertEquals(50, split.train().rowCount() + split.test().rowCount());
        assertSorted(split.train().listingIds());
        assertSorted(split.test().listingIds());
    }

    @Test
    void of_sameSeed_shouldBeReproducible() {
        FeatureMatrix matrix = ModelFixtures.linear(50, 1L);

        TrainTestSplit first = TrainTestSplit.of(matrix, ModelFixtures.TARGET, 0.2, 7L);
        TrainTestSplit second = TrainTestSplit.of(matrix, ModelFixtures.TARGET, 0.2, 7L);
        TrainTestSplit other = TrainTestSplit.of(matrix, ModelFixtures.TARGET, 0.2, 8L);

        assertEquals(first.test().listingIds(), second.test().listingIds());
        assertNotEquals(first.test().listingIds(), other.test().listingIds());
    }

    @Test
    void of_unknownTargets_shouldBeExcluded() {
        double[][] values = new double[6][];
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            values[i] = new double[] {i % 2 == 0 ? Double.NaN : 100 + i, i, i};
            ids.add("L" + i);
        }
        FeatureMatrix matrix = new FeatureMatrix(ids, ModelFixtures.schema(ModelFixtures.TARGET, "x1", "x2"), values);

        TrainTestSplit split = TrainTestSplit.of(matrix, ModelFixtures.TARGET, 0.5, 1L);

        assertEquals(3, split.excluded());
        assertEquals(3, split.train().rowCount() + split.test().rowCount());
        assertFalse(split.train().listingIds().contains("L0"));
        assertFalse(split.test().listingIds().contains("L0"));
    }

    @Test
    void of_singleLabelledRow_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> TrainTestSplit.of(ModelFixtures.linear(1, 1L), ModelFixtures.TARGET, 0.2, 1L));
    }

    @Test
    void of_fractionOutOfRange_shouldThrow() {
        FeatureMatrix matrix = ModelFixtures.linear(10, 1L);

        assertThrows(IllegalArgumentException.class, () -> TrainTestSplit.of(matrix, ModelFixtures.TARGET, 1.0, 1L));
        assertThrows(IllegalArgumentException.class, () -> TrainTestSplit.of(matrix, ModelFixtures.TARGET, 0.0, 1L));
    }

    private static void assertSorted(List<String> ids) {
        List<String> sorted = new ArrayList<>(ids);
        sorted.sort(null);
        assertEquals(sorted, ids);
    }
}
