package de.bsommerfeld.rentalprice.pipeline;

import com.google.common.eventbus.Subscribe;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import de.bsommerfeld.rentalprice.core.config.ModelConfig;
import de.bsommerfeld.rentalprice.core.config.PipelineConfig;
import de.bsommerfeld.rentalprice.core.config.RegressorConfig;
import de.bsommerfeld.rentalprice.core.config.RegressorType;
import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.core.domain.Poi;
import de.bsommerfeld.rentalprice.core.event.PipelineEventBus;
import de.bsommerfeld.rentalprice.core.event.PipelineEvents;
import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;
import de.bsommerfeld.rentalprice.core.util.SyntheticDataGenerator;
import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import de.bsommerfeld.rentalprice.model.evaluation.CrossValidationResult;
import de.bsommerfeld.rentalprice.model.evaluation.EvaluationReport;
import de.bsommerfeld.rentalprice.model.evaluation.ModelEvaluation;
import de.bsommerfeld.rentalprice.model.evaluation.ModelStatus;
import de.bsommerfeld.rentalprice.model.evaluation.Metric;
import de.bsommerfeld.rentalprice.model.training.Ensemble;
import de.bsommerfeld.rentalprice.model.training.TrainingResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PricingPipelineTest {

    private static final LocalDate REFERENCE = LocalDate.of(2024, 6, 1);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private final SyntheticDataGenerator generator = new SyntheticDataGenerator(99L).withReferenceDate(REFERENCE);
    private final List<Listing> listings = generator.listings(240);
    private final List<Poi> pois = generator.pois(6);

    @Test
    void assembleFeatures_shouldUseClockDateAndEmitOneRowPerListing() {
        FeatureMatrix matrix = pipeline(fastConfig()).assembleFeatures(listings, pois);

        assertEquals(listings.size(), matrix.rowCount());
        assertTrue(matrix.columns().contains("distance_to_beach"));
        assertTrue(matrix.columns().contains("grid_avg_price"));
        for (double month : matrix.column("month")) {
            assertEquals(6.0, month);
        }
        assertEquals(List.of("base", "distance_density", "grid", "temporal", "review_trust", "amenity"),
                List.copyOf(matrix.summary().keySet()));
    }

    @Test
    void endToEnd_shouldTrainEvaluateAndPredict() {
        PricingPipeline pipeline = pipeline(fastConfig());
        List<Listing> withScoringRow = new ArrayList<>(listings);
        withScoringRow.add(Listing.builder("unpriced", -22.97, -43.18).build());
        FeatureMatrix matrix = pipeline.assembleFeatures(withScoringRow, pois, REFERENCE);

        TrainingResult result = pipeline.train(matrix);
        EvaluationReport report = pipeline.evaluate(result);

        assertTrue(result.failures().isEmpty(), () -> "failures: " + result.failures());
        assertEquals(1, result.split().excluded());
        Ensemble ensemble = result.requireEnsemble();
        assertEquals(1.0, Arrays.stream(ensemble.weights()).sum(), 1e-9);
        assertEquals(4, report.ranking().size());
        ModelEvaluation ensembleEntry = report.get(Ensemble.NAME).orElseThrow();
        assertEquals(ModelStatus.TRAINED, ensembleEntry.status());
        assertTrue(ensembleEntry.metric(Metric.R2) > 0.5, () -> report.render());

        double estimate = pipeline.predict(ensemble, matrix.row(matrix.rowCount() - 1));
        assertTrue(Double.isFinite(estimate));
        assertTrue(Double.isNaN(matrix.value(matrix.rowCount() - 1, "price")));
    }

    @Test
    void train_sameSeedTwice_shouldProduceIdenticalReports() {
        PricingPipeline pipeline = pipeline(fastConfig());
        FeatureMatrix matrix = pipeline.assembleFeatures(listings, pois, REFERENCE);

        EvaluationReport first = pipeline.evaluate(pipeline.train(matrix, "price"));
        EvaluationReport second = pipeline.evaluate(pipeline.train(matrix, "price"));

        assertEquals(first.ranking(), second.ranking());
    }

    @Test
    void evaluate_explicitModelsWithoutEnsemble_shouldReportEnsembleAsFailed() {
        PricingPipeline pipeline = pipeline(fastConfig());
        TrainingResult result = pipeline.train(pipeline.assembleFeatures(listings, pois, REFERENCE));

        EvaluationReport report = pipeline.evaluate(result.models(), null, result.split().test(), "price");

        assertEquals(ModelStatus.FAILED, report.get(Ensemble.NAME).orElseThrow().status());
        assertTrue(report.bestModel().isPresent());
    }

    @Test
    void crossValidate_shouldScoreConfiguredFolds() {
        PricingPipeline pipeline = pipeline(fastConfig());
        FeatureMatrix matrix = pipeline.assembleFeatures(listings, pois, REFERENCE);

        CrossValidationResult result = pipeline.crossValidate(matrix, "price", "ridge");

        assertEquals(5, result.folds());
        assertEquals(Metric.RMSE, result.metric());
        assertTrue(Double.isFinite(result.mean()));
    }

    @Test
    void train_shouldPublishModelEvents() {
        Injector injector = Guice.createInjector(new PricingModule(fastConfig(), CLOCK));
        TrainedCounter counter = new TrainedCounter();
        injector.getInstance(PipelineEventBus.class).register(counter);
        PricingPipeline pipeline = injector.getInstance(PricingPipeline.class);

        pipeline.train(pipeline.assembleFeatures(listings, pois, REFERENCE));

        assertEquals(3, counter.trained);
        assertEquals(1, counter.ensembles);
    }

    @Test
    void module_defaultResource_shouldBindConfigurationSections() {
        Injector injector = Guice.createInjector(new PricingModule());

        PipelineConfig config = injector.getInstance(PipelineConfig.class);

        assertSame(config.getModel(), injector.getInstance(ModelConfig.class));
        assertEquals(3, config.getModel().getRegressors().size());
        assertEquals(12, config.getGeo().getPoiCategories().size());
        assertSame(injector.getInstance(PricingPipeline.class), injector.getInstance(PricingPipeline.class));
    }

    @Test
    void module_invalidConfiguration_shouldFailAtStartup() {
        PipelineConfig config = fastConfig();
        config.getGeo().setGridCellSizeDegrees(0);

        CreationException e = assertThrows(CreationException.class,
                () -> Guice.createInjector(new PricingModule(config, CLOCK)));

        assertInstanceOf(ConfigurationException.class, e.getCause());
    }

    @Test
    void module_unknownPrimaryMetric_shouldFailBeforeAnyComputation() {
        PipelineConfig config = fastConfig();
        config.getModel().setPrimaryMetric("accuracy");
        Injector injector = Guice.createInjector(new PricingModule(config, CLOCK));

        ProvisionException e = assertThrows(ProvisionException.class,
                () -> injector.getInstance(PricingPipeline.class));

        assertInstanceOf(ConfigurationException.class, e.getCause());
    }

    private PricingPipeline pipeline(PipelineConfig config) {
        return Guice.createInjector(new PricingModule(config, CLOCK)).getInstance(PricingPipeline.class);
    }

    private static PipelineConfig fastConfig() {
        PipelineConfig config = new PipelineConfig();
        config.setParallelism(2);
        RegressorConfig ridge = new RegressorConfig("ridge", RegressorType.RIDGE);
        RegressorConfig forest = new RegressorConfig("forest", RegressorType.RANDOM_FOREST);
        forest.setTrees(30);
        forest.setMaxDepth(8);
        RegressorConfig boosting = new RegressorConfig("boosting", RegressorType.GRADIENT_BOOSTING);
        boosting.setTrees(40);
        boosting.setMaxDepth(3);
        config.getModel().setRegressors(new ArrayList<>(List.of(ridge, forest, boosting)));
        return config;
    }

    private static class TrainedCounter {

        private int trained;
        private int ensembles;

        @Subscribe
        public void onTrained(PipelineEvents.ModelTrainedEvent event) {
            trained++;
        }

        @Subscribe
        public void onEnsemble(PipelineEvents.EnsembleBuiltEvent event) {
            ensembles++;
        }
    }
}
