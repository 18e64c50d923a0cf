package de.bsommerfeld.rentalprice.pipeline;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.rentalprice.core.config.PipelineConfig;
import de.bsommerfeld.rentalprice.core.domain.Listing;
import de.bsommerfeld.rentalprice.core.domain.Poi;
import de.bsommerfeld.rentalprice.core.event.PipelineEventBus;
import de.bsommerfeld.rentalprice.features.assembly.FeatureAssembler;
import de.bsommerfeld.rentalprice.features.assembly.FeatureEngines;
import de.bsommerfeld.rentalprice.features.matrix.FeatureMatrix;
import de.bsommerfeld.rentalprice.features.matrix.FeatureVector;
import de.bsommerfeld.rentalprice.model.evaluation.CrossValidationResult;
import de.bsommerfeld.rentalprice.model.evaluation.CrossValidator;
import de.bsommerfeld.rentalprice.model.evaluation.EvaluationReport;
import de.bsommerfeld.rentalprice.model.evaluation.Evaluator;
import de.bsommerfeld.rentalprice.model.training.Ensemble;
import de.bsommerfeld.rentalprice.model.training.ModelOrchestrator;
import de.bsommerfeld.rentalprice.model.training.PricePredictor;
import de.bsommerfeld.rentalprice.model.training.TrainedModel;
import de.bsommerfeld.rentalprice.model.training.TrainingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Entry point for callers: builds features, trains models, evaluates and
 * scores listings with one shared configuration.
 */
@Singleton
public class PricingPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(PricingPipeline.class);

    private final PipelineConfig config;
    private final PipelineEventBus eventBus;
    private final ModelOrchestrator orchestrator;
    private final Evaluator evaluator;
    private final CrossValidator crossValidator;
    private final Clock clock;

    @Inject
    public PricingPipeline(PipelineConfig config, PipelineEventBus eventBus, ModelOrchestrator orchestrator,
            Evaluator evaluator, CrossValidator crossValidator, Clock clock) {
        this.config = config;
        this.eventBus = eventBus;
        this.orchestrator = orchestrator;
        this.evaluator = evaluator;
        this.crossValidator = crossValidator;
        this.clock = clock;
    }

    /** Features relative to today according to the injected clock. */
    public FeatureMatrix assembleFeatures(List<Listing> listings, List<Poi> pois) {
        return assembleFeatures(listings, pois, LocalDate.now(clock));
    }

    public FeatureMatrix assembleFeatures(List<Listing> listings, List<Poi> pois, LocalDate referenceDate) {
        LOG.info("Assembling features for {} listings against {} POIs (reference date {})",
                listings.size(), pois.size(), referenceDate);
        FeatureAssembler assembler = new FeatureAssembler(
                FeatureEngines.standard(config, pois, referenceDate), eventBus, config.getParallelism());
        return assembler.assemble(listings);
    }

    public TrainingResult train(FeatureMatrix matrix) {
        return train(matrix, config.getModel().getTargetColumn());
    }

    public TrainingResult train(FeatureMatrix matrix, String targetColumn) {
        return orchestrator.train(matrix, targetColumn);
    }

    /** Report over the result's held-out rows, including its failed models. */
    public EvaluationReport evaluate(TrainingResult result) {
        EvaluationReport report = evaluator.evaluate(result);
        LOG.info("Evaluation by {}:{}{}", evaluator.primaryMetric().key(), System.lineSeparator(), report.render());
        return report;
    }

    /**
     * @param ensemble may be null, in which case it is reported as failed
     */
    public EvaluationReport evaluate(List<TrainedModel> models, Ensemble ensemble, FeatureMatrix test,
            String targetColumn) {
        return evaluator.evaluate(models, ensemble, Map.of(), test, targetColumn);
    }

    public double predict(PricePredictor predictor, FeatureVector row) {
        return predictor.predict(row);
    }

    /** K-fold cross-validation of one configured regressor by the primary metric. */
    public CrossValidationResult crossValidate(FeatureMatrix matrix, String targetColumn, String regressorName) {
        return crossValidator.crossValidate(matrix, targetColumn, regressorName, evaluator.primaryMetric());
    }
}
