package de.bsommerfeld.rentalprice.model.training;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import de.bsommerfeld.rentalprice.core.exception.InsufficientModelsException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one training run: the models that fitted, the ones that did
 * not (name to reason), the split they were trained on, and either the
 * ensemble or the reason it could not be built.
 */
public final class TrainingResult {

    private final String targetColumn;
    private final TrainTestSplit split;
    private final ImmutableList<TrainedModel> models;
    private final ImmutableMap<String, String> failures;
    private final Ensemble ensemble;
    private final InsufficientModelsException ensembleFailure;

    TrainingResult(String targetColumn, TrainTestSplit split, List<TrainedModel> models,
            Map<String, String> failures, Ensemble ensemble, InsufficientModelsException ensembleFailure) {
        this.targetColumn = targetColumn;
        this.split = split;
        this.models = ImmutableList.copyOf(models);
        this.failures = ImmutableMap.copyOf(failures);
        this.ensemble = ensemble;
        this.ensembleFailure = ensembleFailure;
    }

    public String targetColumn() {
        return targetColumn;
    }

    public TrainTestSplit split() {
        return split;
    }

    public List<TrainedModel> models() {
        return models;
    }

    public Optional<TrainedModel> model(String name) {
        return models.stream().filter(m -> m.name().equals(name)).findFirst();
    }

    public Map<String, String> failures() {
        return failures;
    }

    public Optional<Ensemble> ensemble() {
        return Optional.ofNullable(ensemble);
    }

    public Optional<InsufficientModelsException> ensembleFailure() {
        return Optional.ofNullable(ensembleFailure);
    }

    /**
     * @throws InsufficientModelsException if fewer than two models trained
     */
    public Ensemble requireEnsemble() {
        if (ensemble == null) {
            throw ensembleFailure;
        }
        return ensemble;
    }
}
