package de.bsommerfeld.rentalprice.pipeline;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.rentalprice.core.config.AmenityConfig;
import de.bsommerfeld.rentalprice.core.config.GeoConfig;
import de.bsommerfeld.rentalprice.core.config.ModelConfig;
import de.bsommerfeld.rentalprice.core.config.PipelineConfig;
import de.bsommerfeld.rentalprice.core.config.PipelineConfigLoader;
import de.bsommerfeld.rentalprice.core.config.TemporalConfig;
import de.bsommerfeld.rentalprice.core.config.TrustConfig;
import de.bsommerfeld.rentalprice.core.event.PipelineEventBus;
import de.bsommerfeld.rentalprice.model.evaluation.CrossValidator;
import de.bsommerfeld.rentalprice.model.evaluation.Evaluator;
import de.bsommerfeld.rentalprice.model.regressor.RegressorFactory;
import de.bsommerfeld.rentalprice.model.training.ModelOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice module wiring the pricing pipeline. The configuration comes from an
 * explicit TOML file, a ready-made {@link PipelineConfig}, or the classpath
 * resource {@value #DEFAULT_RESOURCE}.
 */
public class PricingModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(PricingModule.class);

    public static final String DEFAULT_RESOURCE = "pricing.toml";

    private final Path configPath;
    private final PipelineConfig preset;
    private final Clock clock;

    public PricingModule() {
        this(null, null, Clock.systemDefaultZone());
    }

    public PricingModule(Path configPath) {
        this(configPath, null, Clock.systemDefaultZone());
    }

    public PricingModule(PipelineConfig config, Clock clock) {
        this(null, config, clock);
    }

    private PricingModule(Path configPath, PipelineConfig preset, Clock clock) {
        this.configPath = configPath;
        this.preset = preset;
        this.clock = clock;
    }

    @Override
    protected void configure() {
        PipelineConfig config;
        if (preset != null) {
            config = preset.validate();
        } else if (configPath != null) {
            config = PipelineConfigLoader.load(configPath);
        } else {
            config = PipelineConfigLoader.loadResource(DEFAULT_RESOURCE);
        }
        LOG.info("Pipeline configured: {} POI categories, {} regressors, parallelism {}",
                config.getGeo().getPoiCategories().size(), config.getModel().getRegressors().size(),
                config.getParallelism());

        bind(PipelineConfig.class).toInstance(config);
        bind(GeoConfig.class).toInstance(config.getGeo());
        bind(TemporalConfig.class).toInstance(config.getTemporal());
        bind(TrustConfig.class).toInstance(config.getTrust());
        bind(AmenityConfig.class).toInstance(config.getAmenity());
        bind(ModelConfig.class).toInstance(config.getModel());
        bind(Clock.class).toInstance(clock);
        bind(RegressorFactory.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    ModelOrchestrator orchestrator(PipelineConfig config, RegressorFactory factory, PipelineEventBus eventBus) {
        return new ModelOrchestrator(config.getModel(), factory, eventBus, config.getParallelism());
    }

    @Provides
    @Singleton
    Evaluator evaluator(ModelConfig config) {
        return new Evaluator(config.getPrimaryMetric());
    }

    @Provides
    @Singleton
    CrossValidator crossValidator(ModelConfig config, RegressorFactory factory) {
        return new CrossValidator(config, factory);
    }
}
