package io.griddedetl.era5.config;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.griddedetl.budget.Budget;
import io.griddedetl.budget.SimpleBudgetManager;
import io.griddedetl.era5.grid.GriddedFileOpener;
import io.griddedetl.era5.grid.NetcdfGriddedFile;
import io.griddedetl.era5.extract.VariableExtractor;
import io.griddedetl.era5.join.ColumnDetector;
import io.griddedetl.era5.join.ColumnMappingException;
import io.griddedetl.era5.join.CoordinateJoiner;
import io.griddedetl.era5.join.SchemaRegistry;
import io.griddedetl.era5.orchestrate.BatchOrchestrator;
import io.griddedetl.era5.orchestrate.FileDiscovery;
import io.griddedetl.era5.sort.ChronologicalSorter;

/**
 * Wires the ETL stages from an {@link EtlConfig}. The opener is bound separately so tests can
 * swap in an in-memory one.
 */
public class EtlModule extends AbstractModule {
    private final EtlConfig config;
    private final GriddedFileOpener opener;

    public EtlModule(EtlConfig config) {
        this(config, NetcdfGriddedFile::open);
    }

    public EtlModule(EtlConfig config, GriddedFileOpener opener) {
        this.config = config;
        this.opener = opener;
    }

    @Override
    protected void configure() {
        bind(EtlConfig.class).toInstance(config);
        bind(GriddedFileOpener.class).toInstance(opener);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Budget budget() { return new SimpleBudgetManager(config.cpuSlots()); }

    @Provides @Singleton SchemaRegistry schemaRegistry() throws ColumnMappingException { return SchemaRegistry.load(config.schemaRegistry()); }

    @Provides @Singleton FileDiscovery discovery() { return new FileDiscovery(config.startYear(), config.endYear()); }

    @Provides @Singleton VariableExtractor extractor(GriddedFileOpener opener) { return new VariableExtractor(opener, config.extractOptions()); }

    @Provides @Singleton CoordinateJoiner joiner(SchemaRegistry registry) { return new CoordinateJoiner(registry, new ColumnDetector(), config.joinOptions()); }

    @Provides @Singleton ChronologicalSorter sorter() { return new ChronologicalSorter(config.sortOptions()); }

    @Provides @Singleton BatchOrchestrator orchestrator(FileDiscovery discovery, VariableExtractor extractor, CoordinateJoiner joiner,
                                                         ChronologicalSorter sorter, Budget budget, MetricRegistry registry) {
        return new BatchOrchestrator(config, discovery, extractor, joiner, sorter, budget, registry);
    }
}
