package zohomigrator.pipeline;

import zohomigrator.config.MigrationConfig;
import zohomigrator.gateway.DestinationClient;
import zohomigrator.registry.IdMappingRegistry;
import zohomigrator.source.SourceReader;

import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators shared by every stage of a run.
 */
public record StageContext(
        SourceReader source,
        DestinationClient destination,
        IdMappingRegistry registry,
        MigrationConfig config,
        PipelineOptions options,
        Clock clock
) {
    public StageContext {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(clock, "clock");
    }
}
